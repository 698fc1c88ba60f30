package app.cardwise.core.media.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "app.media")
public record MediaProps(
        Path dir
) {
    public MediaProps {
        if (dir == null) {
            dir = Path.of(System.getProperty("java.io.tmpdir"), "cardwise-media");
        }
    }
}
