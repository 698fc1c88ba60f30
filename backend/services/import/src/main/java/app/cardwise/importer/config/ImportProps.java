package app.cardwise.importer.config;

import app.cardwise.importer.domain.ImportMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param batchSize   rows read per batch and, in streaming mode, per progress event
 * @param defaultMode mode used by the command line runner when none is given
 */
@ConfigurationProperties(prefix = "app.import")
public record ImportProps(
        Integer batchSize,
        ImportMode defaultMode
) {
    public ImportProps {
        if (batchSize == null) {
            batchSize = 200;
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("app.import.batch-size must be positive");
        }
        if (defaultMode == null) {
            defaultMode = ImportMode.FRESH;
        }
    }

    public static ImportProps defaults() {
        return new ImportProps(null, null);
    }
}
