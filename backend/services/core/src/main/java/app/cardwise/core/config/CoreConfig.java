package app.cardwise.core.config;

import app.cardwise.core.media.config.MediaProps;
import app.cardwise.core.media.storage.LocalMediaStorage;
import app.cardwise.core.media.storage.MediaStorage;
import app.cardwise.core.persistence.JsonFileStorePersistence;
import app.cardwise.core.persistence.StorePersistence;
import app.cardwise.core.store.EntityStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.random.RandomGenerator;

@Configuration
@EnableConfigurationProperties({SchedulerProps.class, MediaProps.class})
public class CoreConfig {

    private static final Logger log = LoggerFactory.getLogger(CoreConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public RandomGenerator randomGenerator() {
        return RandomGenerator.getDefault();
    }

    @Bean
    @ConditionalOnMissingBean
    public StorePersistence storePersistence(ObjectMapper objectMapper,
                                             @Value("${app.store.file:${java.io.tmpdir}/cardwise/collection.json}") String file) {
        return new JsonFileStorePersistence(objectMapper, Path.of(file));
    }

    @Bean
    @ConditionalOnMissingBean
    public EntityStore entityStore(StorePersistence persistence,
                                   Clock clock,
                                   @Value("${app.store.load-on-startup:true}") boolean loadOnStartup) {
        if (loadOnStartup) {
            var snapshot = persistence.load();
            if (snapshot.isPresent()) {
                log.info("Loaded store notes={} cards={}", snapshot.get().notes().size(), snapshot.get().cards().size());
                return EntityStore.fromSnapshot(snapshot.get());
            }
        }
        return new EntityStore(clock.instant().getEpochSecond());
    }

    @Bean
    @ConditionalOnMissingBean
    public MediaStorage mediaStorage(MediaProps props) {
        return new LocalMediaStorage(props.dir());
    }
}
