package io.downloader4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.downloader4j.JobStore;
import io.downloader4j.Notifier;
import io.downloader4j.internal.CallbackNotifier;
import io.downloader4j.internal.mongo.MongoJobStore;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Spring Boot auto-configuration entrypoint for the callback notifier.
 */
@AutoConfiguration
@ConditionalOnClass({Notifier.class, MongoTemplate.class})
@EnableConfigurationProperties(DownloaderProperties.class)
@ConditionalOnProperty(prefix = "downloader", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DownloaderConfig {

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate) {
        return new MongoJobStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected DownloaderMongoIndexConfig downloaderMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new DownloaderMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public Notifier notifier(DownloaderProperties props, JobStore jobStore, ObjectMapper om) {
        return new CallbackNotifier(props.toNotifierOptions(), jobStore, om);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotifierLifecycle notifierLifecycle(Notifier notifier) {
        return new NotifierLifecycle(notifier);
    }

    @Bean
    @ConditionalOnProperty(prefix = "downloader", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton downloaderIndexesInitializer(DownloaderMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
