package io.dispatch4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dispatch4j.CallbackSender;
import io.dispatch4j.core.CronStore;
import io.dispatch4j.core.JobStore;
import io.dispatch4j.cron.CronEngine;
import io.dispatch4j.internal.http.OkHttpCallbackSender;
import io.dispatch4j.internal.mongo.MongoCronStore;
import io.dispatch4j.internal.mongo.MongoJobStore;
import io.dispatch4j.scheduler.OneShotScheduler;
import io.dispatch4j.worker.WorkerGroup;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;

/**
 * Wires stores, the callback sender and both scheduling workers.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(DispatchProperties.class)
public class DispatchConfig {

    @Bean
    public JobStore jobStore(MongoTemplate mongoTemplate) {
        return new MongoJobStore(mongoTemplate);
    }

    @Bean
    public CronStore cronStore(MongoTemplate mongoTemplate) {
        return new MongoCronStore(mongoTemplate);
    }

    @Bean
    public DispatchMongoIndexConfig dispatchMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new DispatchMongoIndexConfig(mongoTemplate);
    }

    @Bean(destroyMethod = "close")
    public OkHttpCallbackSender callbackSender(DispatchProperties props) {
        String endpoint = requireText(props.getEndpoint(), "dispatch.endpoint");
        String secret = requireText(props.getSecret(), "dispatch.secret");
        if (!endpoint.startsWith("http://") && !endpoint.startsWith("https://")) {
            throw new IllegalStateException("dispatch.endpoint must be an http(s) URL: " + endpoint);
        }
        return new OkHttpCallbackSender(endpoint, secret, props.getCallbackTimeout());
    }

    @Bean
    public OneShotScheduler oneShotScheduler(JobStore jobStore, CallbackSender sender) {
        return new OneShotScheduler(jobStore, sender);
    }

    @Bean
    public CronEngine cronEngine(CronStore cronStore, CallbackSender sender, ObjectMapper objectMapper,
                                 DispatchProperties props) {
        return new CronEngine(cronStore, sender, objectMapper, cronZone(props), props.getCronThreads());
    }

    @Bean
    public WorkerGroup workerGroup(OneShotScheduler scheduler, CronEngine cronEngine, DispatchProperties props,
                                   ApplicationContext context) {
        return new WorkerGroup(List.of(scheduler, cronEngine), props.getShutdownTimeout(),
                DispatchLifecycle.exitOnFailure(context));
    }

    @Bean
    public DispatchLifecycle dispatchLifecycle(WorkerGroup workerGroup) {
        return new DispatchLifecycle(workerGroup);
    }

    @Bean
    @ConditionalOnProperty(prefix = "dispatch", name = "ensure-indexes-on-startup", havingValue = "true", matchIfMissing = true)
    public SmartInitializingSingleton dispatchIndexesInitializer(DispatchMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }

    private static ZoneId cronZone(DispatchProperties props) {
        String tz = props.getCronTimezone();
        if (tz == null || tz.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(tz.trim());
        } catch (DateTimeException e) {
            throw new IllegalStateException("dispatch.cron-timezone is not a valid zone: " + tz, e);
        }
    }

    private static String requireText(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(property + " must be set");
        }
        return value.trim();
    }
}
