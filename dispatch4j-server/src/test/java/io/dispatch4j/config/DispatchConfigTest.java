package io.dispatch4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dispatch4j.CallbackSender;
import io.dispatch4j.core.CronStore;
import io.dispatch4j.core.JobStore;
import io.dispatch4j.cron.CronEngine;
import io.dispatch4j.internal.mongo.JobDocument;
import io.dispatch4j.scheduler.OneShotScheduler;
import io.dispatch4j.worker.WorkerGroup;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexOperations;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DispatchConfigTest {

    private final IndexOperations indexOps = mock(IndexOperations.class);

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(DispatchConfig.class)
            .withBean(MongoTemplate.class, () -> {
                MongoTemplate template = mock(MongoTemplate.class);
                when(template.indexOps(JobDocument.class)).thenReturn(indexOps);
                return template;
            })
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withPropertyValues(
                    "dispatch.endpoint=http://localhost:9999/hook",
                    "dispatch.secret=s3cret",
                    "dispatch.cron-threads=2",
                    "dispatch.cron-timezone=UTC",
                    "dispatch.shutdown-timeout=2s"
            );

    @Test
    void shouldWireDispatcherBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(JobStore.class);
            assertThat(context).hasSingleBean(CronStore.class);
            assertThat(context).hasSingleBean(CallbackSender.class);
            assertThat(context).hasSingleBean(OneShotScheduler.class);
            assertThat(context).hasSingleBean(CronEngine.class);
            assertThat(context).hasSingleBean(WorkerGroup.class);
            assertThat(context).hasSingleBean(DispatchLifecycle.class);
            assertThat(context.getBean(DispatchLifecycle.class).isRunning()).isTrue();

            DispatchProperties props = context.getBean(DispatchProperties.class);
            assertThat(props.getCronThreads()).isEqualTo(2);
            assertThat(props.getCallbackTimeout()).hasSeconds(10);
        });
    }

    @Test
    void shouldEnsureIndexesOnStartupByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(SmartInitializingSingleton.class);
            verify(indexOps).ensureIndex(any());
        });
    }

    @Test
    void shouldSkipIndexesWhenDisabled() {
        contextRunner
                .withPropertyValues("dispatch.ensure-indexes-on-startup=false")
                .run(context -> assertThat(context).doesNotHaveBean(SmartInitializingSingleton.class));
    }

    @Test
    void shouldFailFastWithoutSecret() {
        contextRunner
                .withPropertyValues("dispatch.secret=")
                .run(context -> assertThat(context).hasFailed()
                        .getFailure().hasRootCauseMessage("dispatch.secret must be set"));
    }

    @Test
    void shouldFailFastOnNonHttpEndpoint() {
        contextRunner
                .withPropertyValues("dispatch.endpoint=ftp://example.com/hook")
                .run(context -> assertThat(context).hasFailed()
                        .getFailure().rootCause().hasMessageContaining("http(s) URL"));
    }

    @Test
    void shouldFailFastOnUnknownTimezone() {
        contextRunner
                .withPropertyValues("dispatch.cron-timezone=Mars/Olympus")
                .run(context -> assertThat(context).hasFailed());
    }
}
