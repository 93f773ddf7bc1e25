package io.sqsoffline.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.sqsoffline.SqsOffline;
import io.sqsoffline.micrometer.MicrometerMetricsExporter;
import io.sqsoffline.spi.MetricsExporter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqsOfflineMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SqsOfflineMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerExporterByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("sqs-offline.metrics.name-prefix=local.sqs").run(ctx -> {
            var exporter = ctx.getBean(MicrometerMetricsExporter.class);
            exporter.incrementHandlerSuccess("orders");
            var registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("local.sqs.handler.success").tag("queue", "orders").counter());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("sqs-offline.metrics.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("micrometerMetricsExporter"));
        });
    }

    @Test
    void backsOffWithoutMeterRegistry() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(SqsOfflineMicrometerAutoConfiguration.class))
                .run(ctx -> {
                    assertFalse(ctx.containsBean("micrometerMetricsExporter"));
                });
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
            var exporter = ctx.getBean(MetricsExporter.class);
            assertFalse(exporter instanceof MicrometerMetricsExporter);
        });
    }

    @Test
    void exporterIsWiredIntoEmulator() {
        runner.withConfiguration(AutoConfigurations.of(SqsOfflineAutoConfiguration.class))
                .withPropertyValues("sqs-offline.wait-time-seconds=0")
                .run(ctx -> {
                    assertTrue(ctx.containsBean("sqsOffline"));
                    assertNotNull(ctx.getBean(SqsOffline.class));
                    assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
                });
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customMetricsExporter() {
            return MetricsExporter.NOOP;
        }
    }
}
