package io.clusterengine;

import io.clusterengine.config.EngineConfig;
import io.clusterengine.driver.Driver;
import io.clusterengine.driver.SimulatedDriver;
import io.clusterengine.notification.AsyncNotificationSink;
import io.clusterengine.notification.LoggingNotificationSink;
import io.clusterengine.notification.NotificationSink;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Spring Boot entry point that wires a cluster engine from application.yml.
 *
 * Without a cloud driver on the classpath the engine runs against the simulated driver.
 */
@Slf4j
@SpringBootApplication
public class ClusterEngineApplication {

    public static void main(String[] args) {
        log.info("Starting Cluster Engine Application");

        try {
            SpringApplication.run(ClusterEngineApplication.class, args);
            log.info("Cluster Engine started successfully");
        } catch (Exception e) {
            log.error("Failed to start Cluster Engine: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public EngineConfig engineConfig() {
        EngineConfig config = new EngineConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public Driver driver() {
        log.info("Initializing simulated driver");
        return new SimulatedDriver();
    }

    @Bean
    public NotificationSink notificationSink() {
        return new AsyncNotificationSink(new LoggingNotificationSink());
    }

    /**
     * The engine is started here and shut down through its @PreDestroy hook.
     */
    @Bean
    public ClusterEngine clusterEngine(EngineConfig config, Driver driver, NotificationSink notificationSink,
                                       MeterRegistry meterRegistry) {
        log.info("Initializing ClusterEngine with {} store", config.getStoreBackend());
        ClusterEngine engine = ClusterEngine.create(config, driver, notificationSink, meterRegistry);
        engine.start();
        return engine;
    }
}
