package io.clusterengine.config;

import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static io.clusterengine.config.Constants.*;

/**
 * Configuration for the cluster engine.
 * Loads configuration from application.yml with fallbacks to constants.
 */
@Slf4j
@Getter
public class EngineConfig {

    private final String engineId;
    private final int workerCount;
    private final String storeBackend;
    private final String[] etcdEndpoints;
    private final int lockMaxRetries;
    private final long lockRetryBaseMillis;
    private final long lockRetryMaxMillis;
    private final long drainTimeoutSeconds;
    private final long actionRetentionMinutes;
    private final long purgeIntervalSeconds;
    private final Map<String, String> policyTypeAliases;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "ENGINE_CONFIG_FILE";

    public EngineConfig() {
        this(null);
    }

    /**
     * Builds the configuration from an already parsed model. A null model means
     * "load from the environment/classpath".
     */
    public EngineConfig(ConfigModel model) {
        ConfigModel config = model != null ? model : loadYamlConfig();

        this.engineId = parseEngineId(config);
        this.workerCount = parseWorkerCount(config);
        this.storeBackend = parseStoreBackend(config);
        this.etcdEndpoints = parseEndpoints(config);
        this.lockMaxRetries = parseLockMaxRetries(config);
        this.lockRetryBaseMillis = parsePositiveLong(
                config.getDispatcher() != null ? config.getDispatcher().getLock_retry_base_millis() : null,
                DEFAULT_LOCK_RETRY_BASE_MILLIS, "lock_retry_base_millis");
        this.lockRetryMaxMillis = parsePositiveLong(
                config.getDispatcher() != null ? config.getDispatcher().getLock_retry_max_millis() : null,
                DEFAULT_LOCK_RETRY_MAX_MILLIS, "lock_retry_max_millis");
        this.drainTimeoutSeconds = parsePositiveLong(
                config.getDispatcher() != null ? config.getDispatcher().getDrain_timeout_seconds() : null,
                DEFAULT_DRAIN_TIMEOUT_SECONDS, "drain_timeout_seconds");
        this.actionRetentionMinutes = parsePositiveLong(
                config.getDispatcher() != null ? config.getDispatcher().getAction_retention_minutes() : null,
                DEFAULT_ACTION_RETENTION_MINUTES, "action_retention_minutes");
        this.purgeIntervalSeconds = parsePositiveLong(
                config.getDispatcher() != null ? config.getDispatcher().getPurge_interval_seconds() : null,
                DEFAULT_PURGE_INTERVAL_SECONDS, "purge_interval_seconds");
        this.policyTypeAliases = parsePolicyTypeAliases(config);

        log.info("Loaded cluster engine config - id: {}, workers: {}, store: {}, lock retries: {}",
                engineId, workerCount, storeBackend, lockMaxRetries);
    }

    /**
     * Parses a YAML document into a configuration model.
     */
    public static ConfigModel parse(InputStream inputStream) {
        Constructor constructor = new Constructor(ConfigModel.class, new LoaderOptions());
        // application.yml is shared with Spring Boot, whose keys are not part of the model
        constructor.getPropertyUtils().setSkipMissingProperties(true);
        Yaml yaml = new Yaml(constructor);
        ConfigModel config = yaml.load(inputStream);
        return config != null ? config : new ConfigModel();
    }

    private ConfigModel loadYamlConfig() {
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check environment variable for external config file path
        String externalConfigPath = System.getenv(EXTERNAL_CONFIG_ENV_VAR);
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", EXTERNAL_CONFIG_ENV_VAR);
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            log.info("Loading config from classpath: {}", DEFAULT_CONFIG_FILE_CLASSPATH);
            inputStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream
        try {
            ConfigModel config = parse(inputStream);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config;
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        } finally {
            try {
                inputStream.close();
            } catch (IOException e) {
                log.error("Error closing config file input stream: {}", e.getMessage());
            }
        }
    }

    private String parseEngineId(ConfigModel config) {
        if (config.getEngine() != null && config.getEngine().getId() != null
                && !config.getEngine().getId().isBlank()) {
            return config.getEngine().getId();
        }
        return DEFAULT_ENGINE_ID;
    }

    private int parseWorkerCount(ConfigModel config) {
        if (config.getEngine() != null && config.getEngine().getWorkers() != null) {
            int workers = config.getEngine().getWorkers();
            if (workers > 0) {
                return workers;
            }
            log.warn("Ignoring non-positive worker count {}, using default {}", workers, DEFAULT_WORKER_COUNT);
        }
        return DEFAULT_WORKER_COUNT;
    }

    private String parseStoreBackend(ConfigModel config) {
        if (config.getStore() != null && config.getStore().getBackend() != null) {
            String backend = config.getStore().getBackend().trim().toLowerCase();
            if (STORE_BACKEND_MEMORY.equals(backend) || STORE_BACKEND_ETCD.equals(backend)) {
                return backend;
            }
            log.warn("Unknown store backend '{}', using '{}'", backend, STORE_BACKEND_MEMORY);
        }
        return STORE_BACKEND_MEMORY;
    }

    private String[] parseEndpoints(ConfigModel config) {
        try {
            if (config.getEtcd() != null && config.getEtcd().getEndpoints() != null) {
                var endpoints = config.getEtcd().getEndpoints();
                if (!endpoints.isEmpty()) {
                    return endpoints.toArray(new String[0]);
                }
            }
        } catch (Exception e) {
            log.warn("Failed to parse etcd endpoints from config, using defaults: {}", e.getMessage());
        }

        return new String[]{DEFAULT_ETCD_ENDPOINT};
    }

    private int parseLockMaxRetries(ConfigModel config) {
        if (config.getDispatcher() != null && config.getDispatcher().getLock_max_retries() != null) {
            int retries = config.getDispatcher().getLock_max_retries();
            if (retries >= 0) {
                return retries;
            }
        }
        return DEFAULT_LOCK_MAX_RETRIES;
    }

    private long parsePositiveLong(Long value, long defaultValue, String name) {
        if (value == null) {
            return defaultValue;
        }
        if (value <= 0) {
            log.warn("Ignoring non-positive value {} for {}, using default {}", value, name, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private Map<String, String> parsePolicyTypeAliases(ConfigModel config) {
        if (config.getPolicies() != null && config.getPolicies().getAliases() != null) {
            return Collections.unmodifiableMap(config.getPolicies().getAliases());
        }
        return Collections.emptyMap();
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Engine engine;
        private Store store;
        private Etcd etcd;
        private Dispatcher dispatcher;
        private Policies policies;
    }

    @Data
    public static class Engine {
        private String id;
        private Integer workers;
    }

    @Data
    public static class Store {
        private String backend;
    }

    @Data
    public static class Etcd {
        private List<String> endpoints;
    }

    @Data
    public static class Dispatcher {
        private Integer lock_max_retries;
        private Long lock_retry_base_millis;
        private Long lock_retry_max_millis;
        private Long drain_timeout_seconds;
        private Long action_retention_minutes;
        private Long purge_interval_seconds;
    }

    @Data
    public static class Policies {
        private Map<String, String> aliases;
    }
}
