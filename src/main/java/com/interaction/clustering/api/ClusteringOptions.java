package com.interaction.clustering.api;

import com.interaction.clustering.core.exception.ConfigurationException;
import com.interaction.clustering.seed.SeedMode;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Options for a clustering run.
 * Every value is validated when {@link Builder#build()} runs, so a bad configuration
 * fails before any record is read.
 *
 * <p>Recognized configuration keys (see {@link #fromProperties(Map)}):
 * {@code batch_size}, {@code max_iterations}, {@code convergence_tolerance},
 * {@code duplication_threshold}, {@code seed_mode}, {@code deadline}, {@code strict},
 * {@code components_seed_max_entities}, {@code worker_threads}, {@code writer_threads},
 * {@code label_cache_size}, {@code storage_max_retries}, {@code storage_retry_backoff_ms}.</p>
 */
public class ClusteringOptions {

    private static final int DEFAULT_BATCH_SIZE = 10_000;
    private static final int DEFAULT_MAX_ITERATIONS = 10;
    private static final double DEFAULT_CONVERGENCE_TOLERANCE = 0.01;
    private static final double DEFAULT_DUPLICATION_THRESHOLD = 0.3;
    private static final long DEFAULT_COMPONENTS_SEED_MAX_ENTITIES = 1_000_000L;
    private static final int DEFAULT_WRITER_THREADS = 4;
    private static final int DEFAULT_LABEL_CACHE_SIZE = 100_000;
    private static final int DEFAULT_STORAGE_MAX_RETRIES = 3;
    private static final long DEFAULT_STORAGE_RETRY_BACKOFF_MS = 100;

    private final int batchSize;
    private final int maxIterations;
    private final double convergenceTolerance;
    private final double duplicationThreshold;
    private final SeedMode seedMode;
    private final Duration deadline;
    private final boolean strict;
    private final long componentsSeedMaxEntities;
    private final int workerThreads;
    private final int writerThreads;
    private final int labelCacheSize;
    private final int storageMaxRetries;
    private final long storageRetryBackoffMs;

    private ClusteringOptions(Builder builder) {
        this.batchSize = builder.batchSize;
        this.maxIterations = builder.maxIterations;
        this.convergenceTolerance = builder.convergenceTolerance;
        this.duplicationThreshold = builder.duplicationThreshold;
        this.seedMode = builder.seedMode;
        this.deadline = builder.deadline;
        this.strict = builder.strict;
        this.componentsSeedMaxEntities = builder.componentsSeedMaxEntities;
        this.workerThreads = builder.workerThreads;
        this.writerThreads = builder.writerThreads;
        this.labelCacheSize = builder.labelCacheSize;
        this.storageMaxRetries = builder.storageMaxRetries;
        this.storageRetryBackoffMs = builder.storageRetryBackoffMs;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public double getConvergenceTolerance() {
        return convergenceTolerance;
    }

    public double getDuplicationThreshold() {
        return duplicationThreshold;
    }

    public SeedMode getSeedMode() {
        return seedMode;
    }

    public Optional<Duration> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    public boolean isStrict() {
        return strict;
    }

    public long getComponentsSeedMaxEntities() {
        return componentsSeedMaxEntities;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public int getWriterThreads() {
        return writerThreads;
    }

    public int getLabelCacheSize() {
        return labelCacheSize;
    }

    public int getStorageMaxRetries() {
        return storageMaxRetries;
    }

    public long getStorageRetryBackoffMs() {
        return storageRetryBackoffMs;
    }

    /**
     * Creates default options.
     */
    public static ClusteringOptions defaults() {
        return builder().build();
    }

    /**
     * Builds options from configuration keys. Keys that are absent keep their defaults.
     *
     * @throws ConfigurationException for unknown keys or unparsable values
     */
    public static ClusteringOptions fromProperties(Map<String, String> properties) {
        Builder builder = builder();
        for (Map.Entry<String, String> e : properties.entrySet()) {
            String key = e.getKey().trim();
            String value = e.getValue() != null ? e.getValue().trim() : "";
            switch (key) {
                case "batch_size" -> builder.batchSize(parseInt(key, value));
                case "max_iterations" -> builder.maxIterations(parseInt(key, value));
                case "convergence_tolerance" -> builder.convergenceTolerance(parseDouble(key, value));
                case "duplication_threshold" -> builder.duplicationThreshold(parseDouble(key, value));
                case "seed_mode" -> builder.seedMode(SeedMode.fromConfig(value));
                case "deadline" -> builder.deadline(value.isEmpty() ? null : parseDuration(key, value));
                case "strict" -> builder.strict(parseBoolean(key, value));
                case "components_seed_max_entities" -> builder.componentsSeedMaxEntities(parseLong(key, value));
                case "worker_threads" -> builder.workerThreads(parseInt(key, value));
                case "writer_threads" -> builder.writerThreads(parseInt(key, value));
                case "label_cache_size" -> builder.labelCacheSize(parseInt(key, value));
                case "storage_max_retries" -> builder.storageMaxRetries(parseInt(key, value));
                case "storage_retry_backoff_ms" -> builder.storageRetryBackoffMs(parseLong(key, value));
                default -> throw new ConfigurationException("Unknown configuration key: " + key);
            }
        }
        return builder.build();
    }

    public static ClusteringOptions fromProperties(Properties properties) {
        Map<String, String> map = new HashMap<>();
        for (String name : properties.stringPropertyNames()) {
            map.put(name, properties.getProperty(name));
        }
        return fromProperties(map);
    }

    /**
     * Loads options from a {@code .properties} file.
     */
    public static ClusteringOptions load(Path path) {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + path, e);
        }
        return fromProperties(properties);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private double convergenceTolerance = DEFAULT_CONVERGENCE_TOLERANCE;
        private double duplicationThreshold = DEFAULT_DUPLICATION_THRESHOLD;
        private SeedMode seedMode = SeedMode.AUTO;
        private Duration deadline;
        private boolean strict = false;
        private long componentsSeedMaxEntities = DEFAULT_COMPONENTS_SEED_MAX_ENTITIES;
        private int workerThreads = Runtime.getRuntime().availableProcessors();
        private int writerThreads = DEFAULT_WRITER_THREADS;
        private int labelCacheSize = DEFAULT_LABEL_CACHE_SIZE;
        private int storageMaxRetries = DEFAULT_STORAGE_MAX_RETRIES;
        private long storageRetryBackoffMs = DEFAULT_STORAGE_RETRY_BACKOFF_MS;

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder convergenceTolerance(double convergenceTolerance) {
            this.convergenceTolerance = convergenceTolerance;
            return this;
        }

        public Builder duplicationThreshold(double duplicationThreshold) {
            this.duplicationThreshold = duplicationThreshold;
            return this;
        }

        public Builder seedMode(SeedMode seedMode) {
            this.seedMode = seedMode;
            return this;
        }

        public Builder deadline(Duration deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder componentsSeedMaxEntities(long componentsSeedMaxEntities) {
            this.componentsSeedMaxEntities = componentsSeedMaxEntities;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder writerThreads(int writerThreads) {
            this.writerThreads = writerThreads;
            return this;
        }

        public Builder labelCacheSize(int labelCacheSize) {
            this.labelCacheSize = labelCacheSize;
            return this;
        }

        public Builder storageMaxRetries(int storageMaxRetries) {
            this.storageMaxRetries = storageMaxRetries;
            return this;
        }

        public Builder storageRetryBackoffMs(long storageRetryBackoffMs) {
            this.storageRetryBackoffMs = storageRetryBackoffMs;
            return this;
        }

        public ClusteringOptions build() {
            requirePositive(batchSize, "batch_size");
            requirePositive(maxIterations, "max_iterations");
            validateRatio(convergenceTolerance, "convergence_tolerance");
            validateRatio(duplicationThreshold, "duplication_threshold");
            if (duplicationThreshold == 0.0) {
                throw new ConfigurationException("duplication_threshold must be greater than 0.0");
            }
            if (seedMode == null) {
                throw new ConfigurationException("seed_mode is required");
            }
            if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
                throw new ConfigurationException("deadline must be a positive duration");
            }
            if (componentsSeedMaxEntities < 0) {
                throw new ConfigurationException("components_seed_max_entities must be >= 0");
            }
            requirePositive(workerThreads, "worker_threads");
            requirePositive(writerThreads, "writer_threads");
            if (labelCacheSize < 0) {
                throw new ConfigurationException("label_cache_size must be >= 0");
            }
            if (storageMaxRetries < 0) {
                throw new ConfigurationException("storage_max_retries must be >= 0");
            }
            if (storageRetryBackoffMs <= 0) {
                throw new ConfigurationException("storage_retry_backoff_ms must be positive");
            }
            return new ClusteringOptions(this);
        }

        private void requirePositive(long value, String name) {
            if (value <= 0) {
                throw new ConfigurationException(name + " must be positive but was " + value);
            }
        }

        private void validateRatio(double value, String name) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new ConfigurationException(name + " must be between 0.0 and 1.0 but was " + value);
            }
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.replace("_", ""));
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not an integer: '" + value + "'", e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.replace("_", ""));
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not an integer: '" + value + "'", e);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not a number: '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new ConfigurationException(key + " must be true or false but was '" + value + "'");
    }

    private static Duration parseDuration(String key, String value) {
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(key + " must be an ISO-8601 duration (e.g. PT30M): '" + value + "'", e);
        }
    }

    @Override
    public String toString() {
        return "ClusteringOptions{" +
                "batchSize=" + batchSize +
                ", maxIterations=" + maxIterations +
                ", convergenceTolerance=" + convergenceTolerance +
                ", duplicationThreshold=" + duplicationThreshold +
                ", seedMode=" + seedMode +
                ", deadline=" + deadline +
                ", strict=" + strict +
                ", componentsSeedMaxEntities=" + componentsSeedMaxEntities +
                ", workerThreads=" + workerThreads +
                ", writerThreads=" + writerThreads +
                ", labelCacheSize=" + labelCacheSize +
                ", storageMaxRetries=" + storageMaxRetries +
                ", storageRetryBackoffMs=" + storageRetryBackoffMs +
                '}';
    }
}
