package com.apisentinel.flink;

import com.apisentinel.core.config.Durations;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Deployment settings of the API Sentinel Flink job: where records come from,
 * where alerts go, and how the job checkpoints and tracks event time.
 *
 * <p>
 * Detection tuning is not here; it lives in the sentinel YAML, whose path is
 * one of these settings.
 * </p>
 *
 * <h3>Environment</h3>
 * <table>
 * <caption>Variables read by {@link #fromEnvironment()}</caption>
 * <tr><th>Variable</th><th>Default</th></tr>
 * <tr><td>{@code KAFKA_BOOTSTRAP_SERVERS}</td><td>{@code localhost:9092}</td></tr>
 * <tr><td>{@code KAFKA_INPUT_TOPIC}</td><td>{@code api-requests}</td></tr>
 * <tr><td>{@code KAFKA_ALERT_TOPIC}</td><td>{@code api-alerts}</td></tr>
 * <tr><td>{@code KAFKA_GROUP_ID}</td><td>{@code api-sentinel}</td></tr>
 * <tr><td>{@code KAFKA_STARTING_OFFSETS}</td><td>{@code committed}</td></tr>
 * <tr><td>{@code FLINK_PARALLELISM}</td><td>{@code 1}</td></tr>
 * <tr><td>{@code FLINK_CHECKPOINT_INTERVAL}</td><td>{@code 1m}</td></tr>
 * <tr><td>{@code MAX_OUT_OF_ORDERNESS}</td><td>{@code 5s}</td></tr>
 * <tr><td>{@code SOURCE_IDLENESS}</td><td>{@code 1m}</td></tr>
 * <tr><td>{@code SENTINEL_CONFIG_PATH}</td><td>bundled {@code sentinel.yml}</td></tr>
 * </table>
 *
 * <p>
 * Durations use the sentinel notation ({@code 500ms}, {@code 30s}, {@code 1m}).
 * {@link Builder#build()} reports every invalid value in one exception.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Where the Kafka source starts when the job has no restored state. */
    public enum StartingOffsets {
        EARLIEST,
        LATEST,
        /** Committed offsets of the group, earliest when the group has none. */
        COMMITTED;

        static StartingOffsets parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown starting offsets '" + value
                        + "'. Supported: earliest, latest, committed", e);
            }
        }

        OffsetsInitializer toInitializer() {
            return switch (this) {
                case EARLIEST -> OffsetsInitializer.earliest();
                case LATEST -> OffsetsInitializer.latest();
                case COMMITTED -> OffsetsInitializer.committedOffsets(OffsetResetStrategy.EARLIEST);
            };
        }
    }

    private final String kafkaBootstrapServers;
    private final String kafkaInputTopic;
    private final String kafkaAlertTopic;
    private final String kafkaGroupId;
    private final StartingOffsets startingOffsets;

    private final int parallelism;
    private final Duration checkpointInterval;
    private final Duration maxOutOfOrderness;
    private final Duration sourceIdleness;

    private final String sentinelConfigPath;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaInputTopic = b.kafkaInputTopic;
        this.kafkaAlertTopic = b.kafkaAlertTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.startingOffsets = b.startingOffsets;
        this.parallelism = b.parallelism;
        this.checkpointInterval = b.checkpointInterval;
        this.maxOutOfOrderness = b.maxOutOfOrderness;
        this.sourceIdleness = b.sourceIdleness;
        this.sentinelConfigPath = b.sentinelConfigPath;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return settings from the process environment
     * @throws IllegalArgumentException if a variable holds an invalid value
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * @param lookup variable name to value, {@code null} when unset
     * @return settings resolved through {@code lookup}; unset or blank
     *         variables keep their defaults
     * @throws IllegalArgumentException if a variable holds an invalid value
     */
    public static JobConfig fromEnvironment(UnaryOperator<String> lookup) {
        Objects.requireNonNull(lookup, "lookup must not be null");
        Builder b = builder();
        List<String> problems = new ArrayList<>();

        ifSet(lookup, "KAFKA_BOOTSTRAP_SERVERS", b::kafkaBootstrapServers);
        ifSet(lookup, "KAFKA_INPUT_TOPIC", b::kafkaInputTopic);
        ifSet(lookup, "KAFKA_ALERT_TOPIC", b::kafkaAlertTopic);
        ifSet(lookup, "KAFKA_GROUP_ID", b::kafkaGroupId);
        ifSet(lookup, "SENTINEL_CONFIG_PATH", b::sentinelConfigPath);
        parse(lookup, "KAFKA_STARTING_OFFSETS", problems, v -> b.startingOffsets(StartingOffsets.parse(v)));
        parse(lookup, "FLINK_PARALLELISM", problems, v -> b.parallelism(Integer.parseInt(v.trim())));
        parse(lookup, "FLINK_CHECKPOINT_INTERVAL", problems, v -> b.checkpointInterval(Durations.parse(v)));
        parse(lookup, "MAX_OUT_OF_ORDERNESS", problems, v -> b.maxOutOfOrderness(Durations.parse(v)));
        parse(lookup, "SOURCE_IDLENESS", problems, v -> b.sourceIdleness(Durations.parse(v)));

        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid job environment: " + String.join("; ", problems));
        }
        return b.build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public StartingOffsets getStartingOffsets() {
        return startingOffsets;
    }

    public int getParallelism() {
        return parallelism;
    }

    public Duration getCheckpointInterval() {
        return checkpointInterval;
    }

    /** @return how far behind the newest record timestamp the watermark trails */
    public Duration getMaxOutOfOrderness() {
        return maxOutOfOrderness;
    }

    /** @return silence after which a source split stops holding back the watermark */
    public Duration getSourceIdleness() {
        return sourceIdleness;
    }

    /** @return path of the sentinel YAML, blank for the bundled default */
    public String getSentinelConfigPath() {
        return sentinelConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaInputTopic = "api-requests";
        private String kafkaAlertTopic = "api-alerts";
        private String kafkaGroupId = "api-sentinel";
        private StartingOffsets startingOffsets = StartingOffsets.COMMITTED;
        private int parallelism = 1;
        private Duration checkpointInterval = Duration.ofMinutes(1);
        private Duration maxOutOfOrderness = Duration.ofSeconds(5);
        private Duration sourceIdleness = Duration.ofMinutes(1);
        private String sentinelConfigPath = "";

        public Builder kafkaBootstrapServers(String kafkaBootstrapServers) {
            this.kafkaBootstrapServers = kafkaBootstrapServers;
            return this;
        }

        public Builder kafkaInputTopic(String kafkaInputTopic) {
            this.kafkaInputTopic = kafkaInputTopic;
            return this;
        }

        public Builder kafkaAlertTopic(String kafkaAlertTopic) {
            this.kafkaAlertTopic = kafkaAlertTopic;
            return this;
        }

        public Builder kafkaGroupId(String kafkaGroupId) {
            this.kafkaGroupId = kafkaGroupId;
            return this;
        }

        public Builder startingOffsets(StartingOffsets startingOffsets) {
            this.startingOffsets = startingOffsets;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder checkpointInterval(Duration checkpointInterval) {
            this.checkpointInterval = checkpointInterval;
            return this;
        }

        public Builder maxOutOfOrderness(Duration maxOutOfOrderness) {
            this.maxOutOfOrderness = maxOutOfOrderness;
            return this;
        }

        public Builder sourceIdleness(Duration sourceIdleness) {
            this.sourceIdleness = sourceIdleness;
            return this;
        }

        public Builder sentinelConfigPath(String sentinelConfigPath) {
            this.sentinelConfigPath = sentinelConfigPath;
            return this;
        }

        /**
         * @return validated settings
         * @throws IllegalArgumentException listing every invalid value
         */
        public JobConfig build() {
            List<String> problems = new ArrayList<>();
            requireText(kafkaBootstrapServers, "kafkaBootstrapServers", problems);
            requireText(kafkaInputTopic, "kafkaInputTopic", problems);
            requireText(kafkaAlertTopic, "kafkaAlertTopic", problems);
            requireText(kafkaGroupId, "kafkaGroupId", problems);
            if (kafkaInputTopic != null && kafkaInputTopic.equals(kafkaAlertTopic)) {
                problems.add("kafkaAlertTopic must differ from kafkaInputTopic, both are '" + kafkaInputTopic + "'");
            }
            if (startingOffsets == null) {
                problems.add("startingOffsets must not be null");
            }
            if (parallelism < 1) {
                problems.add("parallelism must be >= 1, got: " + parallelism);
            }
            requirePositive(checkpointInterval, "checkpointInterval", problems);
            requirePositive(sourceIdleness, "sourceIdleness", problems);
            if (maxOutOfOrderness == null || maxOutOfOrderness.isNegative()) {
                problems.add("maxOutOfOrderness must be >= 0, got: " + maxOutOfOrderness);
            }
            if (sentinelConfigPath == null) {
                problems.add("sentinelConfigPath must not be null; use \"\" for the bundled default");
            }
            if (!problems.isEmpty()) {
                throw new IllegalArgumentException("Invalid job configuration: " + String.join("; ", problems));
            }
            return new JobConfig(this);
        }

        private static void requireText(String value, String name, List<String> problems) {
            if (value == null || value.isBlank()) {
                problems.add(name + " must not be blank");
            }
        }

        private static void requirePositive(Duration value, String name, List<String> problems) {
            if (value == null || value.isZero() || value.isNegative()) {
                problems.add(name + " must be > 0, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private interface Setter {
        void apply(String value);
    }

    private static void ifSet(UnaryOperator<String> lookup, String name, Setter setter) {
        String value = lookup.apply(name);
        if (value != null && !value.isBlank()) {
            setter.apply(value.trim());
        }
    }

    private static void parse(UnaryOperator<String> lookup, String name, List<String> problems, Setter setter) {
        try {
            ifSet(lookup, name, setter);
        } catch (IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException
            problems.add(name + ": " + e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "JobConfig{"
                + "kafka=" + kafkaBootstrapServers
                + ", " + kafkaInputTopic + " -> " + kafkaAlertTopic
                + ", group=" + kafkaGroupId
                + ", startingOffsets=" + startingOffsets
                + ", parallelism=" + parallelism
                + ", checkpointInterval=" + Durations.format(checkpointInterval)
                + ", maxOutOfOrderness=" + Durations.format(maxOutOfOrderness)
                + ", sourceIdleness=" + Durations.format(sourceIdleness)
                + ", sentinelConfigPath='" + sentinelConfigPath + '\''
                + '}';
    }
}
