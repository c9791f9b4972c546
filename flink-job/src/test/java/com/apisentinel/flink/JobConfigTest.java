package com.apisentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Unit tests for {@link JobConfig}. */
class JobConfigTest {

    @Test
    @DisplayName("Should fall back to defaults when nothing is set")
    void shouldUseDefaults() {
        JobConfig config = JobConfig.fromEnvironment(name -> null);

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getKafkaInputTopic()).isEqualTo("api-requests");
        assertThat(config.getKafkaAlertTopic()).isEqualTo("api-alerts");
        assertThat(config.getStartingOffsets()).isEqualTo(JobConfig.StartingOffsets.COMMITTED);
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getCheckpointInterval()).isEqualTo(Duration.ofMinutes(1));
        assertThat(config.getMaxOutOfOrderness()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getSourceIdleness()).isEqualTo(Duration.ofMinutes(1));
        assertThat(config.getSentinelConfigPath()).isEmpty();
    }

    @Test
    @DisplayName("Should read durations and offsets from the environment")
    void shouldReadEnvironment() {
        Map<String, String> env = Map.of(
                "KAFKA_BOOTSTRAP_SERVERS", "kafka:29092",
                "KAFKA_GROUP_ID", "sentinel-eu",
                "KAFKA_STARTING_OFFSETS", " Latest ",
                "FLINK_PARALLELISM", "4",
                "FLINK_CHECKPOINT_INTERVAL", "30s",
                "MAX_OUT_OF_ORDERNESS", "0ms",
                "SOURCE_IDLENESS", "2m",
                "SENTINEL_CONFIG_PATH", "/etc/sentinel/sentinel.yml",
                "KAFKA_ALERT_TOPIC", "  ");

        JobConfig config = JobConfig.fromEnvironment(env::get);

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("kafka:29092");
        assertThat(config.getKafkaGroupId()).isEqualTo("sentinel-eu");
        assertThat(config.getKafkaAlertTopic()).isEqualTo("api-alerts");
        assertThat(config.getStartingOffsets()).isEqualTo(JobConfig.StartingOffsets.LATEST);
        assertThat(config.getParallelism()).isEqualTo(4);
        assertThat(config.getCheckpointInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getMaxOutOfOrderness()).isZero();
        assertThat(config.getSourceIdleness()).isEqualTo(Duration.ofMinutes(2));
        assertThat(config.getSentinelConfigPath()).isEqualTo("/etc/sentinel/sentinel.yml");
        assertThat(config.toString()).contains("sentinel-eu", "checkpointInterval=30s");
    }

    @Test
    @DisplayName("Should report every unparsable variable at once")
    void shouldCollectEnvironmentProblems() {
        Map<String, String> env = Map.of(
                "FLINK_PARALLELISM", "four",
                "FLINK_CHECKPOINT_INTERVAL", "1 minute",
                "KAFKA_STARTING_OFFSETS", "newest");

        assertThatThrownBy(() -> JobConfig.fromEnvironment(env::get))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("FLINK_PARALLELISM")
                .hasMessageContaining("FLINK_CHECKPOINT_INTERVAL")
                .hasMessageContaining("KAFKA_STARTING_OFFSETS");
    }

    @Test
    @DisplayName("Should report every invalid builder value at once")
    void shouldCollectBuilderProblems() {
        assertThatThrownBy(() -> JobConfig.builder()
                .kafkaInputTopic(" ")
                .kafkaBootstrapServers(null)
                .parallelism(0)
                .checkpointInterval(Duration.ZERO)
                .maxOutOfOrderness(Duration.ofMillis(-1))
                .sourceIdleness(null)
                .sentinelConfigPath(null)
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaInputTopic")
                .hasMessageContaining("kafkaBootstrapServers")
                .hasMessageContaining("parallelism")
                .hasMessageContaining("checkpointInterval")
                .hasMessageContaining("maxOutOfOrderness")
                .hasMessageContaining("sourceIdleness")
                .hasMessageContaining("sentinelConfigPath");
    }

    @Test
    @DisplayName("Should reject an alert topic equal to the input topic")
    void shouldRejectFeedbackLoop() {
        assertThatThrownBy(() -> JobConfig.builder().kafkaInputTopic("events").kafkaAlertTopic("events").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must differ");
    }
}
