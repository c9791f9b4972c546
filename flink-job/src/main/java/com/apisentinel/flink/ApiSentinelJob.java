package com.apisentinel.flink;

import com.apisentinel.core.config.ConfigLoader;
import com.apisentinel.core.config.SentinelConfig;
import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.NormalizedRecord;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Main entry point for the API Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (api-requests topic)
 *     → Deserialize + validate JSON → NormalizedRecord
 *     → Event time from record timestamp, bounded out-of-orderness
 *     → Key by endpoint
 *     → DegradationProcessFunction (windows, baselines, correlation)
 *     → Serialize Alert → JSON
 *     → Kafka (api-alerts topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Deployment settings come from environment variables via {@link JobConfig};
 * detection tuning from the sentinel YAML via {@link ConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ApiSentinelJob {

        private static final Logger LOG = LoggerFactory.getLogger(ApiSentinelJob.class);

        private ApiSentinelJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting API Sentinel with config: {}", config);

                // 2. Load detection tuning
                SentinelConfig sentinel = loadSentinelConfig(config);
                LOG.info("Detection config: {}", sentinel);

                // 3. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                // 4. Build pipeline
                buildPipeline(env, config, sentinel);

                // 5. Execute
                env.execute("API Sentinel – Degradation Detection");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the full Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        SentinelConfig sentinel) {
                KafkaSource<NormalizedRecord> kafkaSource = KafkaSource.<NormalizedRecord>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaInputTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(config.getStartingOffsets().toInitializer())
                                .setValueOnlyDeserializer(new RecordDeserializationSchema(sentinel.maxClockSkew()))
                                .build();

                DataStream<NormalizedRecord> records = env.fromSource(
                                kafkaSource,
                                watermarks(config),
                                "kafka-records-source");

                DataStream<Alert> alerts = records
                                .filter(Objects::nonNull) // drop rejected records
                                .keyBy(NormalizedRecord::getEndpoint)
                                .process(new DegradationProcessFunction(sentinel))
                                .name("degradation-detection");

                KafkaSink<Alert> kafkaSink = KafkaSink.<Alert>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setRecordSerializer(new AlertSerializationSchema(config.getKafkaAlertTopic()))
                                .build();

                alerts.sinkTo(kafkaSink).name("kafka-alerts-sink");
        }

        static WatermarkStrategy<NormalizedRecord> watermarks(JobConfig config) {
                return WatermarkStrategy
                                .<NormalizedRecord>forBoundedOutOfOrderness(
                                                config.getMaxOutOfOrderness())
                                .withTimestampAssigner((record, ts) -> record == null
                                                ? ts
                                                : record.getTimestamp().toEpochMilli())
                                .withIdleness(config.getSourceIdleness());
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static SentinelConfig loadSentinelConfig(JobConfig config) {
                String path = config.getSentinelConfigPath();
                if (path != null && !path.isBlank()) {
                        return ConfigLoader.fromFile(path);
                }
                return ConfigLoader.load();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointInterval().toMillis();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
