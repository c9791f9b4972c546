package com.apisentinel.flink;

import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.JsonMappers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Writes alerts to the Kafka alerts topic.
 *
 * <p>
 * The record key is the endpoint, so every update of an endpoint's alert lands
 * on the same partition in order. The value is the alert as JSON with ISO-8601
 * instants. Headers {@value #STATUS_HEADER} and {@value #SEVERITY_HEADER} let
 * consumers route without parsing the body.
 * </p>
 *
 * <p>
 * An alert that cannot be serialized is logged and dropped; it stays in the
 * job's state and is emitted again with its next change.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertSerializationSchema implements KafkaRecordSerializationSchema<Alert> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AlertSerializationSchema.class);

    static final String STATUS_HEADER = "alert-status";
    static final String SEVERITY_HEADER = "alert-severity";

    private final String topic;
    private transient ObjectMapper mapper;

    public AlertSerializationSchema(String topic) {
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
    }

    @Override
    public void open(SerializationSchema.InitializationContext context, KafkaSinkContext sinkContext) {
        mapper = JsonMappers.create();
    }

    @Override
    public ProducerRecord<byte[], byte[]> serialize(Alert alert, KafkaSinkContext context, Long timestamp) {
        byte[] value;
        try {
            value = objectMapper().writeValueAsBytes(alert);
        } catch (JsonProcessingException e) {
            LOG.error("Dropping alert {} for {}: not serializable", alert.getId(), alert.getEndpoint(), e);
            return null;
        }
        ProducerRecord<byte[], byte[]> record = new ProducerRecord<>(topic, null, timestamp,
                utf8(alert.getEndpoint()), value);
        record.headers().add(new RecordHeader(STATUS_HEADER, utf8(alert.getStatus().name())));
        record.headers().add(new RecordHeader(SEVERITY_HEADER, utf8(alert.getSeverity().name())));
        return record;
    }

    private ObjectMapper objectMapper() {
        // open() is skipped when the schema is used outside a running sink
        if (mapper == null) {
            mapper = JsonMappers.create();
        }
        return mapper;
    }

    private static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
