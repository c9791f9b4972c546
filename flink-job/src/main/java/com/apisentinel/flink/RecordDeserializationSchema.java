package com.apisentinel.flink;

import com.apisentinel.core.engine.RecordValidator;
import com.apisentinel.core.model.JsonMappers;
import com.apisentinel.core.model.NormalizedRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.SimpleCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes →
 * {@link NormalizedRecord}.
 * <p>
 * Malformed JSON and records failing {@link RecordValidator} are logged,
 * counted in {@code records_rejected_total} and dropped (returns
 * {@code null}), so one bad record never fails the job.
 * </p>
 */
public class RecordDeserializationSchema implements DeserializationSchema<NormalizedRecord> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(RecordDeserializationSchema.class);

    private final Duration maxClockSkew;

    private transient ObjectMapper mapper;
    private transient RecordValidator validator;
    private transient Counter rejected;

    public RecordDeserializationSchema(Duration maxClockSkew) {
        this.maxClockSkew = Objects.requireNonNull(maxClockSkew, "maxClockSkew must not be null");
    }

    @Override
    public void open(InitializationContext context) {
        rejected = context.getMetricGroup().addGroup(SentinelMetrics.GROUP).counter("records_rejected_total");
    }

    @Override
    public NormalizedRecord deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        NormalizedRecord record;
        try {
            record = objectMapper().readValue(message, NormalizedRecord.class);
        } catch (IOException e) {
            rejectedCounter().inc();
            LOG.warn("Failed to deserialize record, skipping: {}", e.getMessage());
            return null;
        }
        Optional<String> problem = validator().validate(record, Instant.now());
        if (problem.isPresent()) {
            rejectedCounter().inc();
            LOG.warn("Invalid record for {}: skipping: {}", record.getEndpoint(), problem.get());
            return null;
        }
        return record;
    }

    @Override
    public boolean isEndOfStream(NormalizedRecord nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<NormalizedRecord> getProducedType() {
        return TypeInformation.of(NormalizedRecord.class);
    }

    /** @return records rejected so far by this instance */
    public long getRejectedCount() {
        return rejectedCounter().getCount();
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = JsonMappers.create();
        }
        return mapper;
    }

    private RecordValidator validator() {
        if (validator == null) {
            validator = new RecordValidator(maxClockSkew);
        }
        return validator;
    }

    private Counter rejectedCounter() {
        if (rejected == null) {
            rejected = new SimpleCounter();
        }
        return rejected;
    }
}
