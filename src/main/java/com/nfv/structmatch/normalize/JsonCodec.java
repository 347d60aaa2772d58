package com.nfv.structmatch.normalize;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.nfv.structmatch.model.RawJson;
import com.nfv.structmatch.model.TimeValues;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.OffsetDateTime;

/**
 * JSON round trip used by the normalizer, and compact rendering of values for traces
 */
@Slf4j
public class JsonCodec {

    private static final JsonCodec DEFAULT = new JsonCodec();

    private final ObjectMapper objectMapper;
    private final ObjectMapper traceMapper;

    public JsonCodec() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new Jdk8Module());
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // beans without properties normalize to an empty object
        this.objectMapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

        this.traceMapper = objectMapper.copy();
        this.traceMapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        this.traceMapper.registerModule(new SimpleModule("trace-numbers")
                .addSerializer(Double.class, new WholeNumberSerializer()));
    }

    public static JsonCodec getDefault() {
        return DEFAULT;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Serialize a value and decode it back into plain maps, lists and scalars
     */
    public Object roundTrip(Object value) throws JsonProcessingException {
        String json = objectMapper.writeValueAsString(value);
        log.debug("Round-tripped {} through {} characters of JSON", value.getClass().getName(), json.length());
        return objectMapper.readValue(json, Object.class);
    }

    public Object decode(RawJson raw) throws JsonProcessingException {
        String json = raw.getJson();
        if (json == null || json.trim().isEmpty()) {
            return null;
        }
        return objectMapper.readValue(json, Object.class);
    }

    /**
     * Render a value as compact JSON. Falls back to String.valueOf when Jackson cannot serialize it.
     */
    public String render(Object value) {
        if (value instanceof OffsetDateTime) {
            return '"' + TimeValues.format((OffsetDateTime) value) + '"';
        }
        try {
            return traceMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("Cannot render {} as JSON: {}", value.getClass().getName(), e.getOriginalMessage());
            return String.valueOf(value);
        }
    }

    /**
     * Writes doubles with an integral value without the fraction, so 1.0 renders as 1
     */
    static class WholeNumberSerializer extends StdSerializer<Double> {

        private static final double LONG_RANGE = 9.007199254740992E15;

        WholeNumberSerializer() {
            super(Double.class);
        }

        @Override
        public void serialize(Double value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            double d = value;
            if (d == Math.rint(d) && Math.abs(d) < LONG_RANGE) {
                gen.writeNumber((long) d);
            } else {
                gen.writeNumber(d);
            }
        }
    }
}
