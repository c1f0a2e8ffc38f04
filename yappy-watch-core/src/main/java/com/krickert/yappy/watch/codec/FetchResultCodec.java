package com.krickert.yappy.watch.codec;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.krickert.yappy.watch.dependency.Dependency;
import com.krickert.yappy.watch.dependency.FetchResult;
import com.krickert.yappy.watch.dependency.ResponseMetadata;
import com.krickert.yappy.watch.exception.ResultCodecException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

/**
 * JSON (de)serialization of fetched results for caching. Only kinds present in the
 * {@link ResultTypeRegistry} are accepted, in either direction.
 */
public class FetchResultCodec {

    private static final Logger LOG = LoggerFactory.getLogger(FetchResultCodec.class);

    private final ResultTypeRegistry registry;
    private final ObjectMapper objectMapper;

    public FetchResultCodec(ResultTypeRegistry registry) {
        this(registry, new ObjectMapper()
                .registerModule(new Jdk8Module())
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public FetchResultCodec(ResultTypeRegistry registry, ObjectMapper objectMapper) {
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    public byte[] encode(Dependency<?> dependency, FetchResult<?> result) {
        return encode(ResultTypeRegistry.kindOf(dependency.id()), result);
    }

    public byte[] encode(String kind, FetchResult<?> result) {
        if (!registry.isRegistered(kind)) {
            throw new ResultCodecException("Refusing to encode unregistered result kind '" + kind + "'");
        }
        Envelope envelope = new Envelope(kind,
                objectMapper.valueToTree(result.value()),
                result.metadata().lastIndex(),
                result.metadata().lastContact().toMillis());
        try {
            return objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new ResultCodecException("Failed to encode result of kind '" + kind + "'", e);
        }
    }

    /**
     * Decodes a result, checking that it was written for {@code expectedKind}.
     */
    @SuppressWarnings("unchecked")
    public <T> FetchResult<T> decode(byte[] bytes, String expectedKind) {
        Envelope envelope = readEnvelope(bytes);
        if (!envelope.kind().equals(expectedKind)) {
            throw new ResultCodecException("Expected a result of kind '" + expectedKind
                    + "' but found '" + envelope.kind() + "'");
        }
        return (FetchResult<T>) toResult(envelope);
    }

    public FetchResult<?> decode(byte[] bytes) {
        return toResult(readEnvelope(bytes));
    }

    private Envelope readEnvelope(byte[] bytes) {
        try {
            return objectMapper.readValue(bytes, Envelope.class);
        } catch (IOException e) {
            throw new ResultCodecException("Failed to read cached result", e);
        }
    }

    private FetchResult<?> toResult(Envelope envelope) {
        if (envelope.kind() == null || !registry.isRegistered(envelope.kind())) {
            throw new ResultCodecException("Refusing to decode unregistered result kind '" + envelope.kind() + "'");
        }
        try {
            JsonNode node = envelope.value() == null ? NullNode.getInstance() : envelope.value();
            Object value = objectMapper.readerFor(registry.typeOf(envelope.kind(), objectMapper.getTypeFactory()))
                    .readValue(node);
            LOG.trace("Decoded cached result of kind {} at index {}", envelope.kind(), envelope.lastIndex());
            return FetchResult.of(value, new ResponseMetadata(envelope.lastIndex(),
                    Duration.ofMillis(envelope.lastContactMillis())));
        } catch (IOException e) {
            throw new ResultCodecException("Failed to decode result of kind '" + envelope.kind() + "'", e);
        }
    }

    record Envelope(
            @JsonProperty("kind") String kind,
            @JsonProperty("value") JsonNode value,
            @JsonProperty("lastIndex") long lastIndex,
            @JsonProperty("lastContactMillis") long lastContactMillis
    ) {
    }
}
