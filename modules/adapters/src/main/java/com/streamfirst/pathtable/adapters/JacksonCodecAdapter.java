package com.streamfirst.pathtable.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.streamfirst.pathtable.domain.CodecException;
import com.streamfirst.pathtable.domain.DataRecord;
import com.streamfirst.pathtable.ports.CodecPort;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * CodecPort backed by a Jackson {@link ObjectMapper}. A singleton file holds one object;
 * a multi file holds an array of objects. Field values must be scalars.
 */
@Slf4j
@RequiredArgsConstructor
public class JacksonCodecAdapter implements CodecPort {

    @NonNull private final ObjectMapper mapper;
    @NonNull private final Mode mode;

    public static JacksonCodecAdapter json(Mode mode) {
        return new JacksonCodecAdapter(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT), mode);
    }

    public static JacksonCodecAdapter yaml(Mode mode) {
        return new JacksonCodecAdapter(new ObjectMapper(new YAMLFactory()), mode);
    }

    /**
     * Creates a codec by format name: {@code json}, {@code yaml} or {@code yml}.
     */
    public static JacksonCodecAdapter forFormat(String format, Mode mode) {
        switch (format.toLowerCase(Locale.ROOT)) {
            case "json":
                return json(mode);
            case "yaml":
            case "yml":
                return yaml(mode);
            default:
                throw new IllegalArgumentException("Unknown codec format: " + format);
        }
    }

    @Override
    public Mode mode() {
        return mode;
    }

    @Override
    public List<DataRecord> decode(String path, byte[] content) {
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (IOException e) {
            throw new CodecException(path, "Malformed content in " + path + ": " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new CodecException(path, "No content in " + path);
        }

        if (mode == Mode.SINGLETON) {
            return List.of(JsonRecords.toRecord(path, root));
        }
        if (!root.isArray()) {
            throw new CodecException(path, "Expected an array in " + path + " but found " + root.getNodeType());
        }
        List<DataRecord> records = new ArrayList<>(root.size());
        for (JsonNode element : root) {
            records.add(JsonRecords.toRecord(path, element));
        }
        log.trace("Decoded {} records from {}", records.size(), path);
        return records;
    }

    @Override
    public byte[] encode(String path, List<DataRecord> records) {
        Object document;
        if (mode == Mode.SINGLETON) {
            if (records.size() != 1) {
                throw new CodecException(path, "A singleton file holds exactly one record, got " + records.size());
            }
            document = records.get(0).asMap();
        } else {
            document = records.stream().map(DataRecord::asMap).toList();
        }
        try {
            return mapper.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new CodecException(path, "Failed to encode records for " + path, e);
        }
    }
}
