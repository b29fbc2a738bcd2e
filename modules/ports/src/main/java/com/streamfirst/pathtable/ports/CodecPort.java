package com.streamfirst.pathtable.ports;

import com.streamfirst.pathtable.domain.DataRecord;

import java.util.List;

/**
 * Port for converting file content to and from records.
 * Implementations decide the file format (JSON, YAML, CSV, ...) and declare whether a
 * file holds one record or a sequence of records.
 */
public interface CodecPort {

    /**
     * How many records a single file holds.
     */
    enum Mode {
        /** One record per file */
        SINGLETON,
        /** A sequence of records per file */
        MULTI
    }

    /**
     * Gets the mode of this codec.
     *
     * @return the mode
     */
    Mode mode();

    /**
     * Decodes file content.
     *
     * @param path the path the bytes were read from, for error context
     * @param content the raw content
     * @return the decoded records; exactly one in {@link Mode#SINGLETON} mode
     * @throws com.streamfirst.pathtable.domain.CodecException if the content is malformed
     */
    List<DataRecord> decode(String path, byte[] content);

    /**
     * Encodes records into file content.
     *
     * @param path the path the bytes will be written to, for error context
     * @param records the records; exactly one in {@link Mode#SINGLETON} mode
     * @return the encoded content
     * @throws com.streamfirst.pathtable.domain.CodecException if the records cannot be encoded
     */
    byte[] encode(String path, List<DataRecord> records);
}
