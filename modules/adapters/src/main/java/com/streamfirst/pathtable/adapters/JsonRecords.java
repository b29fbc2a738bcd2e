package com.streamfirst.pathtable.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.streamfirst.pathtable.domain.CodecException;
import com.streamfirst.pathtable.domain.DataRecord;

import java.util.Iterator;
import java.util.Map;

/**
 * Conversion between Jackson trees and flat records of scalar fields.
 */
final class JsonRecords {

    private JsonRecords() {
    }

    static DataRecord toRecord(String path, JsonNode node) {
        if (!node.isObject()) {
            throw new CodecException(path, "Expected an object in " + path + " but found " + node.getNodeType());
        }
        DataRecord.Builder record = DataRecord.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            record.put(field.getKey(), toScalar(path, field.getKey(), field.getValue()));
        }
        return record.build();
    }

    private static Object toScalar(String path, String field, JsonNode value) {
        if (value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isIntegralNumber()) {
            if (!value.canConvertToLong()) {
                throw new CodecException(path, "Field '" + field + "' in " + path + " does not fit in 64 bits");
            }
            return value.longValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        throw new CodecException(path, "Field '" + field + "' in " + path + " holds a "
            + value.getNodeType() + "; only scalar values are supported");
    }
}
