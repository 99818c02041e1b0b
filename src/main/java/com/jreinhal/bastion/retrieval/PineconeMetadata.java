package com.jreinhal.bastion.retrieval;

import com.google.protobuf.ListValue;
import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions between plain maps and the protobuf structs the Pinecone data plane speaks.
 */
final class PineconeMetadata {

    private PineconeMetadata() {
    }

    /**
     * Equality filter in Pinecone's metadata filter language: {@code {field: {"$eq": value}}}.
     * An empty filter is {@code null}, which queries the whole namespace.
     */
    static Struct equalityFilter(Map<String, String> filter) {
        if (filter == null || filter.isEmpty()) {
            return null;
        }
        Struct.Builder builder = Struct.newBuilder();
        filter.forEach((field, value) -> builder.putFields(field, Value.newBuilder()
                .setStructValue(Struct.newBuilder().putFields("$eq", Value.newBuilder().setStringValue(value).build()))
                .build()));
        return builder.build();
    }

    static Map<String, Object> toMap(Struct struct) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (struct != null) {
            struct.getFieldsMap().forEach((key, value) -> map.put(key, toJava(value)));
        }
        return map;
    }

    private static Object toJava(Value value) {
        switch (value.getKindCase()) {
            case STRING_VALUE:
                return value.getStringValue();
            case NUMBER_VALUE:
                return value.getNumberValue();
            case BOOL_VALUE:
                return value.getBoolValue();
            case STRUCT_VALUE:
                return toMap(value.getStructValue());
            case LIST_VALUE:
                return toList(value.getListValue());
            default:
                return null;
        }
    }

    private static List<Object> toList(ListValue listValue) {
        List<Object> list = new ArrayList<>(listValue.getValuesCount());
        for (Value item : listValue.getValuesList()) {
            list.add(toJava(item));
        }
        return list;
    }
}
