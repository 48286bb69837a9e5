package com.flagship.transfer_engine.audit;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single value inside an audit detail payload.
 *
 * The set of variants is closed: text, number, flag, list, object and null.
 * Anything else has to be converted to one of them before it is recorded.
 */
public interface AuditValue {

    /**
     * Plain Java representation handed to Jackson (String, BigDecimal, Boolean, List, Map or null).
     */
    Object toJson();

    static AuditValue text(String value) {
        return value == null ? Null.INSTANCE : new Text(value);
    }

    static AuditValue number(BigDecimal value) {
        return value == null ? Null.INSTANCE : new Number(value);
    }

    static AuditValue number(long value) {
        return new Number(BigDecimal.valueOf(value));
    }

    static AuditValue flag(boolean value) {
        return new Flag(value);
    }

    static AuditValue list(List<AuditValue> items) {
        return items == null ? Null.INSTANCE : new Items(List.copyOf(items));
    }

    static AuditValue object(Map<String, AuditValue> fields) {
        return fields == null ? Null.INSTANCE : new Fields(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    static AuditValue nullValue() {
        return Null.INSTANCE;
    }

    /**
     * Converts a parsed JSON node back into the closed set of variants.
     */
    static AuditValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Null.INSTANCE;
        }
        if (node.isTextual()) {
            return new Text(node.textValue());
        }
        if (node.isNumber()) {
            return new Number(node.decimalValue());
        }
        if (node.isBoolean()) {
            return new Flag(node.booleanValue());
        }
        if (node.isArray()) {
            List<AuditValue> items = new ArrayList<>();
            node.forEach(item -> items.add(fromJson(item)));
            return new Items(List.copyOf(items));
        }
        Map<String, AuditValue> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            fields.put(entry.getKey(), fromJson(entry.getValue()));
        }
        return new Fields(Collections.unmodifiableMap(fields));
    }

    @Value
    class Text implements AuditValue {
        String value;

        @Override
        public Object toJson() {
            return value;
        }
    }

    @Value
    class Number implements AuditValue {
        BigDecimal value;

        @Override
        public Object toJson() {
            return value;
        }
    }

    @Value
    class Flag implements AuditValue {
        boolean value;

        @Override
        public Object toJson() {
            return value;
        }
    }

    @Value
    class Items implements AuditValue {
        List<AuditValue> values;

        @Override
        public Object toJson() {
            List<Object> json = new ArrayList<>(values.size());
            values.forEach(v -> json.add(v.toJson()));
            return json;
        }
    }

    @Value
    class Fields implements AuditValue {
        Map<String, AuditValue> values;

        @Override
        public Object toJson() {
            Map<String, Object> json = new LinkedHashMap<>();
            values.forEach((k, v) -> json.put(k, v.toJson()));
            return json;
        }
    }

    enum Null implements AuditValue {
        INSTANCE;

        @Override
        public Object toJson() {
            return null;
        }
    }
}
