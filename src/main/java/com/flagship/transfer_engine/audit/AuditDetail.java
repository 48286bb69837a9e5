package com.flagship.transfer_engine.audit;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Structured payload of an audit record: an ordered map of string keys to {@link AuditValue}s.
 * Stored as a JSON object.
 */
@EqualsAndHashCode
@ToString
public final class AuditDetail {

    private static final AuditDetail EMPTY = new AuditDetail(Map.of());

    private final Map<String, AuditValue> fields;

    private AuditDetail(Map<String, AuditValue> fields) {
        this.fields = fields;
    }

    public static AuditDetail empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<AuditValue> get(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    public Map<String, AuditValue> getFields() {
        return fields;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @JsonValue
    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        fields.forEach((key, value) -> json.put(key, value.toJson()));
        return json;
    }

    /**
     * Rebuilds a detail payload from a stored JSON object. Anything that is not an object
     * (including SQL NULL) yields an empty payload.
     */
    public static AuditDetail fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            return EMPTY;
        }
        Builder builder = builder();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            builder.put(entry.getKey(), AuditValue.fromJson(entry.getValue()));
        }
        return builder.build();
    }

    public static final class Builder {

        private final Map<String, AuditValue> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, AuditValue value) {
            fields.put(key, value != null ? value : AuditValue.nullValue());
            return this;
        }

        public Builder put(String key, String value) {
            return put(key, AuditValue.text(value));
        }

        public Builder put(String key, UUID value) {
            return put(key, AuditValue.text(value != null ? value.toString() : null));
        }

        public Builder put(String key, BigDecimal value) {
            return put(key, AuditValue.number(value));
        }

        public Builder put(String key, boolean value) {
            return put(key, AuditValue.flag(value));
        }

        public Builder put(String key, List<AuditValue> values) {
            return put(key, AuditValue.list(values));
        }

        public Builder put(String key, AuditDetail nested) {
            return put(key, nested != null ? AuditValue.object(nested.fields) : AuditValue.nullValue());
        }

        public AuditDetail build() {
            if (fields.isEmpty()) {
                return EMPTY;
            }
            return new AuditDetail(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
        }
    }
}
