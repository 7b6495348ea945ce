package star.engine.build;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One input row as supplied by the record source: field name to value.
 * Fields the catalog does not store are ignored; derived fields must not be present.
 */
public final class SourceRecord {
    private final Map<String, Object> fields;

    private SourceRecord(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Object get(String name) { return fields.get(name); }

    public Set<String> names() { return fields.keySet(); }

    /** Numeric field as a double, or null when absent or not numeric. */
    public Double getDouble(String name) {
        Object v = fields.get(name);
        return v instanceof Number n ? n.doubleValue() : null;
    }

    @Override
    public String toString() {
        return "SourceRecord" + fields;
    }

    public static final class Builder {
        private final Map<String, Object> fields = new LinkedHashMap<>();

        public Builder put(String name, Object value) {
            fields.put(name, value);
            return this;
        }

        public SourceRecord build() {
            return new SourceRecord(new LinkedHashMap<>(fields));
        }
    }
}
