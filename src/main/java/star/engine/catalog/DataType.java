package star.engine.catalog;

/**
 * Supported column data types.
 *
 * Every type has a canonical text form used for statistics in the manifest;
 * {@link #parse(String)} reverses {@link #format(Object)} exactly.
 */
public enum DataType {
    INT,
    LONG,
    DOUBLE,
    BOOLEAN,
    VARCHAR,
    CATEGORY; // low-cardinality string, dictionary encoded on disk

    // Largest magnitude a long can have and still convert to double exactly everywhere below it.
    private static final long MAX_EXACT_DOUBLE_LONG = 1L << 53;

    public boolean isNumeric() {
        return this == INT || this == LONG || this == DOUBLE;
    }

    public boolean isText() {
        return this == VARCHAR || this == CATEGORY;
    }

    /**
     * Normalize a caller-supplied value to this type's Java representation.
     * Returns null when the value cannot represent this type without loss.
     */
    public Object coerce(Object v) {
        if (v == null) return null;
        return switch (this) {
            case INT -> {
                if (v instanceof Integer) yield v;
                if (v instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) yield l.intValue();
                if (v instanceof Short s) yield s.intValue();
                yield null;
            }
            case LONG -> {
                if (v instanceof Long) yield v;
                if (v instanceof Integer i) yield i.longValue();
                if (v instanceof Short s) yield s.longValue();
                yield null;
            }
            case DOUBLE -> {
                if (v instanceof Double) yield v;
                if (v instanceof Float f) yield f.doubleValue();
                if (v instanceof Integer || v instanceof Short) yield ((Number) v).doubleValue();
                if (v instanceof Long l && l >= -MAX_EXACT_DOUBLE_LONG && l <= MAX_EXACT_DOUBLE_LONG) yield l.doubleValue();
                yield null;
            }
            case BOOLEAN -> v instanceof Boolean ? v : null;
            case VARCHAR, CATEGORY -> v instanceof String ? v : null;
        };
    }

    /** Zero value for numeric types; used by {@link Presence#DEFAULT_ZERO} columns. */
    public Object zero() {
        return switch (this) {
            case INT -> 0;
            case LONG -> 0L;
            case DOUBLE -> 0.0d;
            default -> throw new IllegalStateException("No zero value for " + this);
        };
    }

    public int compare(Object a, Object b) {
        return switch (this) {
            case INT -> Integer.compare((Integer) a, (Integer) b);
            case LONG -> Long.compare((Long) a, (Long) b);
            case DOUBLE -> Double.compare((Double) a, (Double) b);
            case BOOLEAN -> Boolean.compare((Boolean) a, (Boolean) b);
            case VARCHAR, CATEGORY -> ((String) a).compareTo((String) b);
        };
    }

    public String format(Object v) {
        if (v == null) return null;
        return String.valueOf(v);
    }

    public Object parse(String s) {
        if (s == null) return null;
        return switch (this) {
            case INT -> Integer.parseInt(s);
            case LONG -> Long.parseLong(s);
            case DOUBLE -> Double.parseDouble(s);
            case BOOLEAN -> Boolean.parseBoolean(s);
            case VARCHAR, CATEGORY -> s;
        };
    }
}
