package star.engine.query;

/**
 * Single-column exact-match condition descriptor: column = literal, optionally negated.
 */
public class Condition {
    private final String columnName;
    private final Object literalValue; // null matches null cells
    private final boolean negated; // true if preceded by NOT in input

    public Condition(String columnName, Object literalValue) {
        this(columnName, literalValue, false);
    }

    public Condition(String columnName, Object literalValue, boolean negated) {
        this.columnName = columnName;
        this.literalValue = literalValue;
        this.negated = negated;
    }

    public String columnName() { return columnName; }
    public Object literalValue() { return literalValue; }
    public boolean negated() { return negated; }
}
