package star.engine.exec;

import java.util.Map;

/**
 * Row predicate used by catalog lookups.
 */
public interface Predicate {
    boolean test(Row row);

    /**
     * Adds to {@code out} the column = value equalities that every matching row satisfies.
     * Returns false when they contradict what is already there, so no row can match.
     * Predicates that imply no equality leave {@code out} untouched.
     */
    default boolean collectEqualities(Map<String, Object> out) {
        return true;
    }
}
