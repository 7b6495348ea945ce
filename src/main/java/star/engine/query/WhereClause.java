package star.engine.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed lookup expression: conditions joined left to right by connectors, AND binding
 * tighter than OR. {@code hip = 1 AND name = 'x' OR hip = 2} is {@code (hip = 1 AND name = 'x') OR hip = 2}.
 */
public class WhereClause {
    public enum Connector { AND, OR }

    private final List<Condition> conditions;
    private final List<Connector> connectors;

    public WhereClause(List<Condition> conditions, List<Connector> connectors) {
        if (conditions == null || conditions.isEmpty()) throw new IllegalArgumentException("conditions empty");
        if (connectors.size() != conditions.size() - 1) {
            throw new IllegalArgumentException("Expected " + (conditions.size() - 1) + " connectors, got " + connectors.size());
        }
        this.conditions = List.copyOf(conditions);
        this.connectors = List.copyOf(connectors);
    }

    public List<Condition> conditions() { return conditions; }
    public List<Connector> connectors() { return connectors; }
    public boolean isSingle() { return conditions.size() == 1; }

    /** Conditions split at each OR; the conditions inside a group are ANDed. */
    public List<List<Condition>> andGroups() {
        List<List<Condition>> groups = new ArrayList<>();
        List<Condition> current = new ArrayList<>();
        current.add(conditions.get(0));
        for (int i = 0; i < connectors.size(); i++) {
            if (connectors.get(i) == Connector.OR) {
                groups.add(List.copyOf(current));
                current = new ArrayList<>();
            }
            current.add(conditions.get(i + 1));
        }
        groups.add(List.copyOf(current));
        return groups;
    }
}
