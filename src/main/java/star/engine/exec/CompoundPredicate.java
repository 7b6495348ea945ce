package star.engine.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Boolean combination of lookup predicates. Nested conjunctions (and disjunctions) are
 * flattened, so and(and(a, b), c) tests and prints like and(a, b, c).
 * Only a conjunction contributes equalities for pruning; OR and NOT branches never do.
 */
public final class CompoundPredicate implements Predicate {
    public enum Type { AND, OR, NOT }

    private final Type type;
    private final List<Predicate> children;

    private CompoundPredicate(Type type, List<Predicate> children) {
        this.type = type;
        this.children = List.copyOf(children);
    }

    public static CompoundPredicate and(Predicate... predicates) {
        return combine(Type.AND, predicates);
    }

    public static CompoundPredicate or(Predicate... predicates) {
        return combine(Type.OR, predicates);
    }

    public static CompoundPredicate not(Predicate predicate) {
        if (predicate == null) throw new IllegalArgumentException("NOT requires a predicate");
        return new CompoundPredicate(Type.NOT, List.of(predicate));
    }

    private static CompoundPredicate combine(Type type, Predicate[] predicates) {
        if (predicates.length < 2) {
            throw new IllegalArgumentException(type + " requires at least two predicates, got " + predicates.length);
        }
        List<Predicate> flat = new ArrayList<>();
        for (Predicate p : predicates) {
            if (p instanceof CompoundPredicate cp && cp.type == type) flat.addAll(cp.children);
            else flat.add(p);
        }
        return new CompoundPredicate(type, flat);
    }

    public Type type() { return type; }
    public List<Predicate> children() { return children; }

    @Override
    public boolean test(Row row) {
        switch (type) {
            case AND:
                for (Predicate p : children) {
                    if (!p.test(row)) return false;
                }
                return true;
            case OR:
                for (Predicate p : children) {
                    if (p.test(row)) return true;
                }
                return false;
            default:
                return !children.get(0).test(row);
        }
    }

    @Override
    public boolean collectEqualities(Map<String, Object> out) {
        if (type != Type.AND) return true;
        for (Predicate p : children) {
            if (!p.collectEqualities(out)) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        if (type == Type.NOT) return "NOT(" + children.get(0) + ")";
        return children.stream().map(String::valueOf).collect(Collectors.joining(" " + type + " ", "(", ")"));
    }
}
