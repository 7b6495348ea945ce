package star.engine.query;

import java.util.ArrayList;
import java.util.List;

import star.engine.catalog.CatalogSchema;
import star.engine.exec.CompoundPredicate;
import star.engine.exec.EqualityPredicate;
import star.engine.exec.Predicate;

/**
 * Compiles a WhereClause into a physical Predicate against a catalog schema.
 * Unknown columns and mistyped literals fail with SchemaMismatchException.
 */
public class PredicateCompiler {

    public Predicate compile(WhereClause where, CatalogSchema schema) {
        if (where == null) throw new IllegalArgumentException("where must not be null");
        List<Predicate> alternatives = new ArrayList<>();
        for (List<Condition> group : where.andGroups()) {
            List<Predicate> terms = new ArrayList<>(group.size());
            for (Condition c : group) terms.add(compileSingle(c, schema));
            alternatives.add(terms.size() == 1 ? terms.get(0) : CompoundPredicate.and(terms.toArray(new Predicate[0])));
        }
        return alternatives.size() == 1
            ? alternatives.get(0)
            : CompoundPredicate.or(alternatives.toArray(new Predicate[0]));
    }

    private Predicate compileSingle(Condition cond, CatalogSchema schema) {
        Predicate base = EqualityPredicate.forColumnName(schema, cond.columnName(), cond.literalValue());
        return cond.negated() ? CompoundPredicate.not(base) : base;
    }
}
