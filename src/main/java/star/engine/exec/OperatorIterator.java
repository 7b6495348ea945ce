package star.engine.exec;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Adapts a pull operator to an Iterator. Opens on construction and closes
 * once the operator is exhausted.
 */
public final class OperatorIterator implements Iterator<Row> {
    private final Operator op;
    private Row lookahead;
    private boolean done;

    public OperatorIterator(Operator op) {
        this.op = op;
        op.open();
    }

    @Override
    public boolean hasNext() {
        if (done) return false;
        if (lookahead == null) {
            lookahead = op.next();
            if (lookahead == null) {
                done = true;
                op.close();
                return false;
            }
        }
        return true;
    }

    @Override
    public Row next() {
        if (!hasNext()) throw new NoSuchElementException();
        Row r = lookahead;
        lookahead = null;
        return r;
    }
}
