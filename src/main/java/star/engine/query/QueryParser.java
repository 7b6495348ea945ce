package star.engine.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parser for lookup expressions:
 *   [NOT] column = literal [AND|OR [NOT] column = literal ...]
 * Literals: integers, decimals (with optional exponent), true/false, null,
 * single-quoted strings (no escaping).
 */
public class QueryParser {

    public WhereClause parseWhere(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("Empty lookup expression");
        List<String> tokens = tokenize(raw.trim());
        List<Condition> conditions = new ArrayList<>();
        List<WhereClause.Connector> connectors = new ArrayList<>();
        int i = 0;
        while (i < tokens.size()) {
            boolean negated = false;
            if (tokens.get(i).equalsIgnoreCase("NOT")) {
                negated = true;
                i++;
            }
            if (i + 2 >= tokens.size()) {
                throw new IllegalArgumentException("Incomplete comparison near: "
                    + String.join(" ", tokens.subList(Math.min(i, tokens.size()), tokens.size())));
            }
            String col = tokens.get(i);
            if (!tokens.get(i + 1).equals("=")) {
                throw new IllegalArgumentException("Only '=' is supported, got: " + tokens.get(i + 1));
            }
            conditions.add(new Condition(col, parseLiteral(tokens.get(i + 2)), negated));
            i += 3; // consumed column op literal
            if (i < tokens.size()) {
                WhereClause.Connector connector = connector(tokens.get(i));
                connectors.add(connector);
                i++;
                if (i >= tokens.size()) throw new IllegalArgumentException("Dangling " + connector);
            }
        }
        return new WhereClause(conditions, connectors);
    }

    private static WhereClause.Connector connector(String token) {
        String upper = token.toUpperCase(Locale.ROOT);
        if (upper.equals("AND")) return WhereClause.Connector.AND;
        if (upper.equals("OR")) return WhereClause.Connector.OR;
        throw new IllegalArgumentException("Unexpected token (expected AND/OR): " + token);
    }

    Object parseLiteral(String raw) {
        if (raw.startsWith("'") && raw.endsWith("'") && raw.length() >= 2) {
            return raw.substring(1, raw.length() - 1);
        }
        String lower = raw.toLowerCase();
        if (lower.equals("true")) return Boolean.TRUE;
        if (lower.equals("false")) return Boolean.FALSE;
        if (lower.equals("null")) return null;
        if (raw.matches("-?\\d+")) {
            try {
                long v = Long.parseLong(raw);
                if (v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE) return (int) v;
                return v;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid integer literal: " + raw, e);
            }
        }
        if (raw.matches("-?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?")) {
            return Double.parseDouble(raw);
        }
        throw new IllegalArgumentException("Unsupported literal: " + raw);
    }

    // Tokenize respecting single-quoted strings (no escaping inside quotes); '=' is its own token.
    private List<String> tokenize(String raw) {
        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (ch == '\'') {
                inQuote = !inQuote;
                current.append(ch);
            } else if (!inQuote && (Character.isWhitespace(ch) || ch == '=')) {
                if (current.length() > 0) {
                    out.add(current.toString());
                    current.setLength(0);
                }
                if (ch == '=') out.add("=");
            } else {
                current.append(ch);
            }
        }
        if (inQuote) throw new IllegalArgumentException("Unterminated string literal");
        if (current.length() > 0) out.add(current.toString());
        return out;
    }
}
