package star.engine.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

public class QueryParserTest {
    private final QueryParser parser = new QueryParser();

    @Test
    void parsesSingleComparison() {
        WhereClause wc = parser.parseWhere("name = 'Sirius'");
        assertTrue(wc.isSingle());
        Condition c = wc.conditions().get(0);
        assertEquals("name", c.columnName());
        assertEquals("Sirius", c.literalValue());
        assertFalse(c.negated());
    }

    @Test
    void parsesConnectorsAndNegation() {
        WhereClause wc = parser.parseWhere("hip=32349 and NOT constellation_id = 'cma' OR magnitude = -1.44");
        assertEquals(3, wc.conditions().size());
        assertEquals(List.of(WhereClause.Connector.AND, WhereClause.Connector.OR), wc.connectors());
        assertEquals(List.of(2, 1), wc.andGroups().stream().map(List::size).toList());
        assertEquals(32349, wc.conditions().get(0).literalValue());
        assertTrue(wc.conditions().get(1).negated());
        assertEquals(-1.44, wc.conditions().get(2).literalValue());
    }

    @Test
    void literalKinds() {
        assertEquals(5_000_000_000L, parser.parseLiteral("5000000000"));
        assertEquals(1.5e3, parser.parseLiteral("1.5e3"));
        assertEquals(Boolean.TRUE, parser.parseLiteral("TRUE"));
        assertNull(parser.parseLiteral("null"));
        assertEquals("two words", parser.parseWhere("name = 'two words'").conditions().get(0).literalValue());
        assertEquals("a=b", parser.parseWhere("ccdm = 'a=b'").conditions().get(0).literalValue());
    }

    @Test
    void malformedExpressionsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> parser.parseWhere(""));
        assertThrows(IllegalArgumentException.class, () -> parser.parseWhere("name ="));
        assertThrows(IllegalArgumentException.class, () -> parser.parseWhere("magnitude < 3"));
        assertThrows(IllegalArgumentException.class, () -> parser.parseWhere("name = 'Sirius' AND"));
        assertThrows(IllegalArgumentException.class, () -> parser.parseWhere("name = 'Sirius"));
        assertThrows(IllegalArgumentException.class, () -> parser.parseWhere("name = Sirius"));
        assertThrows(IllegalArgumentException.class, () -> parser.parseWhere("hip = 1 XOR hip = 2"));
    }
}
