package co.fanki.zombies.graph.domain.link;

import co.fanki.zombies.graph.domain.AccessKind;
import co.fanki.zombies.graph.domain.DependencyEdge;
import co.fanki.zombies.graph.domain.DependencyGraph;
import co.fanki.zombies.graph.domain.DiagnosticKind;
import co.fanki.zombies.graph.domain.EdgeType;
import co.fanki.zombies.graph.domain.FileFacts;
import co.fanki.zombies.graph.domain.FragmentKind;
import co.fanki.zombies.graph.domain.GraphFixtures;
import co.fanki.zombies.graph.domain.SymbolDeclaration;
import co.fanki.zombies.graph.domain.SymbolKind;
import co.fanki.zombies.graph.domain.TextFragment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static co.fanki.zombies.graph.domain.GraphFixtures.id;
import static co.fanki.zombies.graph.domain.GraphFixtures.java;
import static co.fanki.zombies.graph.domain.GraphFixtures.method;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link SqlTableAccessDetector}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SqlTableAccessDetectorTest {

    private static final String REPORT_ID = id("shop",
            "src/ReportDao.java", "com.x.ReportDao.monthly");

    private static FileFacts dao(final TextFragment... fragments) {
        return java("shop", "src/ReportDao.java",
                List.of(method("com.x.ReportDao", "monthly", 4)), List.of(),
                List.of(fragments));
    }

    private static TextFragment literal(final String owner,
            final String text) {
        return new TextFragment(FragmentKind.SQL_LITERAL, owner, null, text,
                6);
    }

    private static List<DependencyEdge> accesses(final DependencyGraph graph) {
        return graph.edges().stream()
                .filter(e -> e.type() == EdgeType.ACCESSES)
                .toList();
    }

    @Test
    void whenLinking_givenSqlLiteral_shouldAccessTablesFromOwner() {
        final FileFacts schema = new FileFacts("db", "schema.sql", "sql",
                List.of(SymbolDeclaration.of("ORDERS", null,
                        SymbolKind.DB_TABLE, 1)), List.of(), List.of());

        final DependencyGraph graph = GraphFixtures.build(List.of(
                dao(literal("com.x.ReportDao.monthly",
                        "SELECT o.id FROM orders o JOIN customers c"
                                + " ON o.cid = c.id")), schema), List.of());

        final List<DependencyEdge> edges = accesses(graph);
        assertEquals(2, edges.size());
        assertTrue(edges.stream().allMatch(e ->
                e.sourceId().equals(REPORT_ID)
                        && e.access() == AccessKind.READ
                        && e.strength() == SqlTableAccessDetector.STRENGTH));
        assertTrue(edges.stream().anyMatch(e ->
                e.targetId().equals(id("db", "schema.sql", "ORDERS"))));
        assertTrue(edges.stream().anyMatch(e ->
                e.targetId().equals("<phantom>::db_table::customers")));
    }

    @Test
    void whenLinking_givenReadAndWriteOfSameTable_shouldKeepBothEdges() {
        final DependencyGraph graph = GraphFixtures.build(List.of(
                dao(literal("com.x.ReportDao.monthly",
                        "INSERT INTO totals SELECT sum(x) FROM totals"))),
                List.of());

        assertEquals(2, accesses(graph).size());
    }

    @Test
    void whenLinking_givenLiteralOutsideSymbols_shouldAccessFromFileNode() {
        final DependencyGraph graph = GraphFixtures.build(List.of(
                dao(literal(null, "DELETE FROM outbox"))), List.of());

        final DependencyEdge edge = accesses(graph).get(0);
        assertEquals(id("shop", "src/ReportDao.java", "ReportDao.java"),
                edge.sourceId());
        assertEquals(AccessKind.WRITE, edge.access());
    }

    @Test
    void whenLinking_givenPlainText_shouldIgnoreIt() {
        final DependencyGraph graph = GraphFixtures.build(List.of(
                dao(literal("com.x.ReportDao.monthly", "Hello from orders"))),
                List.of());

        assertTrue(accesses(graph).isEmpty());
    }

    @Test
    void whenLinking_givenMalformedSql_shouldDiagnoseAndKeepOtherFragments() {
        final DependencyGraph graph = GraphFixtures.build(List.of(dao(
                literal("com.x.ReportDao.monthly", "SELECT * FROM (orders"),
                literal("com.x.ReportDao.monthly", "SELECT * FROM refunds"))),
                List.of());

        assertEquals(1, accesses(graph).size());
        assertTrue(graph.diagnostics().stream().anyMatch(d ->
                d.kind() == DiagnosticKind.MALFORMED_FRAGMENT
                        && SqlTableAccessDetector.NAME.equals(d.detector())));
    }

}
