package co.fanki.zombies.graph.domain.link;

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
 * Unit tests for {@link StoredProcedureDetector}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class StoredProcedureDetectorTest {

    private static final String OWNER = "com.x.BillingDao.close";

    private static final String OWNER_ID = id("billing",
            "src/BillingDao.java", OWNER);

    private static FileFacts dao(final String callee, final String text) {
        return java("billing", "src/BillingDao.java",
                List.of(method("com.x.BillingDao", "close", 10)), List.of(),
                List.of(new TextFragment(FragmentKind.CALL_ARGUMENT, OWNER,
                        callee, text, 12)));
    }

    private static FileFacts procedures() {
        return new FileFacts("db", "sql/procs.sql", "sql",
                List.of(SymbolDeclaration.of("close_month", null,
                        SymbolKind.STORED_PROCEDURE, 1)), List.of(),
                List.of());
    }

    private static List<DependencyEdge> invocations(
            final DependencyGraph graph) {
        return graph.edges().stream()
                .filter(e -> e.type() == EdgeType.INVOKES)
                .toList();
    }

    @Test
    void whenExtracting_givenCallSyntaxes_shouldFindProcedures() {
        assertEquals(List.of("billing.close_month"),
                StoredProcedureDetector.procedureCalls(
                        "{call billing.close_month(?, ?)}"));
        assertEquals(List.of("f_total"),
                StoredProcedureDetector.procedureCalls("{? = call f_total(?)}"));
        assertEquals(List.of("dbo.sp_rebuild"),
                StoredProcedureDetector.procedureCalls(
                        "EXEC dbo.sp_rebuild @full = 1"));
        assertEquals(List.of("dbo.sp_next"),
                StoredProcedureDetector.procedureCalls(
                        "EXECUTE @rc = [dbo].[sp_next]"));
        assertEquals(List.of("pkg.run_batch"),
                StoredProcedureDetector.procedureCalls(
                        "BEGIN pkg.run_batch(1); END;"));
    }

    @Test
    void whenExtracting_givenBlockKeywords_shouldNotReportThem() {
        assertTrue(StoredProcedureDetector.procedureCalls(
                "BEGIN TRANSACTION; UPDATE t SET a = 1; COMMIT;").isEmpty());
        assertTrue(StoredProcedureDetector.procedureCalls(
                "SELECT * FROM orders").isEmpty());
    }

    @Test
    void whenLinking_givenDeclaredProcedure_shouldInvokeIt() {
        final DependencyGraph graph = GraphFixtures.build(List.of(
                dao("conn.prepareCall", "{call billing.close_month(?)}"),
                procedures()), List.of());

        final List<DependencyEdge> edges = invocations(graph);
        assertEquals(1, edges.size());
        assertEquals(OWNER_ID, edges.get(0).sourceId());
        assertEquals(id("db", "sql/procs.sql", "close_month"),
                edges.get(0).targetId());
        assertEquals(StoredProcedureDetector.CALL_STRENGTH,
                edges.get(0).strength());
    }

    @Test
    void whenLinking_givenUndeclaredProcedure_shouldInvokePhantom() {
        final DependencyGraph graph = GraphFixtures.build(List.of(
                dao("jdbc.execute", "EXEC archive_orders")), List.of());

        final String phantom = "<phantom>::stored_procedure::archive_orders";
        assertEquals(phantom, invocations(graph).get(0).targetId());
        assertTrue(graph.symbol(phantom).orElseThrow().phantom());
        assertTrue(graph.diagnostics().stream().anyMatch(d ->
                d.kind() == DiagnosticKind.PHANTOM_CREATED
                        && d.subject().equals(phantom)));
    }

    @Test
    void whenLinking_givenBareNameToProcedureApi_shouldUseNameStrength() {
        final DependencyGraph graph = GraphFixtures.build(List.of(
                dao("call.withProcedureName", "close_month"), procedures()),
                List.of());

        final DependencyEdge edge = invocations(graph).get(0);
        assertEquals(id("db", "sql/procs.sql", "close_month"),
                edge.targetId());
        assertEquals(StoredProcedureDetector.NAME_STRENGTH, edge.strength());
    }

    @Test
    void whenLinking_givenPlainQuery_shouldNotInvokeAnything() {
        final DependencyGraph graph = GraphFixtures.build(List.of(
                dao("jdbc.executeQuery", "SELECT * FROM t")), List.of());

        assertTrue(invocations(graph).isEmpty());
    }

    @Test
    void whenLinking_givenPrepareCallWithoutProcedure_shouldDiagnose() {
        final DependencyGraph graph = GraphFixtures.build(List.of(
                dao("conn.prepareCall", "SELECT 1")), List.of());

        assertTrue(invocations(graph).isEmpty());
        assertTrue(graph.diagnostics().stream().anyMatch(d ->
                d.kind() == DiagnosticKind.MALFORMED_FRAGMENT
                        && StoredProcedureDetector.NAME.equals(d.detector())
                        && d.subject().equals(
                                "billing::src/BillingDao.java:12")));
    }

}
