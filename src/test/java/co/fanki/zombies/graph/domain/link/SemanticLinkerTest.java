package co.fanki.zombies.graph.domain.link;

import co.fanki.zombies.graph.domain.CodeSymbol;
import co.fanki.zombies.graph.domain.DependencyEdge;
import co.fanki.zombies.graph.domain.Diagnostic;
import co.fanki.zombies.graph.domain.DiagnosticKind;
import co.fanki.zombies.graph.domain.EdgeType;
import co.fanki.zombies.graph.domain.FileFacts;
import co.fanki.zombies.graph.domain.FragmentKind;
import co.fanki.zombies.graph.domain.SymbolKind;
import co.fanki.zombies.graph.domain.SymbolTable;
import co.fanki.zombies.graph.domain.TextFragment;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static co.fanki.zombies.graph.domain.GraphFixtures.java;
import static co.fanki.zombies.graph.domain.GraphFixtures.method;
import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.anyString;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link SemanticLinker}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SemanticLinkerTest {

    private final List<DependencyEdge> edges = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    private static FileFacts file() {
        return java("app", "src/Jobs.java",
                List.of(method("app.Jobs", "run", 3)), List.of(),
                List.of(new TextFragment(FragmentKind.SQL_LITERAL,
                        "app.Jobs.run", null, "SELECT * FROM jobs", 4),
                        new TextFragment(FragmentKind.SQL_LITERAL,
                                "app.Jobs.run", null, "SELECT * FROM runs",
                                5)));
    }

    private LinkContext context(final SymbolTable symbols,
            final FileFacts file) {
        return new LinkContext(symbols, file, edges::add, diagnostics::add);
    }

    @Test
    void whenLinking_givenFailingDetector_shouldDiagnoseAndRunTheOthers() {
        final SymbolTable symbols = new SymbolTable();
        final FileFacts file = file();
        file.declarations().forEach(d -> symbols.intern(d, file));

        final LinkDetector failing = createMock(LinkDetector.class);
        expect(failing.supports(anyObject(FragmentKind.class), anyString()))
                .andReturn(true).anyTimes();
        expect(failing.name()).andReturn("failing").anyTimes();
        failing.link(eq(file), anyObject(TextFragment.class),
                anyObject(LinkContext.class));
        expectLastCall().andThrow(new IllegalStateException("boom")).times(2);
        failing.linkFile(eq(file), anyObject(LinkContext.class));
        replay(failing);

        final SemanticLinker linker = new SemanticLinker(
                List.of(failing, new SqlTableAccessDetector()));
        linker.link(file, context(symbols, file));

        verify(failing);
        assertEquals(2, diagnostics.stream()
                .filter(d -> d.kind() == DiagnosticKind.MALFORMED_FRAGMENT
                        && "failing".equals(d.detector()))
                .count());
        assertTrue(diagnostics.stream().anyMatch(d ->
                d.subject().equals("app::src/Jobs.java:4")));
        assertEquals(2, edges.size());
        assertTrue(edges.stream().allMatch(e ->
                e.type() == EdgeType.ACCESSES));
    }

    @Test
    void whenLinking_givenFailingFileHook_shouldDiagnoseWithFileSubject() {
        final SymbolTable symbols = new SymbolTable();
        final FileFacts file = java("app", "src/Empty.java", List.of(),
                List.of());

        final LinkDetector detector = new LinkDetector() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public boolean supports(final FragmentKind kind,
                    final String language) {
                return false;
            }

            @Override
            public void link(final FileFacts f, final TextFragment fragment,
                    final LinkContext c) {
            }

            @Override
            public void linkFile(final FileFacts f, final LinkContext c) {
                throw new IllegalArgumentException("bad declarations");
            }
        };

        new SemanticLinker(List.of(detector)).link(file,
                context(symbols, file));

        assertEquals(1, diagnostics.size());
        assertEquals("app::src/Empty.java", diagnostics.get(0).subject());
        assertEquals("bad declarations", diagnostics.get(0).message());
    }

    @Test
    void whenForgetting_givenFile_shouldTellEveryDetector() {
        final LinkDetector first = createMock(LinkDetector.class);
        final LinkDetector second = createMock(LinkDetector.class);
        first.forget("app::src/Jobs.java");
        second.forget("app::src/Jobs.java");
        replay(first, second);

        new SemanticLinker(List.of(first, second))
                .forget("app::src/Jobs.java");

        verify(first, second);
    }

    @Test
    void whenIndexing_givenDefaults_shouldDeclareNothingForPlainCode() {
        final SymbolTable symbols = new SymbolTable();
        final FileFacts file = file();
        file.declarations().forEach(d -> symbols.intern(d, file));

        SemanticLinker.defaults().index(file, context(symbols, file));

        assertEquals(1, symbols.size());
        final CodeSymbol run = symbols.all().get(0);
        assertEquals(SymbolKind.METHOD, run.kind());
        assertEquals(4, SemanticLinker.defaults().detectors().size());
    }

    @Test
    void whenCreating_givenDisabledFamilies_shouldOnlyRegisterEnabledOnes() {
        final SemanticLinker linker = SemanticLinker.of(
                new SemanticLinkConfig(false, true, false, true));

        assertEquals(List.of(StoredProcedureDetector.NAME,
                SqlTableAccessDetector.NAME), linker.detectors().stream()
                        .map(LinkDetector::name).toList());
    }

}
