package co.fanki.zombies.graph.domain;

import co.fanki.zombies.graph.domain.link.SemanticLinker;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Builders for the fact sets and graphs used across the test suite.
 *
 * <p>The "letters" graphs declare one method per letter in
 * {@code app::src/App.java}, container {@code app.App}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphFixtures {

    public static final String REPO = "app";

    public static final String PATH = "src/App.java";

    public static final String CONTAINER = "app.App";

    private GraphFixtures() {
    }

    public static GraphBuilder builder() {
        return new GraphBuilder(new SymbolTable(), SemanticLinker.defaults());
    }

    public static SymbolDeclaration method(final String container,
            final String name, final int line) {
        return SymbolDeclaration.of(name, container, SymbolKind.METHOD, line);
    }

    public static FileFacts java(final String repo, final String path,
            final List<SymbolDeclaration> declarations,
            final List<ReferenceFact> references) {
        return new FileFacts(repo, path, "java", declarations, references,
                List.of());
    }

    public static FileFacts java(final String repo, final String path,
            final List<SymbolDeclaration> declarations,
            final List<ReferenceFact> references,
            final List<TextFragment> fragments) {
        return new FileFacts(repo, path, "java", declarations, references,
                fragments);
    }

    public static String id(final String repo, final String path,
            final String qualifiedName) {
        return SymbolId.of(repo, path, qualifiedName).value();
    }

    /** @return the id of a letter method */
    public static String letter(final String name) {
        return id(REPO, PATH, CONTAINER + "." + name);
    }

    /**
     * Facts of the letters file.
     *
     * @param nodes the letters to declare
     * @param edges calls written as {@code "A>B"}
     * @return the file facts
     */
    public static FileFacts lettersFile(final List<String> nodes,
            final String... edges) {
        final List<SymbolDeclaration> declarations = new ArrayList<>();
        int line = 1;
        for (final String node : nodes) {
            declarations.add(method(CONTAINER, node, line++));
        }
        final List<ReferenceFact> references = new ArrayList<>();
        for (final String edge : edges) {
            final String[] ends = edge.split(">");
            references.add(ReferenceFact.of(CONTAINER + "." + ends[0],
                    CONTAINER + "." + ends[1], EdgeType.CALLS, line++));
        }
        return java(REPO, PATH, declarations, references);
    }

    /**
     * Builds and freezes a letters graph.
     *
     * @param nodes the letters to declare
     * @param roots the letters designated as controllers
     * @param edges calls written as {@code "A>B"}
     * @return the frozen graph
     */
    public static DependencyGraph letters(final List<String> nodes,
            final List<String> roots, final String... edges) {
        final List<RootDesignation> designations = new ArrayList<>();
        for (final String root : roots) {
            designations.add(new RootDesignation(CONTAINER + "." + root,
                    RootType.CONTROLLER));
        }
        return build(List.of(lettersFile(nodes, edges)), designations);
    }

    public static DependencyGraph build(final Collection<FileFacts> files,
            final Collection<RootDesignation> roots) {
        final GraphBuilder builder = builder();
        builder.ingestAll(files);
        builder.designateRoots(roots);
        return builder.freeze();
    }

}
