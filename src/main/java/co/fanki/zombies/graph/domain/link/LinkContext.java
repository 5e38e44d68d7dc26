package co.fanki.zombies.graph.domain.link;

import co.fanki.zombies.graph.domain.AccessKind;
import co.fanki.zombies.graph.domain.CodeSymbol;
import co.fanki.zombies.graph.domain.DependencyEdge;
import co.fanki.zombies.graph.domain.Diagnostic;
import co.fanki.zombies.graph.domain.DiagnosticKind;
import co.fanki.zombies.graph.domain.EdgeType;
import co.fanki.zombies.graph.domain.FileFacts;
import co.fanki.zombies.graph.domain.SymbolId;
import co.fanki.zombies.graph.domain.SymbolKind;
import co.fanki.zombies.graph.domain.SymbolTable;
import co.fanki.zombies.shared.Preconditions;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * What a {@link LinkDetector} sees of the graph while processing one file.
 *
 * <p>Every edge and diagnostic emitted through a context is tagged with the
 * file the context was opened for, so it can be withdrawn when that file is
 * ingested again.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class LinkContext {

    private final SymbolTable symbols;
    private final FileFacts file;
    private final Consumer<DependencyEdge> edges;
    private final Consumer<Diagnostic> diagnostics;

    /**
     * Creates a context.
     *
     * @param theSymbols the symbol table
     * @param theFile the file being processed
     * @param theEdges where emitted edges go
     * @param theDiagnostics where emitted diagnostics go
     */
    public LinkContext(final SymbolTable theSymbols, final FileFacts theFile,
            final Consumer<DependencyEdge> theEdges,
            final Consumer<Diagnostic> theDiagnostics) {
        this.symbols = Preconditions.requireNonNull(theSymbols,
                "Symbol table is required");
        this.file = Preconditions.requireNonNull(theFile,
                "File facts are required");
        this.edges = Preconditions.requireNonNull(theEdges,
                "Edge sink is required");
        this.diagnostics = Preconditions.requireNonNull(theDiagnostics,
                "Diagnostic sink is required");
    }

    /** @return the symbol table */
    public SymbolTable symbols() {
        return symbols;
    }

    /** @return the {@code repo::path} key of the file being processed */
    public String fileKey() {
        return file.fileKey();
    }

    /**
     * Returns the symbol a fragment belongs to.
     *
     * <p>The enclosing symbol declared in this file when the fragment names
     * one; otherwise the node standing for the file itself.</p>
     *
     * @param ownerQualifiedName the fragment owner, may be null
     * @param fileKind the kind of the file node if one is needed
     * @return the owner symbol
     */
    public CodeSymbol owner(final String ownerQualifiedName,
            final SymbolKind fileKind) {
        if (ownerQualifiedName != null && !ownerQualifiedName.isBlank()) {
            final Optional<CodeSymbol> declared = symbols.find(SymbolId.of(
                    file.repository(), file.filePath(), ownerQualifiedName)
                    .value());
            if (declared.isPresent()) {
                return declared.get();
            }
        }
        return fileNode(fileKind);
    }

    /**
     * Returns the node standing for the file, creating it on first use.
     *
     * @param kind {@link SymbolKind#FILE} or
     *        {@link SymbolKind#SCHEDULER_SCRIPT}
     * @return the file node
     */
    public CodeSymbol fileNode(final SymbolKind kind) {
        return symbols.upsert(CodeSymbol.fileOf(file.repository(),
                file.filePath(), file.language(), kind));
    }

    /**
     * Returns the declared database entity of a name, or a phantom that
     * stands in for it. Phantom use is recorded as a diagnostic.
     *
     * @param kind the entity kind
     * @param name the referenced name
     * @param detector the detector asking, for the diagnostic
     * @return the entity symbol
     */
    public CodeSymbol databaseEntity(final SymbolKind kind, final String name,
            final String detector) {
        final CodeSymbol entity = symbols.databaseEntityOrPhantom(kind, name);
        if (entity.phantom()) {
            diagnose(DiagnosticKind.PHANTOM_CREATED, detector, entity.id(),
                    kind + " " + name + " is referenced but never declared");
        }
        return entity;
    }

    /**
     * Returns the symbols with a qualified name.
     *
     * @param qualifiedName the qualified name
     * @return the matches in declaration order
     */
    public List<CodeSymbol> byQualifiedName(final String qualifiedName) {
        return symbols.byQualifiedName(qualifiedName);
    }

    /**
     * Emits an edge from this file.
     *
     * <p>Self references are ignored.</p>
     *
     * @param source the dependent symbol
     * @param target the dependency
     * @param type the relationship, not ACCESSES
     * @param strength the confidence
     */
    public void edge(final CodeSymbol source, final CodeSymbol target,
            final EdgeType type, final double strength) {
        if (source.id().equals(target.id())) {
            return;
        }
        edges.accept(new DependencyEdge(source.id(), target.id(), type, null,
                strength, false, "", fileKey()));
    }

    /**
     * Emits a table access edge from this file.
     *
     * @param source the accessing symbol
     * @param table the table
     * @param access read or write
     * @param strength the confidence
     */
    public void access(final CodeSymbol source, final CodeSymbol table,
            final AccessKind access, final double strength) {
        if (source.id().equals(table.id())) {
            return;
        }
        edges.accept(new DependencyEdge(source.id(), table.id(),
                EdgeType.ACCESSES, access, strength, false, "", fileKey()));
    }

    /**
     * Records a diagnostic about this file.
     *
     * @param kind the category
     * @param detector the detector name
     * @param subject what the finding is about
     * @param message the description
     */
    public void diagnose(final DiagnosticKind kind, final String detector,
            final String subject, final String message) {
        diagnostics.accept(new Diagnostic(kind, detector, subject, message,
                fileKey()));
    }

}
