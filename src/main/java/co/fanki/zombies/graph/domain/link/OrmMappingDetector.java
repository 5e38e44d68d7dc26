package co.fanki.zombies.graph.domain.link;

import co.fanki.zombies.graph.domain.CodeSymbol;
import co.fanki.zombies.graph.domain.DependencyEdge;
import co.fanki.zombies.graph.domain.DiagnosticKind;
import co.fanki.zombies.graph.domain.EdgeType;
import co.fanki.zombies.graph.domain.FileFacts;
import co.fanki.zombies.graph.domain.FragmentKind;
import co.fanki.zombies.graph.domain.SourceRange;
import co.fanki.zombies.graph.domain.SymbolDeclaration;
import co.fanki.zombies.graph.domain.SymbolId;
import co.fanki.zombies.graph.domain.SymbolKind;
import co.fanki.zombies.graph.domain.TextFragment;
import co.fanki.zombies.graph.domain.Visibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Links mapper interface methods to the statements of their ORM mapping
 * file.
 *
 * <p>Indexing parses every mapping file and declares one
 * {@link SymbolKind#XML_STATEMENT} node per statement, named
 * {@code namespace#id}. Linking then emits an {@link EdgeType#IMPLEMENTS}
 * edge from the method {@code namespace.id} to its statement. The edge is
 * emitted from both sides, the mapping file and the interface file, so it
 * survives re-ingestion of either one.</p>
 *
 * <p>A statement without a method, or a method of a mapped namespace
 * without a statement, is reported as a diagnostic; no edge is guessed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class OrmMappingDetector implements LinkDetector {

    private static final Logger LOG = LoggerFactory.getLogger(
            OrmMappingDetector.class);

    /** Detector name. */
    public static final String NAME = "orm-mapping";

    /** Separator between namespace and statement id in statement names. */
    public static final String STATEMENT_SEPARATOR = "#";

    /** Mapping files by file key. */
    private final Map<String, MapperXml> mappers = new ConcurrentHashMap<>();

    /** Mapping file keys by namespace. */
    private final Map<String, Set<String>> namespaces =
            new ConcurrentHashMap<>();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supports(final FragmentKind kind, final String language) {
        return kind == FragmentKind.MAPPER_XML;
    }

    @Override
    public void index(final FileFacts file, final TextFragment fragment,
            final LinkContext context) {
        final MapperXml mapper = MapperXml.parse(fragment.text());
        mappers.put(file.fileKey(), mapper);

        for (final MapperXml.Statement statement : mapper.statements()) {
            context.symbols().intern(
                    new SymbolDeclaration(statement.id(), mapper.namespace(),
                            statementName(mapper, statement),
                            SymbolKind.XML_STATEMENT,
                            SourceRange.line(statement.line()),
                            Visibility.PUBLIC, Map.of("tag", statement.tag())),
                    file);
        }
        namespaces.computeIfAbsent(mapper.namespace(),
                k -> ConcurrentHashMap.newKeySet()).add(file.fileKey());

        LOG.debug("Indexed {} statements of {} from {}",
                mapper.statements().size(), mapper.namespace(),
                file.fileKey());
    }

    @Override
    public void link(final FileFacts file, final TextFragment fragment,
            final LinkContext context) {
        final MapperXml mapper = mappers.get(file.fileKey());
        if (mapper == null) {
            return;
        }
        for (final MapperXml.Statement statement : mapper.statements()) {
            final String statementId = SymbolId.of(file.repository(),
                    file.filePath(), statementName(mapper, statement))
                    .value();
            final Optional<CodeSymbol> node = context.symbols()
                    .find(statementId);
            if (node.isEmpty()) {
                continue;
            }
            final List<CodeSymbol> methods = mapperMethods(context,
                    mapper.qualify(statement));
            if (methods.isEmpty()) {
                context.diagnose(DiagnosticKind.UNMATCHED_MAPPER_STATEMENT,
                        NAME, statementId, "Statement " + statement.id()
                                + " has no method in " + mapper.namespace());
                continue;
            }
            for (final CodeSymbol method : methods) {
                context.edge(method, node.get(), EdgeType.IMPLEMENTS,
                        DependencyEdge.FULL_STRENGTH);
            }
        }
    }

    @Override
    public void linkFile(final FileFacts file, final LinkContext context) {
        for (final SymbolDeclaration declaration : file.declarations()) {
            final String namespace = namespaceOf(declaration);
            if (declaration.kind() != SymbolKind.METHOD || namespace == null) {
                continue;
            }
            final List<CodeSymbol> statements = context.byQualifiedName(
                    namespace + STATEMENT_SEPARATOR + declaration.name())
                    .stream()
                    .filter(s -> s.kind() == SymbolKind.XML_STATEMENT)
                    .toList();
            final String methodName = namespace + "." + declaration.name();

            if (statements.isEmpty()) {
                final Set<String> mapperFiles = namespaces.get(namespace);
                if (mapperFiles != null && !mapperFiles.isEmpty()) {
                    context.diagnose(DiagnosticKind.UNMATCHED_MAPPER_METHOD,
                            NAME, methodName, "Mapper method " + methodName
                                    + " has no mapping statement");
                }
                continue;
            }
            for (final CodeSymbol method : mapperMethods(context,
                    methodName)) {
                for (final CodeSymbol statement : statements) {
                    context.edge(method, statement, EdgeType.IMPLEMENTS,
                            DependencyEdge.FULL_STRENGTH);
                }
            }
        }
    }

    @Override
    public void forget(final String fileKey) {
        final MapperXml mapper = mappers.remove(fileKey);
        if (mapper == null) {
            return;
        }
        final Set<String> mapperFiles = namespaces.get(mapper.namespace());
        if (mapperFiles != null) {
            mapperFiles.remove(fileKey);
        }
    }

    /**
     * The mapper namespace a method would belong to: its container, or the
     * qualified name without the method name when no container was given.
     */
    static String namespaceOf(final SymbolDeclaration declaration) {
        if (declaration.container() != null) {
            return declaration.container();
        }
        final String qualified = declaration.qualifiedName();
        if (qualified == null) {
            return null;
        }
        final String suffix = "." + declaration.name();
        if (qualified.endsWith(suffix)
                && qualified.length() > suffix.length()) {
            return qualified.substring(0, qualified.length() - suffix.length());
        }
        return null;
    }

    private static String statementName(final MapperXml mapper,
            final MapperXml.Statement statement) {
        return mapper.namespace() + STATEMENT_SEPARATOR + statement.id();
    }

    private static List<CodeSymbol> mapperMethods(final LinkContext context,
            final String qualifiedName) {
        return context.byQualifiedName(qualifiedName).stream()
                .filter(s -> s.kind() == SymbolKind.METHOD
                        || s.kind() == SymbolKind.FUNCTION)
                .toList();
    }

}
