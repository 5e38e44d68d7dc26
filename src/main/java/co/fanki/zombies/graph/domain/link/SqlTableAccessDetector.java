package co.fanki.zombies.graph.domain.link;

import co.fanki.zombies.graph.domain.CodeSymbol;
import co.fanki.zombies.graph.domain.DiagnosticKind;
import co.fanki.zombies.graph.domain.FileFacts;
import co.fanki.zombies.graph.domain.FragmentKind;
import co.fanki.zombies.graph.domain.SymbolId;
import co.fanki.zombies.graph.domain.SymbolKind;
import co.fanki.zombies.graph.domain.TextFragment;
import co.fanki.zombies.shared.DomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Emits {@code ACCESSES} edges from code and mapping statements to the
 * tables their SQL reads or writes.
 *
 * <p>SQL string literals and data-access call arguments are attributed to
 * their enclosing symbol; mapping statements to their
 * {@link SymbolKind#XML_STATEMENT} node. Tables never declared are
 * represented by phantom nodes.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SqlTableAccessDetector implements LinkDetector {

    private static final Logger LOG = LoggerFactory.getLogger(
            SqlTableAccessDetector.class);

    /** Detector name. */
    public static final String NAME = "sql-table-access";

    /** Confidence of an access inferred from SQL text. */
    public static final double STRENGTH = 0.9;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supports(final FragmentKind kind, final String language) {
        return kind == FragmentKind.SQL_LITERAL
                || kind == FragmentKind.CALL_ARGUMENT
                || kind == FragmentKind.MAPPER_XML;
    }

    @Override
    public void link(final FileFacts file, final TextFragment fragment,
            final LinkContext context) {
        if (fragment.kind() == FragmentKind.MAPPER_XML) {
            linkMapper(file, fragment, context);
            return;
        }
        if (!SqlStatements.isSql(fragment.text())) {
            return;
        }
        final CodeSymbol owner = context.owner(fragment.ownerQualifiedName(),
                SymbolKind.FILE);
        emit(owner, fragment.text(), context);
    }

    private void linkMapper(final FileFacts file, final TextFragment fragment,
            final LinkContext context) {
        final MapperXml mapper = MapperXml.parse(fragment.text());
        for (final MapperXml.Statement statement : mapper.statements()) {
            final String statementId = SymbolId.of(file.repository(),
                    file.filePath(), mapper.namespace()
                            + OrmMappingDetector.STATEMENT_SEPARATOR
                            + statement.id()).value();
            final Optional<CodeSymbol> node = context.symbols()
                    .find(statementId);
            if (node.isEmpty()) {
                continue;
            }
            try {
                emit(node.get(), statement.sql(), context);
            } catch (DomainException e) {
                LOG.warn("Skipping statement {} of {}: {}", statement.id(),
                        file.fileKey(), e.getMessage());
                context.diagnose(DiagnosticKind.MALFORMED_FRAGMENT, NAME,
                        statementId, e.getMessage());
            }
        }
    }

    private void emit(final CodeSymbol owner, final String sql,
            final LinkContext context) {
        for (final SqlStatements.TableAccess access
                : SqlStatements.accesses(sql)) {
            final CodeSymbol table = context.databaseEntity(
                    SymbolKind.DB_TABLE, access.table(), NAME);
            context.access(owner, table, access.access(), STRENGTH);
        }
    }

}
