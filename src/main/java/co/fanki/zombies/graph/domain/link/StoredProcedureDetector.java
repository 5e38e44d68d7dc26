package co.fanki.zombies.graph.domain.link;

import co.fanki.zombies.graph.domain.CodeSymbol;
import co.fanki.zombies.graph.domain.EdgeType;
import co.fanki.zombies.graph.domain.FileFacts;
import co.fanki.zombies.graph.domain.FragmentKind;
import co.fanki.zombies.graph.domain.SymbolKind;
import co.fanki.zombies.graph.domain.TextFragment;
import co.fanki.zombies.shared.DomainException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Emits {@code INVOKES} edges from data-access call sites to the stored
 * procedures they run.
 *
 * <p>Recognised forms: the JDBC escape {@code {call p(?)}} (optionally
 * {@code {? = call p}}), {@code CALL p}, {@code EXEC p},
 * {@code EXECUTE p} and the anonymous block {@code BEGIN p(...); END;}. A bare procedure name is accepted only as argument of
 * an API that takes nothing else, such as {@code withProcedureName} or
 * {@code callproc}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class StoredProcedureDetector implements LinkDetector {

    /** Detector name. */
    public static final String NAME = "stored-procedure";

    /** Confidence of an explicit call statement. */
    public static final double CALL_STRENGTH = 1.0;

    /** Confidence of a bare procedure name. */
    public static final double NAME_STRENGTH = 0.8;

    private static final String PROCEDURE =
            "((?:\\[[^\\]]+\\]|\"[^\"]+\"|[A-Za-z_][\\w$#]*)"
                    + "(?:\\.(?:\\[[^\\]]+\\]|\"[^\"]+\"|[A-Za-z_][\\w$#]*))*)";

    private static final Pattern JDBC_ESCAPE = Pattern.compile(
            "\\{\\s*(?:\\?\\s*=\\s*)?call\\s+" + PROCEDURE,
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CALL_STATEMENT = Pattern.compile(
            "(?:^|;|\\bBEGIN)\\s*(?:CALL|EXEC(?:UTE)?)\\s+(?:@\\w+\\s*=\\s*)?"
                    + PROCEDURE,
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private static final Pattern ANONYMOUS_BLOCK = Pattern.compile(
            "\\bBEGIN\\s+" + PROCEDURE + "\\s*[(;]",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern BARE_NAME = Pattern.compile(
            "^\\s*" + PROCEDURE + "\\s*$");

    /** Words that follow BEGIN without naming a procedure. */
    private static final Set<String> BLOCK_KEYWORDS = Set.of(
            "TRANSACTION", "TRAN", "WORK", "NULL", "END", "DECLARE",
            "IF", "FOR", "LOOP", "WHILE", "CALL", "EXEC", "EXECUTE");

    /** Calls whose only string argument is a procedure name. */
    private static final Set<String> NAME_CALLEES = Set.of(
            "withProcedureName", "callproc", "createStoredProcedureQuery",
            "executeProcedure", "StoredProcedureQuery");

    /** Calls dedicated to running procedures. */
    private static final Set<String> PROCEDURE_CALLEES = Set.of(
            "prepareCall", "withProcedureName", "callproc",
            "createStoredProcedureQuery", "executeProcedure",
            "StoredProcedureQuery");

    /** General statement calls that may carry a procedure call. */
    private static final Set<String> STATEMENT_CALLEES = Set.of(
            "execute", "executeQuery", "executeUpdate", "exec", "query",
            "update", "createNativeQuery", "sql");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supports(final FragmentKind kind, final String language) {
        return kind == FragmentKind.CALL_ARGUMENT
                || kind == FragmentKind.SQL_LITERAL;
    }

    @Override
    public void link(final FileFacts file, final TextFragment fragment,
            final LinkContext context) {
        final String callee = simpleCallee(fragment.callee());
        final boolean dedicated = PROCEDURE_CALLEES.contains(callee);
        if (fragment.kind() == FragmentKind.CALL_ARGUMENT && !dedicated
                && !STATEMENT_CALLEES.contains(callee)) {
            return;
        }

        List<String> procedures = procedureCalls(fragment.text());
        double strength = CALL_STRENGTH;
        if (procedures.isEmpty() && NAME_CALLEES.contains(callee)) {
            final Matcher bare = BARE_NAME.matcher(fragment.text());
            if (bare.matches()) {
                procedures = List.of(unquote(bare.group(1)));
                strength = NAME_STRENGTH;
            }
        }
        if (procedures.isEmpty()) {
            if (dedicated) {
                throw new DomainException("No procedure in " + callee
                        + " argument: " + fragment.text(),
                        "MALFORMED_FRAGMENT");
            }
            return;
        }

        final CodeSymbol owner = context.owner(fragment.ownerQualifiedName(),
                SymbolKind.FILE);
        for (final String procedure : procedures) {
            final CodeSymbol target = context.databaseEntity(
                    SymbolKind.STORED_PROCEDURE, procedure, NAME);
            context.edge(owner, target, EdgeType.INVOKES, strength);
        }
    }

    /**
     * Extracts the procedures an SQL text calls explicitly.
     *
     * @param sql the SQL text
     * @return the procedure names in order of appearance
     */
    static List<String> procedureCalls(final String sql) {
        final List<String> result = new ArrayList<>();
        final Matcher escape = JDBC_ESCAPE.matcher(sql);
        while (escape.find()) {
            result.add(unquote(escape.group(1)));
        }
        collect(CALL_STATEMENT.matcher(sql.trim()), result);
        collect(ANONYMOUS_BLOCK.matcher(sql), result);
        return result;
    }

    private static void collect(final Matcher matcher,
            final List<String> result) {
        while (matcher.find()) {
            final String name = unquote(matcher.group(1));
            if (!result.contains(name) && !BLOCK_KEYWORDS.contains(
                    name.toUpperCase(Locale.ROOT))) {
                result.add(name);
            }
        }
    }

    private static String simpleCallee(final String callee) {
        if (callee == null) {
            return "";
        }
        final int dot = callee.lastIndexOf('.');
        return dot < 0 ? callee : callee.substring(dot + 1);
    }

    private static String unquote(final String name) {
        return name.replace("[", "").replace("]", "").replace("\"", "");
    }

}
