package co.fanki.zombies.graph.domain.link;

import co.fanki.zombies.graph.domain.AccessKind;
import co.fanki.zombies.shared.DomainException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight SQL classifier: which tables a statement reads and writes.
 *
 * <p>Not a parser. The text is stripped of comments, string literals and
 * mapper placeholders, tokenized, and scanned for the clauses that name
 * tables: {@code INSERT INTO}, {@code UPDATE}, {@code DELETE FROM} and
 * {@code MERGE INTO} write; {@code FROM}, {@code JOIN} and
 * {@code USING} read. Common table expression names are not tables.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SqlStatements {

    private static final Pattern LINE_COMMENT = Pattern.compile("--[^\\n]*");

    private static final Pattern BLOCK_COMMENT = Pattern.compile(
            "/\\*.*?\\*/", Pattern.DOTALL);

    private static final Pattern STRING_LITERAL = Pattern.compile(
            "'(?:[^']|'')*'");

    private static final Pattern PLACEHOLDER = Pattern.compile(
            "[#$]\\{[^}]*}");

    private static final String NAME_PART =
            "(?:\"[^\"]+\"|`[^`]+`|\\[[^\\]]+\\]|[A-Za-z_][\\w$#@]*)";

    private static final Pattern TOKEN = Pattern.compile(
            NAME_PART + "(?:\\s*\\.\\s*" + NAME_PART + ")*|[(),;]|\\S");

    private static final Pattern CTE_NAME = Pattern.compile(
            "(?i)(?:\\bWITH(?:\\s+RECURSIVE)?|,)\\s*([A-Za-z_][\\w$]*)"
                    + "\\s*(?:\\([^)]*\\)\\s*)?AS\\s*\\(");

    private static final Set<String> STATEMENT_KEYWORDS = Set.of(
            "SELECT", "WITH", "INSERT", "UPDATE", "DELETE", "MERGE");

    private static final Set<String> RESERVED = Set.of(
            "SELECT", "FROM", "WHERE", "GROUP", "ORDER", "HAVING", "LIMIT",
            "OFFSET", "JOIN", "INNER", "LEFT", "RIGHT", "FULL", "OUTER",
            "CROSS", "NATURAL", "ON", "UNION", "INTERSECT", "EXCEPT",
            "MINUS", "SET", "VALUES", "AS", "USING", "WHEN", "THEN", "INTO",
            "WITH", "RETURNING", "FOR", "WINDOW", "FETCH", "CONNECT",
            "START", "LATERAL", "DUAL", "ALL", "DISTINCT", "AND", "OR",
            "NOT", "IN", "EXISTS", "BY", "DEFAULT", "OUTPUT", "KEY",
            "DUPLICATE", "IGNORE", "ONLY", "TOP");

    private SqlStatements() {
    }

    /**
     * Checks if a text starts like a data-manipulation statement.
     *
     * @param text the text
     * @return true if the first word is a DML keyword
     */
    public static boolean isSql(final String text) {
        for (final String token : tokenize(clean(text))) {
            if ("(".equals(token)) {
                continue;
            }
            return STATEMENT_KEYWORDS.contains(upper(token));
        }
        return false;
    }

    /**
     * Extracts the table accesses of one or more statements.
     *
     * @param sql the SQL text
     * @return the accesses, in the order first seen, without duplicates
     * @throws DomainException with code {@code MALFORMED_FRAGMENT} if a
     *         clause that must name a table does not, or parentheses are
     *         unbalanced
     */
    public static List<TableAccess> accesses(final String sql) {
        final String cleaned = clean(sql);
        final List<String> tokens = tokenize(cleaned);
        checkBalanced(tokens);

        final Set<String> cteNames = new HashSet<>();
        final Matcher cte = CTE_NAME.matcher(cleaned);
        while (cte.find()) {
            cteNames.add(cte.group(1).toLowerCase(Locale.ROOT));
        }

        final Set<TableAccess> result = new LinkedHashSet<>();
        for (int i = 0; i < tokens.size(); i++) {
            final String word = upper(tokens.get(i));
            final String previous = i > 0 ? upper(tokens.get(i - 1)) : "";
            switch (word) {
                case "INSERT", "MERGE" -> {
                    final int at = skip(tokens, i + 1, "INTO", "IGNORE");
                    add(result, cteNames, target(tokens, at, word),
                            AccessKind.WRITE);
                }
                case "UPDATE" -> {
                    if (!"KEY".equals(previous) && !"FOR".equals(previous)) {
                        final int at = skip(tokens, i + 1, "ONLY");
                        add(result, cteNames, target(tokens, at, word),
                                AccessKind.WRITE);
                    }
                }
                case "DELETE" -> {
                    final int at = skip(tokens, i + 1, "FROM");
                    add(result, cteNames, target(tokens, at, word),
                            AccessKind.WRITE);
                    i = at;
                }
                case "FROM" -> readList(tokens, i + 1, result, cteNames);
                case "JOIN", "USING" -> {
                    final int at = skip(tokens, i + 1, "ONLY", "LATERAL");
                    if (at < tokens.size() && isName(tokens.get(at))
                            && !isFunctionCall(tokens, at)) {
                        add(result, cteNames, tokens.get(at),
                                AccessKind.READ);
                    }
                }
                default -> {
                    // not a table clause
                }
            }
        }
        return List.copyOf(result);
    }

    private static void readList(final List<String> tokens, final int from,
            final Set<TableAccess> result, final Set<String> cteNames) {
        int i = skip(tokens, from, "ONLY", "LATERAL");
        while (i < tokens.size() && isName(tokens.get(i))) {
            if (!isFunctionCall(tokens, i)) {
                add(result, cteNames, tokens.get(i), AccessKind.READ);
            }
            i++;
            if (i < tokens.size() && "AS".equals(upper(tokens.get(i)))) {
                i++;
            }
            if (i < tokens.size() && isName(tokens.get(i))) {
                i++;
            }
            if (i < tokens.size() && ",".equals(tokens.get(i))) {
                i++;
            } else {
                return;
            }
        }
    }

    private static String target(final List<String> tokens, final int at,
            final String clause) {
        if (at >= tokens.size() || !isName(tokens.get(at))) {
            throw new DomainException(clause + " names no table",
                    "MALFORMED_FRAGMENT");
        }
        return tokens.get(at);
    }

    private static void add(final Set<TableAccess> result,
            final Set<String> cteNames, final String name,
            final AccessKind access) {
        final String table = unquote(name);
        if (cteNames.contains(table.toLowerCase(Locale.ROOT))) {
            return;
        }
        result.add(new TableAccess(table, access));
    }

    private static int skip(final List<String> tokens, final int from,
            final String... optional) {
        int i = from;
        boolean skipped = true;
        while (skipped && i < tokens.size()) {
            skipped = false;
            for (final String word : optional) {
                if (word.equals(upper(tokens.get(i)))) {
                    i++;
                    skipped = true;
                    break;
                }
            }
        }
        return i;
    }

    private static boolean isName(final String token) {
        if (token.length() == 1 && !Character.isLetter(token.charAt(0))
                && token.charAt(0) != '_') {
            return false;
        }
        final char first = token.charAt(0);
        if (first == '"' || first == '`' || first == '[') {
            return true;
        }
        return !RESERVED.contains(upper(token))
                && (Character.isLetter(first) || first == '_');
    }

    private static boolean isFunctionCall(final List<String> tokens,
            final int at) {
        return at + 1 < tokens.size() && "(".equals(tokens.get(at + 1));
    }

    private static void checkBalanced(final List<String> tokens) {
        int depth = 0;
        for (final String token : tokens) {
            if ("(".equals(token)) {
                depth++;
            } else if (")".equals(token)) {
                depth--;
            }
            if (depth < 0) {
                break;
            }
        }
        if (depth != 0) {
            throw new DomainException("Unbalanced parentheses in SQL",
                    "MALFORMED_FRAGMENT");
        }
    }

    private static String clean(final String sql) {
        String text = sql == null ? "" : sql;
        text = BLOCK_COMMENT.matcher(text).replaceAll(" ");
        text = LINE_COMMENT.matcher(text).replaceAll(" ");
        text = STRING_LITERAL.matcher(text).replaceAll(" '' ");
        return PLACEHOLDER.matcher(text).replaceAll(" ? ");
    }

    private static List<String> tokenize(final String text) {
        final List<String> tokens = new ArrayList<>();
        final Matcher matcher = TOKEN.matcher(text == null ? "" : text);
        while (matcher.find()) {
            tokens.add(matcher.group().replaceAll("\\s+", ""));
        }
        return tokens;
    }

    private static String unquote(final String name) {
        return name.replace("\"", "").replace("`", "")
                .replace("[", "").replace("]", "");
    }

    private static String upper(final String token) {
        return token.toUpperCase(Locale.ROOT);
    }

    /**
     * One table touched by a statement.
     *
     * @param table the table name as written, optionally schema-qualified
     * @param access read or write
     */
    public record TableAccess(String table, AccessKind access) {}

}
