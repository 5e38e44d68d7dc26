package co.fanki.zombies.graph.domain.link;

import co.fanki.zombies.graph.domain.CodeSymbol;
import co.fanki.zombies.graph.domain.DiagnosticKind;
import co.fanki.zombies.graph.domain.EdgeType;
import co.fanki.zombies.graph.domain.FileFacts;
import co.fanki.zombies.graph.domain.FragmentKind;
import co.fanki.zombies.graph.domain.SymbolKind;
import co.fanki.zombies.graph.domain.TextFragment;
import co.fanki.zombies.shared.DomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Emits {@code TRIGGERS} edges from scheduler scripts to the procedures
 * and tables they touch through database command-line clients.
 *
 * <p>Recognised: {@code psql -c}, {@code mysql -e}, {@code sqlcmd},
 * {@code isql} and {@code osql -Q}, {@code db2}, {@code bcp}, here-documents
 * fed to {@code sqlplus} (or any client), and bare {@code EXEC} or
 * {@code CALL} lines. Each line is processed on its own; a line that cannot
 * be tokenized is reported and skipped.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SchedulerScriptDetector implements LinkDetector {

    private static final Logger LOG = LoggerFactory.getLogger(
            SchedulerScriptDetector.class);

    /** Detector name. */
    public static final String NAME = "scheduler-script";

    /** Confidence of a link read from a client invocation. */
    public static final double STRENGTH = 0.9;

    private static final Pattern HEREDOC = Pattern.compile(
            "<<-?\\s*['\"]?([A-Za-z_]\\w*)['\"]?");

    private static final Set<String> SQL_KEYWORDS = Set.of(
            "exec", "execute", "call");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supports(final FragmentKind kind, final String language) {
        return kind == FragmentKind.SCRIPT;
    }

    @Override
    public void link(final FileFacts file, final TextFragment fragment,
            final LinkContext context) {
        final CodeSymbol script = context.fileNode(
                SymbolKind.SCHEDULER_SCRIPT);

        String heredocEnd = null;
        final StringBuilder heredoc = new StringBuilder();
        int heredocLine = 0;

        for (final Line line : logicalLines(fragment.text(),
                fragment.line())) {
            if (heredocEnd != null) {
                if (line.text().trim().equals(heredocEnd)) {
                    guarded(line.number(), context, () ->
                            triggerSql(heredoc.toString(), script, context));
                    heredocEnd = null;
                    heredoc.setLength(0);
                } else {
                    heredoc.append(line.text()).append('\n');
                }
                continue;
            }

            final String trimmed = line.text().trim();
            if (trimmed.isEmpty() || isComment(trimmed)) {
                continue;
            }

            String command = line.text();
            final Matcher marker = HEREDOC.matcher(command);
            if (marker.find()) {
                heredocEnd = marker.group(1);
                heredocLine = line.number();
                command = command.substring(0, marker.start());
            }
            final String shellLine = command;
            guarded(line.number(), context, () -> {
                for (final List<String> words : ShellWords.split(shellLine)) {
                    command(words, script, context);
                }
            });
        }

        if (heredocEnd != null && heredoc.length() > 0) {
            LOG.debug("Here-document from line {} of {} is not terminated",
                    heredocLine, file.fileKey());
            guarded(heredocLine, context, () ->
                    triggerSql(heredoc.toString(), script, context));
        }
    }

    private void command(final List<String> words, final CodeSymbol script,
            final LinkContext context) {
        final String program = program(words.get(0));
        if (SQL_KEYWORDS.contains(program)) {
            triggerSql(String.join(" ", words), script, context);
            return;
        }
        switch (program) {
            case "psql" -> option(words, "-c", "--command")
                    .forEach(sql -> triggerSql(sql, script, context));
            case "mysql" -> option(words, "-e", "--execute")
                    .forEach(sql -> triggerSql(sql, script, context));
            case "sqlcmd", "isql", "osql" -> {
                option(words, "-Q", "--query")
                        .forEach(sql -> triggerSql(sql, script, context));
                option(words, "-q", "--initial-query")
                        .forEach(sql -> triggerSql(sql, script, context));
            }
            case "db2" -> {
                if (words.size() > 1) {
                    triggerSql(String.join(" ",
                            words.subList(1, words.size())), script, context);
                }
            }
            case "bcp" -> bulkCopy(words, script, context);
            default -> {
                // not a database client
            }
        }
    }

    private void bulkCopy(final List<String> words, final CodeSymbol script,
            final LinkContext context) {
        if (words.size() < 3) {
            throw new DomainException("bcp needs a source and a direction",
                    "MALFORMED_FRAGMENT");
        }
        final String source = words.get(1);
        if ("queryout".equalsIgnoreCase(words.get(2))) {
            triggerSql(source, script, context);
        } else {
            trigger(script, SymbolKind.DB_TABLE, source, context);
        }
    }

    private void triggerSql(final String sql, final CodeSymbol script,
            final LinkContext context) {
        for (final String procedure
                : StoredProcedureDetector.procedureCalls(sql)) {
            trigger(script, SymbolKind.STORED_PROCEDURE, procedure, context);
        }
        for (final String statement : sql.split(";")) {
            if (!SqlStatements.isSql(statement)) {
                continue;
            }
            for (final SqlStatements.TableAccess access
                    : SqlStatements.accesses(statement)) {
                trigger(script, SymbolKind.DB_TABLE, access.table(),
                        context);
            }
        }
    }

    private void trigger(final CodeSymbol script, final SymbolKind kind,
            final String name, final LinkContext context) {
        final CodeSymbol target = context.databaseEntity(kind, name, NAME);
        context.edge(script, target, EdgeType.TRIGGERS, STRENGTH);
    }

    private void guarded(final int line, final LinkContext context,
            final Runnable action) {
        try {
            action.run();
        } catch (DomainException e) {
            LOG.warn("Skipping line {} of {}: {}", line, context.fileKey(),
                    e.getMessage());
            context.diagnose(DiagnosticKind.MALFORMED_FRAGMENT, NAME,
                    context.fileKey() + ":" + line, e.getMessage());
        }
    }

    private static List<String> option(final List<String> words,
            final String shortFlag, final String longFlag) {
        final List<String> values = new ArrayList<>();
        for (int i = 1; i < words.size(); i++) {
            final String word = words.get(i);
            if (word.equals(shortFlag) || word.equals(longFlag)) {
                if (i + 1 < words.size()) {
                    values.add(words.get(++i));
                }
            } else if (word.startsWith(longFlag + "=")) {
                values.add(word.substring(longFlag.length() + 1));
            } else if (word.startsWith(shortFlag)
                    && word.length() > shortFlag.length()
                    && !word.startsWith("--")) {
                values.add(word.substring(shortFlag.length()));
            }
        }
        return values;
    }

    private static String program(final String word) {
        String name = word;
        final int slash = Math.max(name.lastIndexOf('/'),
                name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        name = name.toLowerCase(Locale.ROOT);
        return name.endsWith(".exe")
                ? name.substring(0, name.length() - 4) : name;
    }

    private static boolean isComment(final String trimmed) {
        final String upper = trimmed.toUpperCase(Locale.ROOT);
        return trimmed.startsWith("#") || trimmed.startsWith("::")
                || trimmed.startsWith("--") || upper.equals("REM")
                || upper.startsWith("REM ");
    }

    private static List<Line> logicalLines(final String text,
            final int firstLine) {
        final List<Line> lines = new ArrayList<>();
        final String[] physical = text.split("\\r?\\n", -1);
        final StringBuilder current = new StringBuilder();
        int start = firstLine;
        for (int i = 0; i < physical.length; i++) {
            final String part = physical[i];
            if (current.length() == 0) {
                start = firstLine + i;
            }
            if (part.endsWith("\\")) {
                current.append(part, 0, part.length() - 1).append(' ');
                continue;
            }
            current.append(part);
            lines.add(new Line(start, current.toString()));
            current.setLength(0);
        }
        if (current.length() > 0) {
            lines.add(new Line(start, current.toString()));
        }
        return lines;
    }

    /** A logical script line with its first physical line number. */
    private record Line(int number, String text) {}

}
