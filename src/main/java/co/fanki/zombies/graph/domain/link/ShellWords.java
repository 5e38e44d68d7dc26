package co.fanki.zombies.graph.domain.link;

import co.fanki.zombies.shared.DomainException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one shell line into commands and words, honouring quotes.
 *
 * <p>Single quotes are literal; double quotes allow backslash escapes of
 * {@code "}, {@code \}, {@code $} and {@code `}. Unquoted {@code ;},
 * {@code |}, {@code &&} and {@code ||} separate commands; an unquoted
 * {@code #} at the start of a word starts a comment. Variable expansion
 * is not performed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class ShellWords {

    private ShellWords() {
    }

    /**
     * Splits a line.
     *
     * @param line the line, continuations already joined
     * @return the commands, each a non-empty list of words
     * @throws DomainException with code {@code MALFORMED_FRAGMENT} on an
     *         unterminated quote
     */
    static List<List<String>> split(final String line) {
        final List<List<String>> commands = new ArrayList<>();
        List<String> words = new ArrayList<>();
        final StringBuilder word = new StringBuilder();
        boolean inWord = false;

        int i = 0;
        while (i < line.length()) {
            final char c = line.charAt(i);
            if (c == '\'') {
                final int end = line.indexOf('\'', i + 1);
                if (end < 0) {
                    throw unterminated(line);
                }
                word.append(line, i + 1, end);
                inWord = true;
                i = end + 1;
            } else if (c == '"') {
                i = doubleQuoted(line, i + 1, word);
                inWord = true;
            } else if (c == '\\' && i + 1 < line.length()) {
                word.append(line.charAt(i + 1));
                inWord = true;
                i += 2;
            } else if (Character.isWhitespace(c)) {
                inWord = flush(word, inWord, words);
                i++;
            } else if (c == '#' && !inWord) {
                break;
            } else if (c == ';' || c == '|' || c == '&') {
                inWord = flush(word, inWord, words);
                if (!words.isEmpty()) {
                    commands.add(words);
                    words = new ArrayList<>();
                }
                i++;
            } else {
                word.append(c);
                inWord = true;
                i++;
            }
        }
        flush(word, inWord, words);
        if (!words.isEmpty()) {
            commands.add(words);
        }
        return commands;
    }

    private static int doubleQuoted(final String line, final int from,
            final StringBuilder word) {
        int i = from;
        while (i < line.length()) {
            final char c = line.charAt(i);
            if (c == '"') {
                return i + 1;
            }
            if (c == '\\' && i + 1 < line.length()
                    && "\"\\$`".indexOf(line.charAt(i + 1)) >= 0) {
                word.append(line.charAt(i + 1));
                i += 2;
            } else {
                word.append(c);
                i++;
            }
        }
        throw unterminated(line);
    }

    private static boolean flush(final StringBuilder word,
            final boolean inWord, final List<String> words) {
        if (inWord) {
            words.add(word.toString());
            word.setLength(0);
        }
        return false;
    }

    private static DomainException unterminated(final String line) {
        return new DomainException("Unterminated quote in: " + line,
                "MALFORMED_FRAGMENT");
    }

}
