package ai.cascadeedit.util;

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Pure text transforms shared by the matching strategies. Every comparison in the cascade is "apply a
 * normalizer to both sides, then compare", so these must stay side-effect free and deterministic.
 */
public final class TextNormalizers {
    private static final Splitter LINE_SPLITTER = Splitter.on('\n');
    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("\\h+");

    private TextNormalizers() {
        // utility class
    }

    /** Splits on {@code \n}, keeping empty segments (so "a\n" yields ["a", ""]). */
    public static List<String> splitLines(String s) {
        return LINE_SPLITTER.splitToList(s);
    }

    /**
     * Splits a search block into lines, dropping the single empty segment produced by a trailing newline.
     */
    public static List<String> splitSearchLines(String s) {
        var lines = splitLines(s);
        if (lines.size() > 1 && lines.get(lines.size() - 1).isEmpty()) {
            return lines.subList(0, lines.size() - 1);
        }
        return lines;
    }

    /**
     * Strips every line and removes fully blank lines at the start and end of the block. Interior blank
     * lines are kept so the block's line structure is preserved.
     */
    public static List<String> trimLines(String s) {
        var stripped = new ArrayList<String>();
        for (var line : splitLines(s)) {
            stripped.add(line.strip());
        }
        int start = 0;
        while (start < stripped.size() && stripped.get(start).isEmpty()) {
            start++;
        }
        int end = stripped.size();
        while (end > start && stripped.get(end - 1).isEmpty()) {
            end--;
        }
        return List.copyOf(stripped.subList(start, end));
    }

    /** Replaces every run of horizontal whitespace (spaces, tabs) in the line with a single space. */
    public static String collapseInternalWhitespace(String line) {
        return HORIZONTAL_WHITESPACE.matcher(line).replaceAll(" ");
    }

    /** Removes leading whitespace only; trailing content, including trailing spaces, is kept verbatim. */
    public static String stripLeadingIndent(String line) {
        return line.stripLeading();
    }

    /** Strips leading and trailing whitespace, newlines included, of the whole string as one unit. */
    public static String trimBlock(String s) {
        return s.strip();
    }

    /** True if {@link #decodeEscapes} would change {@code s}. */
    public static boolean containsEscapes(String s) {
        for (int i = 0; i < s.length() - 1; i++) {
            if (s.charAt(i) == '\\') {
                if (decodeEscape(s.charAt(i + 1)) != 0) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Decodes the literal two-character sequences {@code \n}, {@code \t}, {@code \r}, {@code \\},
     * {@code \"} and {@code \'} into the characters they denote. Decoding is a single left-to-right pass,
     * so {@code \\n} becomes a backslash followed by {@code n}. Unknown sequences are kept as they are.
     */
    public static String decodeEscapes(String s) {
        if (s.indexOf('\\') < 0) {
            return s;
        }
        var sb = new StringBuilder(s.length());
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                char decoded = decodeEscape(s.charAt(i + 1));
                if (decoded != 0) {
                    sb.append(decoded);
                    i += 2;
                    continue;
                }
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    /** @return the decoded character, or 0 if {@code c} does not form a known escape. */
    private static char decodeEscape(char c) {
        return switch (c) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            case '\\' -> '\\';
            case '"' -> '"';
            case '\'' -> '\'';
            default -> 0;
        };
    }
}
