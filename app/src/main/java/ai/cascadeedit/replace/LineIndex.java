package ai.cascadeedit.replace;

import ai.cascadeedit.util.TextNormalizers;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * The content split on {@code \n} together with the char offset at which each line starts, so a run of
 * matched lines can be turned back into a {@link MatchSpan} of the original, untouched text.
 */
final class LineIndex {
    private final List<String> lines;
    private final int[] starts;

    private LineIndex(List<String> lines) {
        this.lines = lines;
        this.starts = new int[lines.size()];
        int offset = 0;
        for (int i = 0; i < lines.size(); i++) {
            starts[i] = offset;
            offset += lines.get(i).length() + 1;
        }
    }

    static LineIndex of(String content) {
        return new LineIndex(TextNormalizers.splitLines(content));
    }

    List<String> lines() {
        return lines;
    }

    String line(int i) {
        return lines.get(i);
    }

    int size() {
        return lines.size();
    }

    /** The lines with {@code normalizer} applied to each one. */
    List<String> normalized(UnaryOperator<String> normalizer) {
        var out = new ArrayList<String>(lines.size());
        for (var line : lines) {
            out.add(normalizer.apply(line));
        }
        return out;
    }

    /**
     * Span covering {@code count} lines starting at {@code first}; the newline after the last line is not
     * part of the span.
     */
    MatchSpan span(int first, int count) {
        assert count > 0 && first + count <= lines.size();
        int last = first + count - 1;
        return new MatchSpan(starts[first], starts[last] + lines.get(last).length());
    }

    /** All start indices at which {@code needle} occurs as a contiguous run of {@code haystack}. */
    static List<Integer> findSequence(List<String> haystack, List<String> needle) {
        var matches = new ArrayList<Integer>();
        if (needle.isEmpty()) {
            return matches;
        }
        outer:
        for (int i = 0; i <= haystack.size() - needle.size(); i++) {
            for (int j = 0; j < needle.size(); j++) {
                if (!haystack.get(i + j).equals(needle.get(j))) {
                    continue outer;
                }
            }
            matches.add(i);
        }
        return matches;
    }
}
