package ai.cascadeedit.replace;

import ai.cascadeedit.replace.MatchOutcome.Bail;
import ai.cascadeedit.replace.MatchOutcome.Matched;
import ai.cascadeedit.replace.MatchOutcome.NotFound;
import ai.cascadeedit.util.TextNormalizers;
import java.util.ArrayList;
import java.util.List;

/**
 * Strategies that look for the search block (or a transformed form of it) as a plain substring of the
 * content, without regard to line boundaries.
 */
final class SubstringStrategies {
    private SubstringStrategies() {
        // utility class
    }

    /**
     * Non-overlapping occurrences of {@code needle}, scanning left to right. An empty needle never occurs.
     */
    static List<MatchSpan> occurrences(String content, String needle) {
        var spans = new ArrayList<MatchSpan>();
        if (needle.isEmpty()) {
            return spans;
        }
        int from = 0;
        while (true) {
            int idx = content.indexOf(needle, from);
            if (idx < 0) {
                break;
            }
            spans.add(new MatchSpan(idx, idx + needle.length()));
            from = idx + needle.length();
        }
        return spans;
    }

    /**
     * Literal substring. With {@code replaceAll} every occurrence is replaced; otherwise the occurrence
     * must be unique, and duplicates are left for the final multi-occurrence stage.
     */
    static MatchOutcome exact(EditRequest request, ReplacerConfig config) {
        var spans = occurrences(request.content(), request.searchBlock());
        if (spans.isEmpty()) {
            return new Bail("no exact occurrence");
        }
        if (request.replaceAll() || spans.size() == 1) {
            return new Matched(spans, request.replaceBlock());
        }
        return new Bail("%d exact occurrences".formatted(spans.size()));
    }

    /**
     * Search block written with literal escape sequences ({@code \n} as two characters). Both blocks are
     * decoded, and the decoded search must occur exactly once.
     */
    static MatchOutcome escapeNormalized(EditRequest request, ReplacerConfig config) {
        if (!TextNormalizers.containsEscapes(request.searchBlock())) {
            return new Bail("search block has no escape sequences");
        }
        var decodedSearch = TextNormalizers.decodeEscapes(request.searchBlock());
        var spans = occurrences(request.content(), decodedSearch);
        if (spans.size() != 1) {
            return new Bail("%d occurrences of decoded search block".formatted(spans.size()));
        }
        return new Matched(spans, TextNormalizers.decodeEscapes(request.replaceBlock()));
    }

    /**
     * Search block surrounded by stray whitespace or newlines. The trimmed block must occur exactly once,
     * anywhere in the content; only that substring is replaced.
     */
    static MatchOutcome trimmedBoundary(EditRequest request, ReplacerConfig config) {
        var trimmed = TextNormalizers.trimBlock(request.searchBlock());
        if (trimmed.isEmpty() || trimmed.equals(request.searchBlock())) {
            return new Bail("nothing to trim");
        }
        var spans = occurrences(request.content(), trimmed);
        if (spans.size() != 1) {
            return new Bail("%d occurrences of trimmed search block".formatted(spans.size()));
        }
        return new Matched(spans, request.replaceBlock());
    }

    /** Last resort: every exact occurrence is replaced. */
    static MatchOutcome multiOccurrence(EditRequest request, ReplacerConfig config) {
        var spans = occurrences(request.content(), request.searchBlock());
        if (spans.isEmpty()) {
            return new NotFound("no exact occurrence");
        }
        return new Matched(spans, request.replaceBlock());
    }
}
