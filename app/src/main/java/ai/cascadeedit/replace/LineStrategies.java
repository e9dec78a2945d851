package ai.cascadeedit.replace;

import ai.cascadeedit.replace.MatchOutcome.Bail;
import ai.cascadeedit.replace.MatchOutcome.Matched;
import ai.cascadeedit.util.Levenshtein;
import ai.cascadeedit.util.TextNormalizers;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Strategies that compare the search block with the content line by line after normalizing both sides.
 * A match is always a whole run of content lines, and it must be unique: duplicates make the stage bail.
 */
final class LineStrategies {
    static final int BLOCK_ANCHOR_MIN_LINES = 3;
    static final int CONTEXT_AWARE_MIN_LINES = 2;

    private LineStrategies() {
        // utility class
    }

    /**
     * Every line stripped on both sides; blank lines around the search block are ignored. The matched
     * lines are replaced verbatim.
     */
    static MatchOutcome lineTrimmed(EditRequest request, ReplacerConfig config) {
        var search = TextNormalizers.trimLines(request.searchBlock());
        if (search.isEmpty()) {
            return new Bail("search block is blank");
        }
        var index = LineIndex.of(request.content());
        var matches = LineIndex.findSequence(index.normalized(String::strip), search);
        if (matches.size() != 1) {
            return declined(matches.size(), "trimmed-line");
        }
        return new Matched(index.span(matches.get(0), search.size()), verbatimReplacement(request));
    }

    /**
     * First and last lines (stripped) act as anchors around a block of the same height; interior lines are
     * not compared at all. The anchored block is replaced verbatim.
     */
    static MatchOutcome blockAnchor(EditRequest request, ReplacerConfig config) {
        var search = TextNormalizers.splitSearchLines(request.searchBlock());
        if (search.size() < BLOCK_ANCHOR_MIN_LINES) {
            return new Bail("fewer than " + BLOCK_ANCHOR_MIN_LINES + " search lines");
        }
        var index = LineIndex.of(request.content());
        var candidates = anchoredWindows(index, search);
        if (candidates == null) {
            return new Bail("blank anchor line");
        }
        if (candidates.size() != 1) {
            return declined(candidates.size(), "anchored block");
        }
        return new Matched(index.span(candidates.get(0), search.size()), verbatimReplacement(request));
    }

    /** Runs of spaces and tabs collapsed to one space on both sides; replaced verbatim. */
    static MatchOutcome whitespaceNormalized(EditRequest request, ReplacerConfig config) {
        var search = TextNormalizers.splitSearchLines(request.searchBlock()).stream()
                .map(TextNormalizers::collapseInternalWhitespace)
                .toList();
        if (search.stream().allMatch(String::isBlank)) {
            return new Bail("search block is blank");
        }
        var index = LineIndex.of(request.content());
        var matches =
                LineIndex.findSequence(index.normalized(TextNormalizers::collapseInternalWhitespace), search);
        if (matches.size() != 1) {
            return declined(matches.size(), "whitespace-normalized");
        }
        return new Matched(index.span(matches.get(0), search.size()), verbatimReplacement(request));
    }

    /**
     * Only leading indentation removed on both sides, so trailing whitespace still has to agree. Catches
     * blocks that the trimmed comparison saw more than once. Replaced verbatim.
     */
    static MatchOutcome indentationFlexible(EditRequest request, ReplacerConfig config) {
        var search = TextNormalizers.splitSearchLines(request.searchBlock()).stream()
                .map(TextNormalizers::stripLeadingIndent)
                .toList();
        if (search.stream().allMatch(String::isBlank)) {
            return new Bail("search block is blank");
        }
        var index = LineIndex.of(request.content());
        var matches = LineIndex.findSequence(index.normalized(TextNormalizers::stripLeadingIndent), search);
        if (matches.size() != 1) {
            return declined(matches.size(), "indentation-stripped");
        }
        return new Matched(index.span(matches.get(0), search.size()), verbatimReplacement(request));
    }

    /**
     * Anchors like {@link #blockAnchor}, but a candidate is only accepted when enough of its interior lines
     * are similar to the search block's (Levenshtein ratio, positionally aligned). This picks out the one
     * intended block when several share the same anchors. A two-line search has no interior and is
     * accepted on its anchors.
     */
    static MatchOutcome contextAware(EditRequest request, ReplacerConfig config) {
        var search = TextNormalizers.splitSearchLines(request.searchBlock());
        if (search.size() < CONTEXT_AWARE_MIN_LINES) {
            return new Bail("fewer than " + CONTEXT_AWARE_MIN_LINES + " search lines");
        }
        var index = LineIndex.of(request.content());
        var candidates = anchoredWindows(index, search);
        if (candidates == null) {
            return new Bail("blank anchor line");
        }
        var accepted = new ArrayList<Integer>();
        for (int start : candidates) {
            if (interiorAgrees(index, start, search, config)) {
                accepted.add(start);
            }
        }
        if (accepted.size() != 1) {
            return declined(accepted.size(), "context-similar block");
        }
        return new Matched(index.span(accepted.get(0), search.size()), verbatimReplacement(request));
    }

    static boolean interiorAgrees(LineIndex index, int start, List<String> search, ReplacerConfig config) {
        int interior = search.size() - 2;
        if (interior <= 0) {
            return true;
        }
        int agreeing = 0;
        for (int k = 1; k <= interior; k++) {
            var actual = index.line(start + k).strip();
            var expected = search.get(k).strip();
            if (Levenshtein.similarity(actual, expected) >= config.contextSimilarityThreshold()) {
                agreeing++;
            }
        }
        return agreeing >= config.contextMatchFraction() * interior;
    }

    /**
     * Start lines of every content window of the search block's height whose first and last lines,
     * stripped, equal the search block's. Returns null if either anchor is blank, since blank anchors
     * would match almost anywhere.
     */
    private static @Nullable List<Integer> anchoredWindows(LineIndex index, List<String> search) {
        var first = search.get(0).strip();
        var last = search.get(search.size() - 1).strip();
        if (first.isEmpty() || last.isEmpty()) {
            return null;
        }
        var starts = new ArrayList<Integer>();
        for (int i = 0; i <= index.size() - search.size(); i++) {
            if (index.line(i).strip().equals(first)
                    && index.line(i + search.size() - 1).strip().equals(last)) {
                starts.add(i);
            }
        }
        return starts;
    }

    /**
     * The replacement as given, except that when both blocks end with a newline one is dropped: the
     * search's trailing newline is not part of a line-based match span.
     */
    static String verbatimReplacement(EditRequest request) {
        var replace = request.replaceBlock();
        if (request.searchBlock().endsWith("\n") && replace.endsWith("\n")) {
            return replace.substring(0, replace.length() - 1);
        }
        return replace;
    }

    private static Bail declined(int count, String what) {
        return new Bail(count == 0 ? "no " + what + " match" : count + " " + what + " matches");
    }
}
