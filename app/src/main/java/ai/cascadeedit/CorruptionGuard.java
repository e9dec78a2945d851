package ai.cascadeedit;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Detects replacement text that contains fragments of the tool-call markup an assistant uses to frame its
 * edits. Such text is a transcript that leaked into a replacement and must never be written to a file.
 */
public final class CorruptionGuard {
    static final List<Pattern> ACTION_TAGS = List.of(
            Pattern.compile("<edit\\s+path\\s*=", Pattern.CASE_INSENSITIVE),
            Pattern.compile("</edit>", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<end>", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<bash>", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<say>", Pattern.CASE_INSENSITIVE));

    /** Distinct tags needed before text counts as corrupted. */
    static final int CORRUPTION_THRESHOLD = 3;

    private CorruptionGuard() {}

    public static boolean hasActionTagCorruption(String text) {
        long distinct = ACTION_TAGS.stream()
                .filter(tag -> tag.matcher(text).find())
                .count();
        return distinct >= CORRUPTION_THRESHOLD;
    }
}
