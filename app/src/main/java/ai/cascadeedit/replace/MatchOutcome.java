package ai.cascadeedit.replace;

import java.util.List;

/**
 * What a single strategy decided about a request. Only the last stage of the cascade ever reports
 * {@link NotFound}; every other stage either matches or bails so the next stage can try.
 */
sealed interface MatchOutcome permits MatchOutcome.Matched, MatchOutcome.Bail, MatchOutcome.NotFound {

    /** The spans, sorted and non-overlapping, each to be replaced by {@code replacement}. */
    record Matched(List<MatchSpan> spans, String replacement) implements MatchOutcome {
        public Matched {
            assert !spans.isEmpty();
            spans = List.copyOf(spans);
        }

        Matched(MatchSpan span, String replacement) {
            this(List.of(span), replacement);
        }
    }

    /** The strategy declined: it found nothing, or more than one candidate. */
    record Bail(String reason) implements MatchOutcome {}

    /** Terminal stage found nothing; the cascade is exhausted. */
    record NotFound(String reason) implements MatchOutcome {}
}
