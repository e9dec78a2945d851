package ai.cascadeedit.replace;

/**
 * Result of running the cascade: either the patched content together with the strategy that produced it,
 * or a failure carrying the untouched original content.
 */
public sealed interface ReplaceOutcome permits ReplaceOutcome.ReplaceResult, ReplaceOutcome.ReplaceFailure {

    /** Patched content on success; the original, unchanged content on failure. */
    String content();

    boolean ok();

    record ReplaceResult(String content, StrategyName strategy) implements ReplaceOutcome {
        @Override
        public boolean ok() {
            return true;
        }
    }

    record ReplaceFailure(String message, String content) implements ReplaceOutcome {
        @Override
        public boolean ok() {
            return false;
        }
    }
}
