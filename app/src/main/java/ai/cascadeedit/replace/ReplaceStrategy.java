package ai.cascadeedit.replace;

/** One stage of the cascade. Implementations are pure functions of their arguments. */
@FunctionalInterface
interface ReplaceStrategy {
    MatchOutcome match(EditRequest request, ReplacerConfig config);
}
