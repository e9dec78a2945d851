package ai.cascadeedit.replace;

import com.fasterxml.jackson.annotation.JsonValue;

/** The matching strategies of the cascade, in the order they are tried. */
public enum StrategyName {
    EXACT("exact"),
    LINE_TRIMMED("line-trimmed"),
    BLOCK_ANCHOR("block-anchor"),
    WHITESPACE_NORMALIZED("whitespace-normalized"),
    INDENTATION_FLEXIBLE("indentation-flexible"),
    ESCAPE_NORMALIZED("escape-normalized"),
    TRIMMED_BOUNDARY("trimmed-boundary"),
    CONTEXT_AWARE("context-aware"),
    MULTI_OCCURRENCE("multi-occurrence");

    private final String wireName;

    StrategyName(String wireName) {
        this.wireName = wireName;
    }

    /** Stable, lower-case name reported to callers and written to tool results. */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
