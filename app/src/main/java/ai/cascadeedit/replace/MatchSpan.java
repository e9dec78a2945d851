package ai.cascadeedit.replace;

/** Half-open char range {@code [startOffset, endOffset)} of the content that a strategy will replace. */
record MatchSpan(int startOffset, int endOffset) {
    MatchSpan {
        assert startOffset >= 0 && startOffset <= endOffset : "bad span " + startOffset + ".." + endOffset;
    }
}
