package ai.cascadeedit.replace;

import java.util.Objects;

/**
 * One proposed edit against the current text of a file.
 *
 * @param content full current file text, read immediately before the call
 * @param searchBlock the text the proposer believes is in the file
 * @param replaceBlock the text that should take its place
 * @param replaceAll replace every exact occurrence instead of requiring a unique one
 */
public record EditRequest(String content, String searchBlock, String replaceBlock, boolean replaceAll) {
    public EditRequest {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(searchBlock, "searchBlock");
        Objects.requireNonNull(replaceBlock, "replaceBlock");
    }

    public EditRequest(String content, String searchBlock, String replaceBlock) {
        this(content, searchBlock, replaceBlock, false);
    }
}
