package ai.cascadeedit;

import static java.util.Objects.requireNonNull;

/**
 * One proposed edit to a file: replace {@code searchText} with {@code replaceText}. With {@code replaceAll}
 * every exact occurrence of the search text is replaced rather than requiring it to be unique.
 */
public record SearchReplaceBlock(String searchText, String replaceText, boolean replaceAll) {
    public SearchReplaceBlock {
        requireNonNull(searchText);
        requireNonNull(replaceText);
    }

    public SearchReplaceBlock(String searchText, String replaceText) {
        this(searchText, replaceText, false);
    }
}
