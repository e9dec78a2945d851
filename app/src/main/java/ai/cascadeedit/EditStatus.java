package ai.cascadeedit;

public enum EditStatus {
    APPLIED,
    /** Every block resolved but the file content did not change. */
    ALREADY_APPLIED,
    NOT_FOUND,
    NO_MATCH,
    ERROR;

    public boolean isSuccess() {
        return this == APPLIED || this == ALREADY_APPLIED;
    }
}
