package ai.cascadeedit;

import ai.cascadeedit.replace.StrategyName;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/**
 * Outcome of {@link FileEditor#edit}. {@code strategies} lists, per block and in block order, the matching
 * strategy that resolved it; it is empty unless the blocks all resolved.
 */
public record EditResult(EditStatus status, String path, String message, List<StrategyName> strategies) {
    public EditResult {
        strategies = List.copyOf(strategies);
    }

    static EditResult applied(String path, List<StrategyName> strategies) {
        return new EditResult(EditStatus.APPLIED, path, "Applied " + strategies.size() + " edit(s) to " + path, strategies);
    }

    static EditResult alreadyApplied(String path, List<StrategyName> strategies) {
        return new EditResult(
                EditStatus.ALREADY_APPLIED, path, "No changes: " + path + " already has the requested content", strategies);
    }

    static EditResult failure(EditStatus status, String path, String message) {
        assert !status.isSuccess();
        return new EditResult(status, path, message, List.of());
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status.isSuccess();
    }
}
