package ai.cascadeedit;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import ai.cascadeedit.replace.CascadeReplacer;
import ai.cascadeedit.replace.ReplaceOutcome;
import ai.cascadeedit.replace.StrategyName;
import com.google.common.util.concurrent.Striped;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Lock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

/**
 * Applies search/replace blocks to files under a root directory through the {@link CascadeReplacer}.
 *
 * <p>A batch of blocks for one file is all-or-nothing: every block is resolved in order against the content
 * produced by the blocks before it, and the file is only written when all of them resolved. Edits to the
 * same file are serialised, and the file is re-read under the lock so a batch always starts from what is on
 * disk. Failures are reported as {@link EditResult} values rather than thrown.
 */
@NullMarked
public final class FileEditor {
    private static final Logger logger = LogManager.getLogger(FileEditor.class);

    private final Path root;
    private final CascadeReplacer replacer;
    private final Map<Path, String> snapshots = new ConcurrentHashMap<>();
    private final Striped<Lock> fileLocks = Striped.lock(64);
    private final List<EditListener> listeners = new CopyOnWriteArrayList<>();

    public FileEditor(Path root) {
        this(root, new CascadeReplacer());
    }

    public FileEditor(Path root, CascadeReplacer replacer) {
        this.root = root.toAbsolutePath().normalize();
        this.replacer = requireNonNull(replacer);
    }

    public Path root() {
        return root;
    }

    public void addListener(EditListener listener) {
        listeners.add(requireNonNull(listener));
    }

    public void removeListener(EditListener listener) {
        listeners.remove(listener);
    }

    /** Resolves {@code path} against the root after expanding a leading {@code ~}. */
    public Path resolve(String path) {
        var home = System.getProperty("user.home");
        var expanded = path;
        if ("~".equals(path)) {
            expanded = home;
        } else if (path.startsWith("~/")) {
            expanded = home + path.substring(1);
        }
        var p = Path.of(expanded);
        return (p.isAbsolute() ? p : root.resolve(p)).toAbsolutePath().normalize();
    }

    /** Reads the file as UTF-8 and remembers the content as its latest snapshot. */
    public String read(String path) throws IOException {
        var file = resolve(path);
        var content = Files.readString(file, UTF_8);
        snapshots.put(file, content);
        return content;
    }

    /** Content last read or written through this editor. */
    public Optional<String> snapshot(String path) {
        return Optional.ofNullable(snapshots.get(resolve(path)));
    }

    public EditResult edit(String path, SearchReplaceBlock block) {
        return edit(path, List.of(block));
    }

    public EditResult edit(String path, List<SearchReplaceBlock> blocks) {
        return run(path, blocks, true).result();
    }

    /**
     * Resolves the blocks against the file exactly as {@link #edit} would, but never writes it or notifies
     * listeners. The returned content is the edited text on success and the file's text otherwise.
     */
    public Preview preview(String path, List<SearchReplaceBlock> blocks) {
        return run(path, blocks, false);
    }

    private Preview run(String path, List<SearchReplaceBlock> blocks, boolean write) {
        if (blocks.isEmpty()) {
            return new Preview(EditResult.failure(EditStatus.ERROR, path, path + ": no edit blocks given"), "");
        }
        for (var block : blocks) {
            if (CorruptionGuard.hasActionTagCorruption(block.replaceText())) {
                logger.warn("Rejecting edit to {}: replacement contains tool-call markup", path);
                var result = EditResult.failure(
                        EditStatus.ERROR, path, path + ": replacement text contains tool-call markup, refusing to write it");
                return new Preview(result, "");
            }
        }

        var file = resolve(path);
        var lock = fileLocks.get(file);
        lock.lock();
        try {
            if (!Files.isRegularFile(file)) {
                logger.debug("Edit target {} does not exist", file);
                return new Preview(EditResult.failure(EditStatus.NOT_FOUND, path, path + ": file not found"), "");
            }

            String original;
            try {
                original = Files.readString(file, UTF_8);
            } catch (IOException e) {
                logger.error("Unable to read {}: {}", file, e.getMessage());
                return new Preview(EditResult.failure(EditStatus.ERROR, path, path + ": " + e.getMessage()), "");
            }
            snapshots.put(file, original);

            var batch = applyAll(original, blocks);
            if (!batch.ok()) {
                logger.debug("Edit of {} failed: {}", file, batch.failure());
                return new Preview(
                        EditResult.failure(EditStatus.NO_MATCH, path, path + ": " + batch.failure()), original);
            }
            if (batch.content().equals(original)) {
                return new Preview(EditResult.alreadyApplied(path, batch.strategies()), original);
            }
            if (!write) {
                return new Preview(EditResult.applied(path, batch.strategies()), batch.content());
            }

            try {
                Files.writeString(file, batch.content(), UTF_8);
            } catch (IOException e) {
                logger.error("Unable to write {}: {}", file, e.getMessage());
                return new Preview(EditResult.failure(EditStatus.ERROR, path, path + ": " + e.getMessage()), original);
            }
            snapshots.put(file, batch.content());
            logger.info("Applied {} edit(s) to {} using {}", blocks.size(), file, batch.strategies());
            notifyListeners(new EditEvent(file, original, batch.content()));
            return new Preview(EditResult.applied(path, batch.strategies()), batch.content());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resolves every block in order against {@code content} without touching the disk. Stops at the first
     * block that does not resolve.
     */
    public BatchOutcome applyAll(String content, List<SearchReplaceBlock> blocks) {
        var current = content;
        var strategies = new ArrayList<StrategyName>(blocks.size());
        for (var block : blocks) {
            var outcome = replacer.replace(current, block.searchText(), block.replaceText(), block.replaceAll());
            if (outcome instanceof ReplaceOutcome.ReplaceFailure failure) {
                return new BatchOutcome(content, strategies, failure.message());
            }
            var result = (ReplaceOutcome.ReplaceResult) outcome;
            current = result.content();
            strategies.add(result.strategy());
        }
        return new BatchOutcome(current, strategies, null);
    }

    private void notifyListeners(EditEvent event) {
        for (var listener : listeners) {
            try {
                listener.onFileEdited(event);
            } catch (RuntimeException e) {
                logger.error("Edit listener {} failed for {}", listener, event.path(), e);
            }
        }
    }

    /**
     * Result of resolving a batch in memory. On failure {@code content} is the input unchanged and
     * {@code strategies} holds the blocks that resolved before the failing one.
     */
    public record BatchOutcome(String content, List<StrategyName> strategies, @Nullable String failure) {
        public BatchOutcome {
            strategies = List.copyOf(strategies);
        }

        public boolean ok() {
            return failure == null;
        }
    }

    /** An edit result together with the file content it leads to. */
    public record Preview(EditResult result, String content) {}
}
