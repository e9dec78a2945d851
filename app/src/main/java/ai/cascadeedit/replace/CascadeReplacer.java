package ai.cascadeedit.replace;

import ai.cascadeedit.replace.MatchOutcome.Bail;
import ai.cascadeedit.replace.MatchOutcome.Matched;
import ai.cascadeedit.replace.MatchOutcome.NotFound;
import ai.cascadeedit.replace.ReplaceOutcome.ReplaceFailure;
import ai.cascadeedit.replace.ReplaceOutcome.ReplaceResult;
import ai.cascadeedit.util.TextNormalizers;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Applies a search/replace edit to text, trying progressively looser matching strategies until one of them
 * finds the search block unambiguously.
 *
 * <p>The order of {@link #STAGES} is fixed: stricter strategies run first, so an exact match always wins
 * over a fuzzy one. Every stage except the last declines (rather than guesses) when it finds more than one
 * candidate. When no stage matches, the original content is returned untouched together with a message
 * quoting the start of the search block.
 *
 * <p>Instances hold only their configuration and are safe to share between threads.
 */
public final class CascadeReplacer {
    private static final Logger logger = LogManager.getLogger(CascadeReplacer.class);

    static final String NOT_FOUND_PREFIX = "Search block not found";

    /** One entry of the dispatch table. */
    record Stage(StrategyName name, ReplaceStrategy strategy) {}

    static final List<Stage> STAGES = List.of(
            new Stage(StrategyName.EXACT, SubstringStrategies::exact),
            new Stage(StrategyName.LINE_TRIMMED, LineStrategies::lineTrimmed),
            new Stage(StrategyName.BLOCK_ANCHOR, LineStrategies::blockAnchor),
            new Stage(StrategyName.WHITESPACE_NORMALIZED, LineStrategies::whitespaceNormalized),
            new Stage(StrategyName.INDENTATION_FLEXIBLE, LineStrategies::indentationFlexible),
            new Stage(StrategyName.ESCAPE_NORMALIZED, SubstringStrategies::escapeNormalized),
            new Stage(StrategyName.TRIMMED_BOUNDARY, SubstringStrategies::trimmedBoundary),
            new Stage(StrategyName.CONTEXT_AWARE, LineStrategies::contextAware),
            new Stage(StrategyName.MULTI_OCCURRENCE, SubstringStrategies::multiOccurrence));

    private final ReplacerConfig config;

    public CascadeReplacer() {
        this(ReplacerConfig.defaults());
    }

    public CascadeReplacer(ReplacerConfig config) {
        this.config = Objects.requireNonNull(config);
    }

    public ReplacerConfig config() {
        return config;
    }

    public ReplaceOutcome replace(String content, String searchBlock, String replaceBlock, boolean replaceAll) {
        return replace(new EditRequest(content, searchBlock, replaceBlock, replaceAll));
    }

    public ReplaceOutcome replace(EditRequest request) {
        Objects.requireNonNull(request);
        for (var stage : STAGES) {
            var outcome = stage.strategy().match(request, config);
            if (outcome instanceof Matched matched) {
                logger.debug("Strategy {} matched {} span(s)", stage.name(), matched.spans().size());
                return new ReplaceResult(applySpans(request.content(), matched), stage.name());
            }
            if (outcome instanceof Bail bail) {
                logger.trace("Strategy {} declined: {}", stage.name(), bail.reason());
            } else if (outcome instanceof NotFound notFound) {
                logger.trace("Strategy {} found nothing: {}", stage.name(), notFound.reason());
            }
        }
        var message = notFoundMessage(request.searchBlock(), config.failurePreviewLines());
        logger.debug("No strategy matched; {} stages tried", STAGES.size());
        return new ReplaceFailure(message, request.content());
    }

    /** Splices the replacement into every span, left to right. */
    static String applySpans(String content, Matched matched) {
        var sb = new StringBuilder(content.length() + matched.replacement().length());
        int cursor = 0;
        for (var span : matched.spans()) {
            assert span.startOffset() >= cursor : "spans must be sorted and disjoint";
            sb.append(content, cursor, span.startOffset());
            sb.append(matched.replacement());
            cursor = span.endOffset();
        }
        sb.append(content, cursor, content.length());
        return sb.toString();
    }

    static String notFoundMessage(String searchBlock, int previewLines) {
        var lines = TextNormalizers.splitSearchLines(searchBlock);
        var sb = new StringBuilder(NOT_FOUND_PREFIX).append(". No matching strategy found for:\n");
        int shown = Math.min(previewLines, lines.size());
        for (int i = 0; i < shown; i++) {
            sb.append("  ").append(lines.get(i)).append('\n');
        }
        if (lines.size() > shown) {
            sb.append("  ... (").append(lines.size() - shown).append(" more lines)\n");
        }
        return sb.toString().stripTrailing();
    }
}
