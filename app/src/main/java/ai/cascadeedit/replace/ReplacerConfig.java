package ai.cascadeedit.replace;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Tunables of the cascade.
 *
 * <ul>
 *   <li>{@code contextSimilarityThreshold}: Levenshtein similarity an interior line pair needs before the
 *       context-aware stage counts it as agreeing (default 0.5).</li>
 *   <li>{@code contextMatchFraction}: fraction of interior line pairs that must agree for a context-aware
 *       candidate to be accepted (default 0.5).</li>
 *   <li>{@code failurePreviewLines}: how many search lines the failure message quotes (default 5).</li>
 * </ul>
 *
 * <p>Values can come from a JSON file ({@link #load(Path)}) and be overridden by the
 * {@code CASCADE_CONTEXT_SIMILARITY}, {@code CASCADE_CONTEXT_FRACTION} and {@code CASCADE_PREVIEW_LINES}
 * environment variables ({@link #withEnvironment(Map)}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReplacerConfig(double contextSimilarityThreshold, double contextMatchFraction, int failurePreviewLines) {
    private static final Logger logger = LogManager.getLogger(ReplacerConfig.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final double DEFAULT_CONTEXT_SIMILARITY = 0.5;
    public static final double DEFAULT_CONTEXT_FRACTION = 0.5;
    public static final int DEFAULT_PREVIEW_LINES = 5;

    static final String ENV_CONTEXT_SIMILARITY = "CASCADE_CONTEXT_SIMILARITY";
    static final String ENV_CONTEXT_FRACTION = "CASCADE_CONTEXT_FRACTION";
    static final String ENV_PREVIEW_LINES = "CASCADE_PREVIEW_LINES";

    public ReplacerConfig {
        if (!(contextSimilarityThreshold >= 0.0 && contextSimilarityThreshold <= 1.0)) {
            throw new IllegalArgumentException(
                    "contextSimilarityThreshold must be in [0, 1], got " + contextSimilarityThreshold);
        }
        if (!(contextMatchFraction >= 0.0 && contextMatchFraction <= 1.0)) {
            throw new IllegalArgumentException("contextMatchFraction must be in [0, 1], got " + contextMatchFraction);
        }
        if (failurePreviewLines < 1) {
            throw new IllegalArgumentException("failurePreviewLines must be >= 1, got " + failurePreviewLines);
        }
    }

    /** Json factory: absent properties fall back to the defaults. */
    @JsonCreator
    public static ReplacerConfig forJson(
            @JsonProperty("contextSimilarityThreshold") @Nullable Double contextSimilarityThreshold,
            @JsonProperty("contextMatchFraction") @Nullable Double contextMatchFraction,
            @JsonProperty("failurePreviewLines") @Nullable Integer failurePreviewLines) {
        return new ReplacerConfig(
                contextSimilarityThreshold == null ? DEFAULT_CONTEXT_SIMILARITY : contextSimilarityThreshold,
                contextMatchFraction == null ? DEFAULT_CONTEXT_FRACTION : contextMatchFraction,
                failurePreviewLines == null ? DEFAULT_PREVIEW_LINES : failurePreviewLines);
    }

    public static ReplacerConfig defaults() {
        return new ReplacerConfig(DEFAULT_CONTEXT_SIMILARITY, DEFAULT_CONTEXT_FRACTION, DEFAULT_PREVIEW_LINES);
    }

    /** Defaults overridden by the process environment. */
    public static ReplacerConfig fromEnvironment() {
        return defaults().withEnvironment(System.getenv());
    }

    /** Reads a JSON config file. */
    public static ReplacerConfig load(Path path) throws IOException {
        var config = objectMapper.readValue(Files.readString(path), ReplacerConfig.class);
        logger.debug("Loaded replacer config from {}: {}", path, config);
        return config;
    }

    /**
     * Returns a copy with any of the {@code CASCADE_*} variables present in {@code env} applied. Values
     * that do not parse or are out of range are logged and ignored.
     */
    public ReplacerConfig withEnvironment(Map<String, String> env) {
        double similarity = parseDouble(env, ENV_CONTEXT_SIMILARITY, contextSimilarityThreshold);
        double fraction = parseDouble(env, ENV_CONTEXT_FRACTION, contextMatchFraction);
        int preview = parseInt(env, ENV_PREVIEW_LINES, failurePreviewLines);
        try {
            var overridden = new ReplacerConfig(similarity, fraction, preview);
            if (!overridden.equals(this)) {
                logger.info("CASCADE_* override in effect; replacer config: {}", overridden);
            }
            return overridden;
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring CASCADE_* overrides: {}", e.getMessage());
            return this;
        }
    }

    private static double parseDouble(Map<String, String> env, String key, double fallback) {
        var raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.strip());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring malformed {}='{}'", key, raw);
            return fallback;
        }
    }

    private static int parseInt(Map<String, String> env, String key, int fallback) {
        var raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.strip());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring malformed {}='{}'", key, raw);
            return fallback;
        }
    }
}
