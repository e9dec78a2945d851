package ai.cascadeedit.cli;

import static java.nio.charset.StandardCharsets.UTF_8;

import ai.cascadeedit.EditResult;
import ai.cascadeedit.FileEditor;
import ai.cascadeedit.SearchReplaceBlock;
import ai.cascadeedit.replace.CascadeReplacer;
import ai.cascadeedit.replace.ReplacerConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@SuppressWarnings("NullAway.Init") // fields are populated by picocli before call()
@CommandLine.Command(
        name = "cascade-edit",
        mixinStandardHelpOptions = true,
        description = "Apply a search/replace edit to a file, tolerating whitespace, indentation and escaping drift.")
public final class CascadeEditCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CascadeEditCli.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--file", required = true, description = "File to edit.")
    private String file;

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
    private SearchSource search;

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
    private ReplaceSource replace;

    @CommandLine.Option(names = "--replace-all", description = "Replace every exact occurrence of the search text.")
    private boolean replaceAll;

    @CommandLine.Option(names = "--dry-run", description = "Print the edited content instead of writing the file.")
    private boolean dryRun;

    @CommandLine.Option(names = "--json", description = "Print the edit result as JSON.")
    private boolean json;

    @CommandLine.Option(names = "--config", description = "JSON file with replacer settings.")
    @Nullable
    private Path configPath;

    static final class SearchSource {
        @CommandLine.Option(names = "--search", description = "Text to search for.")
        @Nullable
        String text;

        @CommandLine.Option(names = "--search-file", description = "File holding the text to search for.")
        @Nullable
        Path path;
    }

    static final class ReplaceSource {
        @CommandLine.Option(names = "--replace", description = "Replacement text.")
        @Nullable
        String text;

        @CommandLine.Option(names = "--replace-file", description = "File holding the replacement text.")
        @Nullable
        Path path;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CascadeEditCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        ReplacerConfig config;
        String searchText;
        String replaceText;
        try {
            config = loadConfig();
            searchText = textOf(search.text, search.path);
            replaceText = textOf(replace.text, replace.path);
        } catch (IOException e) {
            logger.error("Unable to read input: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        } catch (IllegalArgumentException e) {
            err.println("Error: invalid configuration: " + e.getMessage());
            return EXIT_FAILED;
        }

        var editor = new FileEditor(Path.of(""), new CascadeReplacer(config));
        var blocks = List.of(new SearchReplaceBlock(searchText, replaceText, replaceAll));

        EditResult result;
        if (dryRun) {
            var preview = editor.preview(file, blocks);
            result = preview.result();
            if (result.isSuccess() && !json) {
                out.print(preview.content());
            }
        } else {
            result = editor.edit(file, blocks);
        }

        if (json) {
            out.println(toJson(result));
        } else if (result.isSuccess()) {
            err.println(result.message());
        } else {
            err.println("Error: " + result.message());
        }
        out.flush();
        err.flush();
        return result.isSuccess() ? EXIT_OK : EXIT_FAILED;
    }

    private ReplacerConfig loadConfig() throws IOException {
        if (configPath == null) {
            return ReplacerConfig.fromEnvironment();
        }
        return ReplacerConfig.load(configPath).withEnvironment(System.getenv());
    }

    private static String textOf(@Nullable String text, @Nullable Path path) throws IOException {
        if (text != null) {
            return text;
        }
        assert path != null : "picocli enforces one of the two";
        return Files.readString(path, UTF_8);
    }

    private static String toJson(EditResult result) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("EditResult is always serialisable", e);
        }
    }
}
