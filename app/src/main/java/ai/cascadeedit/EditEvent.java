package ai.cascadeedit;

import java.nio.file.Path;

/** A file was rewritten by {@link FileEditor}; both contents are the full file text. */
public record EditEvent(Path path, String beforeContent, String afterContent) {}
