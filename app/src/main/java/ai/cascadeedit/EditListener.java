package ai.cascadeedit;

/**
 * Listener notified after {@link FileEditor} has written a file. Not called for edits that failed or that
 * left the file unchanged.
 */
public interface EditListener {
    void onFileEdited(EditEvent event);
}
