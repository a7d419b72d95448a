package authkit.core.model.credential;

/**
 * Result of loading a file backed object.
 */
public enum LoadOutcome {
    /** Data was read from the backing file. */
    LOADED,
    /** No path is set; the in-memory data stays authoritative. */
    IN_MEMORY,
    /** A path is set but no file exists there yet. In-memory data is untouched. */
    NOT_FOUND
}
