package authkit.core.exception;

import java.nio.file.Path;

/**
 * Data held by, or loaded into, a file backed JSON object failed its validity contract.
 */
public class DataIntegrityException extends AuthException {

    private Path filePath;

    public DataIntegrityException(String message) {
        super(message);
    }

    public DataIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }

    public DataIntegrityException(String message, Path filePath, Throwable cause) {
        super(message, cause);
        this.filePath = filePath;
    }

    public Path filePath() {
        return filePath;
    }

    public DataIntegrityException withFilePath(Path filePath) {
        this.filePath = filePath;
        return this;
    }

    @Override
    public String getMessage() {
        if (filePath == null) {
            return super.getMessage();
        }
        return super.getMessage() + " (File: " + filePath + ")";
    }
}
