package authkit.core.port.out;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Port for reading and writing JSON object documents on disk.
 *
 * <p>Implementations decide the on-disk encoding from the path (plain JSON or
 * externally encrypted) and restrict file permissions to the owner.
 */
public interface JsonDocumentStore {

    /**
     * Read a JSON object document.
     *
     * @param path the document path
     * @return the parsed object, or empty if no file exists at the path
     * @throws authkit.core.exception.DataIntegrityException if the file exists but is not a JSON object
     */
    Optional<Map<String, Object>> read(Path path);

    /**
     * Write a JSON object document, replacing any existing file.
     *
     * @param path the document path
     * @param data the object to write; null values are omitted
     */
    void write(Path path, Map<String, Object> data);

    /**
     * Last modification time of the document, or empty if the file does not exist.
     *
     * @param path the document path
     * @return modification time in epoch milliseconds
     */
    Optional<Long> lastModified(Path path);
}
