package authkit.adapter.out.storage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.jboss.logging.Logger;

import authkit.core.exception.DataIntegrityException;
import authkit.core.port.out.JsonDocumentStore;

/**
 * Stores JSON object documents as files.
 *
 * <p>Files whose name ends in {@code .sops.json} are decrypted and encrypted with
 * the external {@code sops} tool. Everything else is plain JSON, written
 * pretty-printed with sorted keys and without null values. Written files are
 * readable and writable by the owner only.
 */
public class JsonFileStorage implements JsonDocumentStore {

    private static final Logger LOG = Logger.getLogger(JsonFileStorage.class);
    private static final String SOPS_SUFFIX = ".sops.json";
    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private final String sopsCommand;

    public JsonFileStorage() {
        this("sops");
    }

    public JsonFileStorage(String sopsCommand) {
        this.sopsCommand = sopsCommand;
    }

    @Override
    public Optional<Map<String, Object>> read(Path path) {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        final String json;
        try {
            json = isSopsPath(path) ? readSops(path) : readPlain(path);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new DataIntegrityException("Failed to read JSON file: " + e.getMessage(), path, e);
        }
        try {
            final Map<String, Object> data = objectMapper.readValue(json, MAP_TYPE);
            if (data == null) {
                throw new DataIntegrityException("JSON file does not hold an object", path, null);
            }
            return Optional.of(data);
        } catch (JsonProcessingException e) {
            throw new DataIntegrityException("Failed to parse JSON file: " + e.getOriginalMessage(), path, e);
        }
    }

    @Override
    public void write(Path path, Map<String, Object> data) {
        try {
            final var parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            final var json = objectMapper.writeValueAsString(data);
            if (isSopsPath(path)) {
                writeSops(path, json);
            } else {
                writePlain(path, json);
            }
        } catch (IOException e) {
            throw new DataIntegrityException("Failed to write JSON file: " + e.getMessage(), path, e);
        }
    }

    @Override
    public Optional<Long> lastModified(Path path) {
        try {
            return Optional.of(Files.getLastModifiedTime(path).toMillis());
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new DataIntegrityException("Failed to stat file: " + e.getMessage(), path, e);
        }
    }

    static boolean isSopsPath(Path path) {
        final var name = path.getFileName();
        return name != null && name.toString().endsWith(SOPS_SUFFIX);
    }

    private String readPlain(Path path) throws IOException {
        LOG.debugf("Loading JSON data from file %s", path);
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    private void writePlain(Path path, String json) throws IOException {
        LOG.debugf("Writing JSON data to file %s", path);
        if (!Files.exists(path)) {
            Files.createFile(path);
        }
        restrictPermissions(path);
        Files.writeString(path, json, StandardCharsets.UTF_8);
    }

    private String readSops(Path path) throws IOException {
        LOG.debugf("Loading JSON data from SOPS encrypted file %s", path);
        return runSops(List.of(sopsCommand, "-d", path.toString()));
    }

    private void writeSops(Path path, String json) throws IOException {
        LOG.debugf("Writing JSON data to SOPS encrypted file %s", path);
        writePlain(path, json);
        runSops(List.of(sopsCommand, "-e", "--input-type", "json", "--output-type", "json", "-i", path.toString()));
    }

    private String runSops(List<String> command) throws IOException {
        final var process = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();
        final String output;
        try (InputStream in = process.getInputStream()) {
            output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        try {
            final var exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new IOException("sops exited with status " + exitCode);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted waiting for sops", e);
        }
        return output;
    }

    private void restrictPermissions(Path path) throws IOException {
        try {
            Files.setPosixFilePermissions(path, OWNER_ONLY);
        } catch (UnsupportedOperationException e) {
            LOG.debugf("POSIX permissions not supported for %s", path);
        }
    }
}
