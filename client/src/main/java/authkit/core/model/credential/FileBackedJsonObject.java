package authkit.core.model.credential;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.jboss.logging.Logger;

import authkit.core.exception.DataIntegrityException;
import authkit.core.port.out.JsonDocumentStore;

/**
 * A JSON object held in memory and optionally backed by a file.
 *
 * <p>Null data means the object has never been loaded or set. An empty map is
 * valid data. Every mutation goes through {@link #checkData(Map)} first, so an
 * invalid update leaves the previous data in place.
 *
 * <p>Instances are not thread-safe.
 */
public abstract class FileBackedJsonObject {

    private static final Logger LOG = Logger.getLogger(FileBackedJsonObject.class);

    private final JsonDocumentStore store;
    private final Clock clock;
    private Map<String, Object> data;
    private Path path;
    private long loadTime;

    protected FileBackedJsonObject(Map<String, ?> data, Path path, JsonDocumentStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.path = path;
        if (data != null) {
            checkData(data);
            this.data = new LinkedHashMap<>(data);
            this.loadTime = clock.instant().getEpochSecond();
        }
    }

    /**
     * Check that the given data is acceptable for this type.
     *
     * <p>Subclasses add their own requirements and must call the superclass.
     *
     * @param data candidate data
     * @throws DataIntegrityException if the data is not valid
     */
    protected void checkData(Map<String, ?> data) {
        if (data == null) {
            throw new DataIntegrityException(
                    "null is not valid data for " + getClass().getSimpleName(), path, null);
        }
    }

    /**
     * Check the current in-memory data.
     *
     * @throws DataIntegrityException if the current data is not valid
     */
    public void check() {
        try {
            checkData(data);
        } catch (DataIntegrityException e) {
            if (path != null) {
                e.withFilePath(path);
            }
            throw e;
        }
    }

    /**
     * Current in-memory data, or null if never loaded. Never reads from storage.
     */
    public Map<String, Object> data() {
        return data == null ? null : Collections.unmodifiableMap(data);
    }

    public Path path() {
        return path;
    }

    public void setPath(Path path) {
        this.path = path;
    }

    protected JsonDocumentStore store() {
        return store;
    }

    protected Clock clock() {
        return clock;
    }

    /**
     * Epoch seconds of the last load, set or save.
     */
    public long loadTime() {
        return loadTime;
    }

    public boolean isLoaded() {
        return data != null;
    }

    /**
     * Replace the in-memory data.
     *
     * @param newData the new data
     * @throws DataIntegrityException if the data is invalid; the current data is kept
     */
    public void setData(Map<String, ?> newData) {
        checkData(newData);
        this.data = new LinkedHashMap<>(newData);
        this.loadTime = clock.instant().getEpochSecond();
    }

    /**
     * Merge a sparse update into the in-memory data.
     *
     * @param sparse values to overlay
     * @throws DataIntegrityException if the merged data is invalid; the current data is kept
     */
    public void updateData(Map<String, ?> sparse) {
        final var merged = new LinkedHashMap<String, Object>();
        if (data != null) {
            merged.putAll(data);
        }
        if (sparse != null) {
            merged.putAll(sparse);
        }
        setData(merged);
    }

    /**
     * Write the data to the backing file. Without a path this only checks the data.
     *
     * @throws DataIntegrityException if the current data is invalid
     */
    public void save() {
        check();
        if (path == null) {
            LOG.debugf("No path set for %s, keeping data in memory", getClass().getSimpleName());
            return;
        }
        store.write(path, data);
        loadTime = clock.instant().getEpochSecond();
    }

    /**
     * Read the data from the backing file.
     *
     * @return whether data was loaded, no path is set, or no file exists
     * @throws DataIntegrityException if the file is unreadable or holds invalid data;
     *                                the current data is kept
     */
    public LoadOutcome load() {
        if (path == null) {
            return LoadOutcome.IN_MEMORY;
        }
        final Optional<Map<String, Object>> read;
        try {
            read = store.read(path);
        } catch (DataIntegrityException e) {
            throw e.withFilePath(path);
        }
        if (read.isEmpty()) {
            return LoadOutcome.NOT_FOUND;
        }
        final var newData = read.get();
        try {
            checkData(newData);
        } catch (DataIntegrityException e) {
            throw e.withFilePath(path);
        }
        this.data = new LinkedHashMap<>(newData);
        this.loadTime = clock.instant().getEpochSecond();
        return LoadOutcome.LOADED;
    }

    /**
     * Load only if no data is held yet.
     */
    public LoadOutcome lazyLoad() {
        if (isLoaded()) {
            return path == null ? LoadOutcome.IN_MEMORY : LoadOutcome.LOADED;
        }
        return load();
    }

    /**
     * Load if no data is held yet, or if the backing file was modified after
     * the last load.
     */
    public LoadOutcome lazyReload() {
        if (!isLoaded()) {
            return load();
        }
        if (path == null) {
            return LoadOutcome.IN_MEMORY;
        }
        final var modified = store.lastModified(path);
        if (modified.isPresent() && modified.get() / 1000 > loadTime) {
            LOG.debugf("%s changed on disk, reloading", path);
            return load();
        }
        return LoadOutcome.LOADED;
    }

    /**
     * Lazy load, then return a field.
     */
    public Optional<Object> lazyGet(String field) {
        lazyLoad();
        if (data == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(data.get(field));
    }

    protected Optional<String> getString(String field) {
        if (data == null) {
            return Optional.empty();
        }
        final var value = data.get(field);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }
}
