package authkit.core.service.request;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Mutable header view of an outgoing request, so authenticators can decorate
 * requests of any HTTP library.
 */
public interface RequestHeaders {

    Optional<String> get(String name);

    void set(String name, String value);

    default boolean contains(String name) {
        return get(name).isPresent();
    }

    /**
     * Headers backed by a map. Names are matched case-insensitively.
     */
    static RequestHeaders of(Map<String, String> headers) {
        return new MapRequestHeaders(headers);
    }

    /**
     * Case-insensitive view that writes through to the given map.
     */
    final class MapRequestHeaders implements RequestHeaders {
        private final Map<String, String> target;

        MapRequestHeaders(Map<String, String> target) {
            this.target = target;
        }

        @Override
        public Optional<String> get(String name) {
            final var view = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
            view.putAll(target);
            return Optional.ofNullable(view.get(name));
        }

        @Override
        public void set(String name, String value) {
            target.keySet().removeIf(k -> k.equalsIgnoreCase(name));
            target.put(name, value);
        }
    }
}
