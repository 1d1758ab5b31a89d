package datamigrator.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Named {@link TransformFunction}s that transform rules refer to.
 *
 * <p>Not thread-safe for registration; register everything before compiling.
 */
public final class TransformRegistry {

    private final Map<String, TransformFunction> functions = new LinkedHashMap<>();

    /**
     * Registers a function.
     *
     * @throws IllegalArgumentException if the name is already taken
     */
    public TransformRegistry register(String name, TransformFunction function) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(function, "function");
        if (functions.putIfAbsent(name, function) != null) {
            throw new IllegalArgumentException("Transform already registered: " + name);
        }
        return this;
    }

    public Optional<TransformFunction> find(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(functions.keySet());
    }
}
