package org.example.storyteller.service.backend;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The configured backends, keyed by name, plus the default preference order.
 * Built once at startup and injected wherever backends are needed; read-only afterwards.
 */
public class NarrationBackendRegistry {

    private final Map<String, NarrationBackend> backends;
    private final List<String> defaultPreference;

    public NarrationBackendRegistry(Collection<? extends NarrationBackend> backends, List<String> defaultPreference) {
        Map<String, NarrationBackend> byName = new LinkedHashMap<>();
        for (NarrationBackend backend : backends) {
            NarrationBackend previous = byName.putIfAbsent(normalize(backend.name()), backend);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate narration backend name: " + backend.name());
            }
        }
        this.backends = Collections.unmodifiableMap(byName);
        this.defaultPreference = List.copyOf(defaultPreference);
        resolve(this.defaultPreference);
    }

    public Optional<NarrationBackend> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(backends.get(normalize(name)));
    }

    /**
     * Resolves a preference list to backends in the same order; null or empty means the default order.
     *
     * @throws IllegalArgumentException for unknown or repeated names
     */
    public List<NarrationBackend> resolve(List<String> preference) {
        List<String> names = preference == null || preference.isEmpty() ? defaultPreference : preference;
        if (names.isEmpty()) {
            throw new IllegalArgumentException("No narration backends configured");
        }
        List<NarrationBackend> resolved = new ArrayList<>();
        for (String name : names) {
            NarrationBackend backend = find(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown narration backend: " + name));
            if (resolved.contains(backend)) {
                throw new IllegalArgumentException("Narration backend listed twice: " + name);
            }
            resolved.add(backend);
        }
        return List.copyOf(resolved);
    }

    public Collection<NarrationBackend> getBackends() {
        return backends.values();
    }

    public List<String> getDefaultPreference() {
        return defaultPreference;
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
