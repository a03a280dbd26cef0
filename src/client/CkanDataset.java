package client;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable wrapper for a CKAN package dictionary.
 */
public final class CkanDataset implements IDatasetHandle {

    private final Map<String, Object> data;
    private final List<IResourceHandle> resources;

    public CkanDataset(Map<String, Object> initialData, CkanHandler handler) {
        Objects.requireNonNull(initialData, "Initial data map must not be null");
        Objects.requireNonNull(handler, "CkanHandler must not be null");
        this.data = Collections.unmodifiableMap(new HashMap<>(initialData));

        List<IResourceHandle> wrapped = new ArrayList<>();
        for (Map<String, Object> resource : dictionaries(data.get("resources"))) {
            wrapped.add(new CkanResource(resource, handler));
        }
        this.resources = Collections.unmodifiableList(wrapped);
    }

    public Map<String, Object> getData() {
        return data;
    }

    @Override
    public String getName() {
        return String.valueOf(data.getOrDefault("name", ""));
    }

    @Override
    public List<String> getFileTypes() {
        Set<String> types = new LinkedHashSet<>();
        for (IResourceHandle resource : resources) {
            if (!resource.getFileType().isEmpty()) {
                types.add(resource.getFileType());
            }
        }
        return List.copyOf(types);
    }

    @Override
    public List<IResourceHandle> getResources() {
        return resources;
    }

    @Override
    public List<String> getLocationCodes() {
        List<String> codes = new ArrayList<>();
        for (Map<String, Object> group : dictionaries(data.get("groups"))) {
            Object name = group.get("name");
            if (name != null) {
                codes.add(String.valueOf(name).toUpperCase(Locale.ROOT));
            }
        }
        return codes;
    }

    @SuppressWarnings("unchecked") // CKAN lists of dictionaries arrive as List<Map>
    private static List<Map<String, Object>> dictionaries(Object value) {
        List<Map<String, Object>> maps = new ArrayList<>();
        if (value instanceof List<?>) {
            for (Object item : (List<?>) value) {
                if (item instanceof Map<?, ?>) {
                    maps.add((Map<String, Object>) item);
                }
            }
        }
        return maps;
    }

    @Override
    public String toString() {
        return "CkanDataset{name=" + getName() + ", resources=" + resources.size() + '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CkanDataset)) return false;
        CkanDataset that = (CkanDataset) o;
        return Objects.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(data);
    }
}
