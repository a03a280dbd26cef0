package client;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable wrapper for CKAN resource data, downloading through the handler that listed it.
 */
public final class CkanResource implements IResourceHandle {

    private final Map<String, Object> data;
    private final CkanHandler handler;

    /**
     * @param initialData the resource dictionary from the CKAN API; must not be null
     * @param handler     the client used for downloads; must not be null
     */
    public CkanResource(Map<String, Object> initialData, CkanHandler handler) {
        Objects.requireNonNull(initialData, "Initial data map must not be null");
        this.handler = Objects.requireNonNull(handler, "CkanHandler must not be null");
        this.data = Collections.unmodifiableMap(new HashMap<>(initialData));
    }

    public Map<String, Object> getData() {
        return data;
    }

    @Override
    public String getName() {
        Object name = data.get("name");
        return (name == null) ? String.valueOf(data.getOrDefault("id", "")) : String.valueOf(name);
    }

    @Override
    public String getFileType() {
        Object format = data.get("format");
        return (format == null) ? "" : String.valueOf(format).trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public Long getSize() {
        Object size = data.get("size");
        if (size instanceof Number) {
            return ((Number) size).longValue();
        }
        if (size instanceof String && !((String) size).isBlank()) {
            try {
                return Long.parseLong(((String) size).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public String getUrl() {
        Object url = data.get("url");
        return (url == null) ? null : String.valueOf(url);
    }

    @Override
    public Path download(Path folder) throws IOException {
        String url = getUrl();
        if (url == null || url.isBlank()) {
            throw new IOException("Resource " + getName() + " has no URL");
        }
        return handler.download(url, folder);
    }

    @Override
    public String toString() {
        return "CkanResource{name=" + getName() + ", format=" + getFileType() + '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CkanResource)) return false;
        CkanResource that = (CkanResource) o;
        return Objects.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(data);
    }
}
