package processing;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A file believed to hold tabular data, optionally narrowed to one layer of a
 * multi-layer container.
 *
 * @param file  the file or container directory on disk
 * @param layer layer name inside {@code file}, or {@code null} for plain files
 */
public record Candidate(Path file, String layer) {

    public Candidate {
        Objects.requireNonNull(file, "file must not be null");
        if (layer != null && layer.isBlank()) {
            throw new IllegalArgumentException("layer must not be blank");
        }
    }

    public static Candidate of(Path file) {
        return new Candidate(file, null);
    }

    public static Candidate layer(Path container, String layer) {
        return new Candidate(container, Objects.requireNonNull(layer, "layer must not be null"));
    }

    public boolean isLayer() {
        return layer != null;
    }

    /** The container path joined with the layer name. */
    public Path pseudoPath() {
        return isLayer() ? file.resolve(layer) : file;
    }

    /** Base name used in error messages: the layer name, or the file name. */
    public String displayName() {
        return isLayer() ? layer : String.valueOf(file.getFileName());
    }

    @Override
    public String toString() {
        return pseudoPath().toString();
    }
}
