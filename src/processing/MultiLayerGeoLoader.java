package processing;

import processing.LocationExceptions.ReadException;
import tabular.Table;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads one layer of a multi-layer container through the container reader registered
 * for the resource's type.
 */
final class MultiLayerGeoLoader implements ITableLoader {

    private final Map<FileType, IGeoContainer> containers;

    MultiLayerGeoLoader(Map<FileType, IGeoContainer> containers) {
        this.containers = Objects.requireNonNull(containers, "containers must not be null");
    }

    @Override
    public List<Table> read(Candidate candidate, FileType type, int maxRows) throws ReadException {
        IGeoContainer container = containers.get(type);
        if (container == null || !candidate.isLayer()) {
            throw new ReadException("Unable to read resource " + candidate.displayName());
        }
        return List.of(container.readLayer(candidate.file(), candidate.layer(), maxRows));
    }
}
