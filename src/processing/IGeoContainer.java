package processing;

import processing.LocationExceptions.ReadException;
import tabular.Table;

import java.nio.file.Path;
import java.util.List;

/**
 * A multi-layer geo container format: lists its layers and reads a capped sample of one.
 */
interface IGeoContainer {

    /** Layer names in the container's own order. */
    List<String> listLayers(Path container) throws ReadException;

    /** Reads at most {@code maxRows} rows of {@code layer}. */
    Table readLayer(Path container, String layer, int maxRows) throws ReadException;
}
