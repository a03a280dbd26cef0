package processing;

import processing.LocationExceptions.ReadException;
import tabular.Table;

import java.util.List;

/**
 * Reads single-layer geo files: shapefiles through their attribute table, every JSON
 * flavour through the GeoJSON reader.
 */
final class SingleLayerGeoLoader implements ITableLoader {

    private final ITableLoader shapefiles;
    private final ITableLoader geoJson;

    SingleLayerGeoLoader() {
        this(new ShapefileLoader(), new GeoJsonLoader());
    }

    SingleLayerGeoLoader(ITableLoader shapefiles, ITableLoader geoJson) {
        this.shapefiles = shapefiles;
        this.geoJson = geoJson;
    }

    @Override
    public List<Table> read(Candidate candidate, FileType type, int maxRows) throws ReadException {
        return (type == FileType.SHP ? shapefiles : geoJson).read(candidate, type, maxRows);
    }
}
