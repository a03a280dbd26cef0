package client;

import java.util.List;

/**
 * Read-only view of one catalog dataset.
 */
public interface IDatasetHandle {

    String getName();

    /** Distinct lower-cased resource formats, in listing order. */
    List<String> getFileTypes();

    /** Resources in catalog listing order. */
    List<IResourceHandle> getResources();

    /** Upper-cased location codes (ISO3 on HDX) the dataset is tagged with. */
    List<String> getLocationCodes();
}
