package client;

import client.CkanExceptions.CkanException;

import java.io.IOException;
import java.util.List;

/**
 * A searchable dataset catalog.
 */
public interface ICatalog {

    /**
     * Runs a fresh search on every call.
     *
     * @param filter catalog filter expression, e.g. {@code groups:"tur"}
     * @return every matching dataset in catalog order
     */
    List<IDatasetHandle> searchDatasets(String filter) throws CkanException, IOException;
}
