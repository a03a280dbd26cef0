package client;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Read-only view of one catalog resource, able to fetch its file.
 */
public interface IResourceHandle {

    String getName();

    /** Lower-cased declared format, or an empty string when none is declared. */
    String getFileType();

    /** Declared size in bytes, or {@code null} when the catalog does not know it. */
    Long getSize();

    /**
     * Downloads the resource into {@code folder}.
     *
     * @return the downloaded file
     * @throws IOException if the file cannot be fetched; partial files may be left behind
     */
    Path download(Path folder) throws IOException;
}
