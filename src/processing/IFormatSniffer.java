package processing;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Recognises archives by their content signature.
 */
@FunctionalInterface
public interface IFormatSniffer {
    /**
     * @param file a downloaded file
     * @return {@code true} if the file's content is a ZIP archive
     */
    boolean isZipArchive(Path file) throws IOException;
}
