package processing;

import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;
import org.slf4j.Logger;
import util.LoggingUtil;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link IFormatSniffer} backed by Apache Tika's magic-byte detection.
 */
public class TikaFormatSniffer implements IFormatSniffer {

    private static final Logger logger = LoggingUtil.getLogger(TikaFormatSniffer.class);

    private final Tika tika;

    public TikaFormatSniffer() {
        this(new Tika());
    }

    public TikaFormatSniffer(Tika tika) {
        this.tika = Objects.requireNonNull(tika, "Tika facade must not be null");
    }

    @Override
    public boolean isZipArchive(Path file) throws IOException {
        String detected = tika.detect(file);
        logger.debug("Detected media type {} for {}", detected, file.getFileName());
        return MediaType.APPLICATION_ZIP.toString().equals(detected);
    }
}
