package processing;

import java.io.IOException;

/**
 * Container class for the failures that stop a resource from being classified.
 * Messages are written for the status report and are surfaced there verbatim.
 */
public final class LocationExceptions {

    private LocationExceptions() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * Base class for failures that leave a resource's verdict unknown.
     */
    public static class LocationCheckException extends IOException {
        public LocationCheckException(String message) {
            super(message);
        }
        public LocationCheckException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * The resource could not be fetched from the catalog.
     */
    public static final class DownloadException extends LocationCheckException {
        public DownloadException(String message) {
            super(message);
        }
        public DownloadException(String message, Throwable cause) {
            super(message, cause);
        }

        public static DownloadException forResource(String resourceName, Throwable cause) {
            return new DownloadException("Could not download file " + resourceName, cause);
        }
    }

    /**
     * The downloaded archive could not be unpacked, or held nothing of the declared type.
     */
    public static final class ExtractionException extends LocationCheckException {
        public ExtractionException(String message) {
            super(message);
        }
        public ExtractionException(String message, Throwable cause) {
            super(message, cause);
        }

        public static ExtractionException forResource(String resourceName, Throwable cause) {
            return new ExtractionException("Could not unzip resource " + resourceName, cause);
        }
    }

    /**
     * A candidate file could not be read in its declared format.
     */
    public static final class ReadException extends LocationCheckException {
        public ReadException(String message) {
            super(message);
        }
        public ReadException(String message, Throwable cause) {
            super(message, cause);
        }

        /** @param fileName base name of the file or layer that failed */
        public static ReadException forFile(String fileName, Throwable cause) {
            return new ReadException(messageFor(fileName), cause);
        }

        public static String messageFor(String fileName) {
            return "Unable to read resource " + fileName;
        }
    }

    /**
     * None of the declared file types can be checked.
     */
    public static final class UnsupportedFormatException extends LocationCheckException {
        public static final String MESSAGE = "Can't check formats";

        public UnsupportedFormatException() {
            super(MESSAGE);
        }
    }
}
