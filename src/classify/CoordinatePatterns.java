package classify;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Text forms of a single latitude or longitude accepted as coordinates: signed decimal
 * degrees, degrees-minutes(-seconds) with optional unit marks and colon separators, and
 * the same with a hemisphere letter before or after. Ranges are not checked.
 */
public final class CoordinatePatterns {

    private static final String DEGREES = "\\d+(?:\\.\\d*)?\\s*°?";
    private static final String MINUTES = "\\d+(?:\\.\\d*)?\\s*(?:'|′|‘|’)?";
    private static final String SECONDS = "\\d+(?:\\.\\d*)?\\s*(?:\"|″|''|′′|“|”)?";
    private static final String SEPARATOR = "\\s*:?\\s*";
    private static final String DMS = DEGREES + "(?:" + SEPARATOR + MINUTES + "(?:" + SEPARATOR + SECONDS + ")?)?";

    public static final List<Pattern> LATITUDE = forHemispheres("NS");
    public static final List<Pattern> LONGITUDE = forHemispheres("EW");

    private CoordinatePatterns() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    private static List<Pattern> forHemispheres(String letters) {
        String hemisphere = "[" + letters + "]";
        int flags = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        return List.of(
                Pattern.compile("[+-]?" + DMS, flags),
                Pattern.compile(hemisphere + "\\s*" + DMS, flags),
                Pattern.compile(DMS + "\\s*" + hemisphere, flags));
    }

    public static boolean isLatitude(String value) {
        return matchesAny(LATITUDE, value);
    }

    public static boolean isLongitude(String value) {
        return matchesAny(LONGITUDE, value);
    }

    private static boolean matchesAny(List<Pattern> patterns, String value) {
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        for (Pattern pattern : patterns) {
            if (pattern.matcher(trimmed).matches()) {
                return true;
            }
        }
        return false;
    }
}
