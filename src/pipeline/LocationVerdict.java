package pipeline;

/**
 * Outcome of one location check. Each verdict is tri-state: {@code TRUE} when the pattern
 * was found, {@code FALSE} when everything was checked without a match, {@code null} when
 * it could not be decided.
 *
 * @param pcoded    whether a pcode column was found
 * @param latLonged whether both a latitude and a longitude column were found
 * @param error     message of the failure that left a verdict undecided, or {@code null}
 */
public record LocationVerdict(Boolean pcoded, Boolean latLonged, String error) {

    public static LocationVerdict unknown(String error) {
        return new LocationVerdict(null, null, error);
    }

    public boolean hasError() {
        return error != null;
    }
}
