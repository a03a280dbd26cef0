package pipeline;

/**
 * One line of the status report.
 *
 * @param pcoded    pcode verdict, {@code null} when unchecked
 * @param misPcoded latitude/longitude verdict, {@code null} when unchecked
 * @param error     reason the resource was skipped or left undecided, or {@code null}
 */
public record StatusRow(String datasetName, String resourceName, String format,
                        Boolean pcoded, Boolean misPcoded, String error) {

    public static StatusRow skipped(String datasetName, String resourceName, String format, String reason) {
        return new StatusRow(datasetName, resourceName, format, null, null, reason);
    }

    public static StatusRow checked(String datasetName, String resourceName, String format, LocationVerdict verdict) {
        return new StatusRow(datasetName, resourceName, format, verdict.pcoded(), verdict.latLonged(), verdict.error());
    }
}
