package processing;

import processing.LocationExceptions.ReadException;
import tabular.Table;

import java.util.List;

/**
 * Reads capped samples from one candidate file or layer.
 */
public interface ITableLoader {

    /**
     * @param candidate the file or layer to read
     * @param type      the resource's declared type
     * @param maxRows   maximum number of data rows per returned table
     * @return one table per sheet or layer found; never null
     * @throws ReadException if the candidate cannot be read in the declared format
     */
    List<Table> read(Candidate candidate, FileType type, int maxRows) throws ReadException;
}
