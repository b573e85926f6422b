package de.hpi.isg.xtab.banner;

import de.hpi.isg.xtab.model.RespondentTable;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates the membership predicates of a {@link BannerStructure} on a {@link RespondentTable}.
 */
public class BannerSegmenter {

    private final Logger logger = LoggerFactory.getLogger(this.getClass());

    /**
     * Determines the row indices of every banner column.
     *
     * @param table     the (possibly filtered) respondents
     * @param structure the banner columns
     * @return the {@link RowIndexMap} with one entry per {@link BannerColumn}, in banner order
     * @throws de.hpi.isg.xtab.error.CrosstabException if a banner column is not in the data
     */
    public RowIndexMap segment(RespondentTable table, BannerStructure structure) {
        int numRows = table.getNumRows();
        RowIndexMap map = new RowIndexMap(numRows);
        for (BannerColumn column : structure.getColumns()) {
            IntArrayList rows = new IntArrayList();
            if (column.isTotal()) {
                for (int row = 0; row < numRows; row++) rows.add(row);
            } else {
                boolean[] mask = column.getPredicate().evaluate(table);
                for (int row = 0; row < numRows; row++) {
                    if (mask[row]) rows.add(row);
                }
            }
            rows.trim();
            map.put(column.getKey(), rows);
        }
        this.logger.debug("Segmented {} into {}.", table, map);
        return map;
    }
}
