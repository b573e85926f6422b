package de.hpi.isg.xtab.banner;

import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;
import de.hpi.isg.xtab.model.SegmentKey;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Materialized segmentation of a (possibly filtered) {@link de.hpi.isg.xtab.model.RespondentTable}: the ascending
 * row indices of each {@link SegmentKey}.
 */
public class RowIndexMap {

    private final int numRows;

    private final LinkedHashMap<SegmentKey, IntList> indices = new LinkedHashMap<>();

    public RowIndexMap(int numRows) {
        this.numRows = numRows;
    }

    void put(SegmentKey key, IntList rows) {
        this.indices.put(key, IntLists.unmodifiable(rows));
    }

    /**
     * @return the number of rows of the segmented table
     */
    public int getNumRows() {
        return this.numRows;
    }

    /**
     * @return the row indices of the given key
     * @throws CrosstabException if the key was not segmented
     */
    public IntList get(SegmentKey key) {
        IntList rows = this.indices.get(key);
        if (rows == null) {
            throw new CrosstabException(
                    ErrorCode.SEGMENT_KEY_MISMATCH, "Segment Key Mismatch",
                    String.format("No row indices for %s.", key),
                    "Values for this banner column cannot be computed.",
                    "This is an internal error - check that the banner structure and row index map match"
            );
        }
        return rows;
    }

    public boolean contains(SegmentKey key) {
        return this.indices.containsKey(key);
    }

    public List<SegmentKey> getKeys() {
        return new ArrayList<>(this.indices.keySet());
    }

    public Map<SegmentKey, IntList> asMap() {
        return Collections.unmodifiableMap(this.indices);
    }

    @Override
    public String toString() {
        return String.format("RowIndexMap[%d rows, %d segments]", this.numRows, this.indices.size());
    }
}
