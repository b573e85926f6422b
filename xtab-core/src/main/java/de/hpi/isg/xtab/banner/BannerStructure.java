package de.hpi.isg.xtab.banner;

import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;
import de.hpi.isg.xtab.model.SegmentKey;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The complete segmentation: the total column followed by the {@link BannerGroup}s.
 */
public class BannerStructure implements Serializable {

    public static final String TOTAL_LABEL = "Total";

    public static final String TOTAL_LETTER = "-";

    private final BannerColumn totalColumn = new BannerColumn(SegmentKey.TOTAL, TOTAL_LABEL, TOTAL_LETTER, null);

    private final List<BannerGroup> groups;

    /**
     * All {@link BannerColumn}s including the total column, in output order.
     */
    private final LinkedHashMap<SegmentKey, BannerColumn> columns = new LinkedHashMap<>();

    private final Map<SegmentKey, BannerGroup> groupsByKey = new LinkedHashMap<>();

    /**
     * @throws CrosstabException if the groups share any keys
     */
    public BannerStructure(List<BannerGroup> groups) {
        this.groups = new ArrayList<>(groups);
        this.columns.put(this.totalColumn.getKey(), this.totalColumn);
        for (BannerGroup group : groups) {
            for (BannerColumn column : group.getColumns()) {
                if (this.columns.containsKey(column.getKey())) {
                    throw new CrosstabException(
                            ErrorCode.DUPLICATE_SEGMENT_KEY, "Duplicate Banner Column",
                            String.format("Banner column %s is defined more than once.", column.getKey()),
                            "Values of the duplicate columns would overwrite each other.",
                            "Make the display texts of the banner options unique",
                            "Do not use the same banner question twice with the same segmentation"
                    );
                }
                this.columns.put(column.getKey(), column);
                this.groupsByKey.put(column.getKey(), group);
            }
        }
    }

    /**
     * @return a structure with only the total column
     */
    public static BannerStructure totalOnly() {
        return new BannerStructure(Collections.emptyList());
    }

    public BannerColumn getTotalColumn() {
        return this.totalColumn;
    }

    public List<BannerGroup> getGroups() {
        return Collections.unmodifiableList(this.groups);
    }

    public List<SegmentKey> getKeys() {
        return new ArrayList<>(this.columns.keySet());
    }

    public List<BannerColumn> getColumns() {
        return new ArrayList<>(this.columns.values());
    }

    /**
     * @return the {@link BannerColumn} with the given key or {@code null} if there is none
     */
    public BannerColumn getColumn(SegmentKey key) {
        return this.columns.get(key);
    }

    /**
     * @return the {@link BannerGroup} of the given key or {@code null} for the total column
     */
    public BannerGroup getGroup(SegmentKey key) {
        return this.groupsByKey.get(key);
    }

    public int getNumColumns() {
        return this.columns.size();
    }

    @Override
    public String toString() {
        return String.format("BannerStructure[%d groups, %d columns]", this.groups.size(), this.columns.size());
    }
}
