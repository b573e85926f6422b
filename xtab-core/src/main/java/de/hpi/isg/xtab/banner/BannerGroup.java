package de.hpi.isg.xtab.banner;

import de.hpi.isg.xtab.model.SegmentKey;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The {@link BannerColumn}s that stem from the same banner question. Significance tests compare only columns of the
 * same group.
 */
public class BannerGroup implements Serializable {

    private final String questionCode;

    private final String label;

    private final SegmentationKind kind;

    private final List<BannerColumn> columns;

    public BannerGroup(String questionCode, String label, SegmentationKind kind, List<BannerColumn> columns) {
        this.questionCode = questionCode;
        this.label = label;
        this.kind = kind;
        this.columns = new ArrayList<>(columns);
    }

    public String getQuestionCode() {
        return this.questionCode;
    }

    public String getLabel() {
        return this.label;
    }

    public SegmentationKind getKind() {
        return this.kind;
    }

    public List<BannerColumn> getColumns() {
        return Collections.unmodifiableList(this.columns);
    }

    public List<SegmentKey> getKeys() {
        return this.columns.stream().map(BannerColumn::getKey).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return String.format("BannerGroup[%s, %d columns]", this.questionCode, this.columns.size());
    }
}
