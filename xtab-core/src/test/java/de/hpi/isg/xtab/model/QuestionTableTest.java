package de.hpi.isg.xtab.model;

import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

/**
 * Test suite for the {@link QuestionTable} class.
 */
public class QuestionTableTest {

    private final SegmentKey male = SegmentKey.ofOption("Gender", "Male");

    private final List<SegmentKey> keys = Arrays.asList(SegmentKey.TOTAL, this.male);

    @Test
    public void testBuiltTableRejectsValueChanges() {
        QuestionTable.Builder builder = QuestionTable.builder("Q1", "Do you agree?", this.keys);
        builder.addRow("Yes", RowKind.FREQUENCY).setValue(SegmentKey.TOTAL, 42d);
        builder.addRow("Yes", RowKind.SIGNIFICANCE).setText(this.male, "A");
        QuestionTable table = builder.build();

        QuestionRow row = table.getRows().get(0);
        Assert.assertTrue(row.isReadOnly());
        try {
            row.setValue(SegmentKey.TOTAL, -1d);
            Assert.fail("Expected an IllegalStateException.");
        } catch (IllegalStateException e) {
            // Expected.
        }
        try {
            table.findRow("Yes", RowKind.SIGNIFICANCE).setText(this.male, "");
            Assert.fail("Expected an IllegalStateException.");
        } catch (IllegalStateException e) {
            // Expected.
        }
        Assert.assertEquals(42d, table.getRows().get(0).getValue(SegmentKey.TOTAL), 0d);
        Assert.assertEquals("A", table.findRow("Yes", RowKind.SIGNIFICANCE).getText(this.male));
    }

    @Test
    public void testBuiltTableRejectsKeyChanges() {
        QuestionTable.Builder builder = QuestionTable.builder("Q1", "Do you agree?", this.keys);
        builder.addRow("Yes", RowKind.FREQUENCY).setValue(this.male, 7d);
        QuestionTable table = builder.build();

        QuestionRow row = table.getRows().get(0);
        try {
            row.getKeys().add(SegmentKey.ofOption("Q", "X"));
            Assert.fail("Expected an UnsupportedOperationException.");
        } catch (UnsupportedOperationException e) {
            // Expected.
        }
        try {
            table.getRows().add(row);
            Assert.fail("Expected an UnsupportedOperationException.");
        } catch (UnsupportedOperationException e) {
            // Expected.
        }
        Assert.assertEquals(this.keys, row.getKeys());
        Assert.assertEquals(7d, row.getValue(this.male), 0d);
        try {
            row.getValue(SegmentKey.ofOption("Q", "X"));
            Assert.fail("Expected a CrosstabException.");
        } catch (CrosstabException e) {
            Assert.assertEquals(ErrorCode.SEGMENT_KEY_MISMATCH, e.getCode());
        }
    }

    @Test
    public void testBuilderRowsStayDetachedFromBuiltTable() {
        QuestionTable.Builder builder = QuestionTable.builder("Q1", "Do you agree?", this.keys);
        QuestionRow row = builder.addRow("Yes", RowKind.FREQUENCY).setValue(SegmentKey.TOTAL, 1d);
        QuestionTable table = builder.build();

        row.setValue(SegmentKey.TOTAL, 2d);
        Assert.assertFalse(row.isReadOnly());
        Assert.assertEquals(1d, table.getRows().get(0).getValue(SegmentKey.TOTAL), 0d);
        Assert.assertEquals(2d, builder.build().getRows().get(0).getValue(SegmentKey.TOTAL), 0d);
    }
}
