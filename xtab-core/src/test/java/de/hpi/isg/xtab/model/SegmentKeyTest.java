package de.hpi.isg.xtab.model;

import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;
import org.junit.Assert;
import org.junit.Test;

/**
 * Test suite for the {@link SegmentKey} class.
 */
public class SegmentKeyTest {

    @Test
    public void testParse() {
        Assert.assertSame(SegmentKey.TOTAL, SegmentKey.parse(SegmentKey.TOTAL.toString()));

        SegmentKey option = SegmentKey.ofOption("Gender", "Male");
        Assert.assertEquals("Gender::Male", option.toString());
        Assert.assertEquals(option, SegmentKey.parse("Gender::Male"));

        SegmentKey category = SegmentKey.ofBoxCategory("Age", "Young");
        Assert.assertEquals(category, SegmentKey.parse(category.toString()));
        Assert.assertEquals(SegmentKey.Kind.BOX_CATEGORY, SegmentKey.parse(category.toString()).getKind());
        Assert.assertNotEquals(option, SegmentKey.ofBoxCategory("Gender", "Male"));

        // Display texts may contain the separator themselves.
        Assert.assertEquals("a::b", SegmentKey.parse("Q1::a::b").getValue());
    }

    @Test
    public void testInvalidKeys() {
        for (String text : new String[]{"Male", "::Male", "Gender::", "TOTAL::x"}) {
            try {
                SegmentKey.parse(text);
                Assert.fail("Key should be rejected: " + text);
            } catch (CrosstabException e) {
                Assert.assertEquals(ErrorCode.INVALID_SEGMENT_KEY, e.getCode());
            }
        }
    }

    @Test
    public void testOptionCannotImitateBoxCategory() {
        try {
            SegmentKey.ofOption("Q", "BOXCAT::X");
            Assert.fail("Expected a CrosstabException.");
        } catch (CrosstabException e) {
            Assert.assertEquals(ErrorCode.INVALID_SEGMENT_KEY, e.getCode());
        }

        SegmentKey category = SegmentKey.ofBoxCategory("Q", "X");
        Assert.assertEquals("Q::BOXCAT::X", category.toString());
        Assert.assertEquals(SegmentKey.Kind.BOX_CATEGORY, SegmentKey.parse("Q::BOXCAT::X").getKind());

        // Only the prefix is reserved.
        Assert.assertEquals(SegmentKey.Kind.OPTION, SegmentKey.ofOption("Q", "NO BOXCAT::X").getKind());
    }
}
