package unionfind;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class LabelRangeTest {

  @Test
  public void spanCoversBothRanges() {
    LabelRange left = LabelRange.of(1, 4);
    LabelRange right = LabelRange.of(7, 9);
    assertEquals(LabelRange.of(1, 9), left.span(right));
    assertEquals(left.span(right), right.span(left));
  }

  @Test
  public void spanReturnsEnclosingRangeItself() {
    LabelRange outer = LabelRange.of(0, 10);
    LabelRange inner = LabelRange.of(3, 5);
    assertSame(outer, outer.span(inner));
    assertSame(outer, inner.span(outer));
  }

  @Test
  public void spanIsAssociative() {
    LabelRange a = LabelRange.singleton(5);
    LabelRange b = LabelRange.of(-2, 0);
    LabelRange c = LabelRange.of(8, 12);
    assertEquals(a.span(b).span(c), a.span(b.span(c)));
  }

  @Test
  public void containsAndWidth() {
    LabelRange range = LabelRange.of(2, 6);
    assertTrue(range.contains(2));
    assertTrue(range.contains(6));
    assertFalse(range.contains(7));
    assertEquals(5, range.width());
    assertEquals(1, LabelRange.singleton(3).width());
    assertEquals(1L << 32, LabelRange.of(Integer.MIN_VALUE, Integer.MAX_VALUE).width());
  }

  @Test
  public void valueSemantics() {
    assertEquals(LabelRange.of(3, 3), LabelRange.singleton(3));
    assertEquals(LabelRange.of(1, 2).hashCode(), LabelRange.of(1, 2).hashCode());
    assertNotEquals(LabelRange.of(1, 2), LabelRange.of(1, 3));
    assertEquals("[1..2]", LabelRange.of(1, 2).toString());
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsInvertedRange() {
    LabelRange.of(4, 3);
  }
}
