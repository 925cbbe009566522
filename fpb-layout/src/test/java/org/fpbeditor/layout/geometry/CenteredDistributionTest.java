package org.fpbeditor.layout.geometry;

import org.junit.Assert;
import org.junit.Test;

public class CenteredDistributionTest {

  private static final double DELTA = 1e-9;

  @Test
  public void testSpan() {
    Assert.assertEquals(0, CenteredDistribution.span(0, 55, 40), DELTA);
    Assert.assertEquals(55, CenteredDistribution.span(1, 55, 40), DELTA);
    Assert.assertEquals(3 * 55 + 2 * 40, CenteredDistribution.span(3, 55, 40), DELTA);
  }

  @Test
  public void testSingleItemCentered() {
    double[] xs = CenteredDistribution.distribute(1, 150, 40, 200);
    Assert.assertEquals(1, xs.length);
    Assert.assertEquals(125, xs[0], DELTA);
  }

  @Test
  public void testSymmetricAroundAnchor() {
    double[] xs = CenteredDistribution.distribute(4, 55, 40, 500);

    Assert.assertEquals(4, xs.length);
    Assert.assertEquals(500 - CenteredDistribution.span(4, 55, 40) / 2, xs[0], DELTA);
    for (int i = 1; i < xs.length; i++) {
      Assert.assertEquals(95, xs[i] - xs[i - 1], DELTA);
    }
    Assert.assertEquals(500, (xs[0] + xs[3] + 55) / 2, DELTA);
  }

  @Test
  public void testNothingToDistribute() {
    Assert.assertEquals(0, CenteredDistribution.distribute(0, 55, 40, 10).length);
  }
}
