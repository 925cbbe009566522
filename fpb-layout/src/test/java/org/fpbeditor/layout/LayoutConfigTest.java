package org.fpbeditor.layout;

import java.util.Properties;

import org.junit.Assert;
import org.junit.Test;

public class LayoutConfigTest {

  private static final double DELTA = 1e-9;

  @Test
  public void testDefaults() {
    LayoutConfig config = LayoutConfig.defaults();

    Assert.assertEquals(40, config.getPadding(), DELTA);
    Assert.assertEquals(40, config.getHorizontalGap(), DELTA);
    Assert.assertEquals(80, config.getVerticalGap(), DELTA);
    Assert.assertEquals(50, config.getSystemPadding(), DELTA);
    Assert.assertEquals(40, config.getResourceOffset(), DELTA);
    Assert.assertEquals(120, config.getSystemGap(), DELTA);
  }

  @Test
  public void testWithCopies() {
    LayoutConfig config = LayoutConfig.defaults().withHorizontalGap(10).withVerticalGap(20);

    Assert.assertEquals(10, config.getHorizontalGap(), DELTA);
    Assert.assertEquals(20, config.getVerticalGap(), DELTA);
    Assert.assertEquals(30, config.getSystemGap(), DELTA);
    Assert.assertEquals(40, LayoutConfig.defaults().getHorizontalGap(), DELTA);
    Assert.assertEquals(7, config.withPadding(7).getPadding(), DELTA);
    Assert.assertEquals(8, config.withSystemPadding(8).getSystemPadding(), DELTA);
    Assert.assertEquals(9, config.withResourceOffset(9).getResourceOffset(), DELTA);
  }

  @Test
  public void testFromProperties() {
    Properties properties = new Properties();
    properties.setProperty(LayoutConfig.PROP_H_GAP, " 25 ");
    properties.setProperty(LayoutConfig.PROP_SYSTEM_PADDING, "12.5");
    properties.setProperty(LayoutConfig.PROP_V_GAP, "");
    LayoutConfig config = LayoutConfig.fromProperties(properties);

    Assert.assertEquals(25, config.getHorizontalGap(), DELTA);
    Assert.assertEquals(12.5, config.getSystemPadding(), DELTA);
    Assert.assertEquals(LayoutConfig.DEFAULT_V_GAP, config.getVerticalGap(), DELTA);
    Assert.assertEquals(LayoutConfig.DEFAULT_PADDING, config.getPadding(), DELTA);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNotANumber() {
    Properties properties = new Properties();
    properties.setProperty(LayoutConfig.PROP_PADDING, "wide");
    LayoutConfig.fromProperties(properties);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegative() {
    LayoutConfig.defaults().withVerticalGap(-1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInfinite() {
    new LayoutConfig(0, Double.POSITIVE_INFINITY, 0, 0, 0);
  }
}
