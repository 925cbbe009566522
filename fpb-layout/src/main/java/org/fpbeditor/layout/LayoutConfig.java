package org.fpbeditor.layout;

import java.util.Properties;

/**
 * Spacing settings of the layout. Instances are immutable; the {@code with...} methods return
 * modified copies.
 */
public class LayoutConfig {

  public static final String ARTIFACT_ID = "fpb-layout";

  public static final String PROP_PADDING = ARTIFACT_ID + ".padding";
  public static final String PROP_H_GAP = ARTIFACT_ID + ".h-gap";
  public static final String PROP_V_GAP = ARTIFACT_ID + ".v-gap";
  public static final String PROP_SYSTEM_PADDING = ARTIFACT_ID + ".system-padding";
  public static final String PROP_RESOURCE_OFFSET = ARTIFACT_ID + ".resource-offset";

  public static final double DEFAULT_PADDING = 40;
  public static final double DEFAULT_H_GAP = 40;
  public static final double DEFAULT_V_GAP = 80;
  public static final double DEFAULT_SYSTEM_PADDING = 50;
  public static final double DEFAULT_RESOURCE_OFFSET = 40;

  private static final LayoutConfig DEFAULT = new LayoutConfig(DEFAULT_PADDING, DEFAULT_H_GAP,
      DEFAULT_V_GAP, DEFAULT_SYSTEM_PADDING, DEFAULT_RESOURCE_OFFSET);

  private final double padding;
  private final double horizontalGap;
  private final double verticalGap;
  private final double systemPadding;
  private final double resourceOffset;

  /**
   * @throws IllegalArgumentException
   *           if any value is negative or not a number.
   */
  public LayoutConfig(double padding, double horizontalGap, double verticalGap,
      double systemPadding, double resourceOffset) {
    this.padding = check("padding", padding);
    this.horizontalGap = check("horizontal gap", horizontalGap);
    this.verticalGap = check("vertical gap", verticalGap);
    this.systemPadding = check("system padding", systemPadding);
    this.resourceOffset = check("resource offset", resourceOffset);
  }

  public static LayoutConfig defaults() {
    return DEFAULT;
  }

  /**
   * Reads the settings from properties named {@code fpb-layout.*}; missing ones keep their
   * default.
   * 
   * @throws IllegalArgumentException
   *           if a value is not a non-negative number.
   */
  public static LayoutConfig fromProperties(Properties properties) {
    return new LayoutConfig(read(properties, PROP_PADDING, DEFAULT_PADDING),
        read(properties, PROP_H_GAP, DEFAULT_H_GAP), read(properties, PROP_V_GAP, DEFAULT_V_GAP),
        read(properties, PROP_SYSTEM_PADDING, DEFAULT_SYSTEM_PADDING),
        read(properties, PROP_RESOURCE_OFFSET, DEFAULT_RESOURCE_OFFSET));
  }

  private static double read(Properties properties, String name, double defaultValue) {
    String value = properties.getProperty(name);
    if (value == null || value.trim().isEmpty())
      return defaultValue;
    try {
      return Double.parseDouble(value.trim());
    }
    catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Property " + name + " is not a number: " + value, ex);
    }
  }

  private static double check(String name, double value) {
    if (Double.isNaN(value) || Double.isInfinite(value) || value < 0)
      throw new IllegalArgumentException("The " + name + " must be a non-negative number: "
          + value);
    return value;
  }

  /**
   * @return the space between the diagram origin and the first element.
   */
  public double getPadding() {
    return padding;
  }

  /**
   * @return the gap between siblings placed side by side, or stacked beside a rank row.
   */
  public double getHorizontalGap() {
    return horizontalGap;
  }

  /**
   * @return the gap between rank rows.
   */
  public double getVerticalGap() {
    return verticalGap;
  }

  /**
   * @return the margin between the core of a system and its boundary.
   */
  public double getSystemPadding() {
    return systemPadding;
  }

  /**
   * @return the distance of the technical resource column from the system boundary.
   */
  public double getResourceOffset() {
    return resourceOffset;
  }

  /**
   * @return the horizontal space left between two systems.
   */
  public double getSystemGap() {
    return horizontalGap * 3;
  }

  public LayoutConfig withPadding(double padding) {
    return new LayoutConfig(padding, horizontalGap, verticalGap, systemPadding, resourceOffset);
  }

  public LayoutConfig withHorizontalGap(double horizontalGap) {
    return new LayoutConfig(padding, horizontalGap, verticalGap, systemPadding, resourceOffset);
  }

  public LayoutConfig withVerticalGap(double verticalGap) {
    return new LayoutConfig(padding, horizontalGap, verticalGap, systemPadding, resourceOffset);
  }

  public LayoutConfig withSystemPadding(double systemPadding) {
    return new LayoutConfig(padding, horizontalGap, verticalGap, systemPadding, resourceOffset);
  }

  public LayoutConfig withResourceOffset(double resourceOffset) {
    return new LayoutConfig(padding, horizontalGap, verticalGap, systemPadding, resourceOffset);
  }

  @Override
  public String toString() {
    return "padding=" + padding + ", hGap=" + horizontalGap + ", vGap=" + verticalGap
        + ", systemPadding=" + systemPadding + ", resourceOffset=" + resourceOffset;
  }
}
