package org.fpbeditor.layout.classify;

/**
 * The category of a state together with the ranks it is attached to.
 */
public class Affinity {

  private final Category category;
  private final int rank;
  private final int sourceRank;
  private final int targetRank;

  Affinity(Category category, int rank, int sourceRank, int targetRank) {
    this.category = category;
    this.rank = rank;
    this.sourceRank = sourceRank;
    this.targetRank = targetRank;
  }

  public Category getCategory() {
    return category;
  }

  /**
   * @return the rank row a left or right boundary state sits beside.
   */
  public int getRank() {
    return rank;
  }

  /**
   * @return the highest rank feeding an internal state.
   */
  public int getSourceRank() {
    return sourceRank;
  }

  /**
   * @return the lowest rank an internal state feeds.
   */
  public int getTargetRank() {
    return targetRank;
  }

  /**
   * @return true for an internal state that flows down to a later rank and is placed in the gap
   *         beneath its source rank.
   */
  public boolean isForward() {
    return category == Category.INTERNAL && sourceRank < targetRank;
  }

  /**
   * @return true for an internal state that flows back up (or stays within one rank); it is
   *         placed in a feedback lane beside the operator column.
   */
  public boolean isFeedback() {
    return category == Category.INTERNAL && sourceRank >= targetRank;
  }

  @Override
  public String toString() {
    return category + "[" + rank + ", " + sourceRank + "->" + targetRank + "]";
  }
}
