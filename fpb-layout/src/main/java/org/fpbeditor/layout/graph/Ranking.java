package org.fpbeditor.layout.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The vertical order of the process operators of one system: every ranked operator has an
 * integer rank starting at 0, operators sharing a rank are kept in id order.
 */
public class Ranking {

  private final Map<String, Integer> ranks;
  private final List<String> order;
  private final int maxRank;

  Ranking(Map<String, Integer> ranks, List<String> order) {
    this.ranks = Collections.unmodifiableMap(new LinkedHashMap<>(ranks));
    this.order = Collections.unmodifiableList(new ArrayList<>(order));
    int max = -1;
    for (int rank : ranks.values()) {
      max = Math.max(max, rank);
    }
    this.maxRank = max;
  }

  /**
   * @return the rank of the operator, or null if the operator was not ranked.
   */
  public Integer getRank(String operatorId) {
    return ranks.get(operatorId);
  }

  public boolean isRanked(String operatorId) {
    return ranks.containsKey(operatorId);
  }

  /**
   * @return the highest rank, or -1 if no operator was ranked.
   */
  public int getMaxRank() {
    return maxRank;
  }

  /**
   * @return the ranked operator ids, by rank, then by id.
   */
  public List<String> getOrder() {
    return order;
  }

  /**
   * @return the smallest rank among the given operators; unranked ones are skipped. Null if none
   *         of them is ranked.
   */
  public Integer getMinRank(Collection<String> operatorIds) {
    Integer min = null;
    for (String operatorId : operatorIds) {
      Integer rank = ranks.get(operatorId);
      if (rank != null && (min == null || rank < min))
        min = rank;
    }
    return min;
  }

  /**
   * @return the largest rank among the given operators; unranked ones are skipped. Null if none
   *         of them is ranked.
   */
  public Integer getMaxRank(Collection<String> operatorIds) {
    Integer max = null;
    for (String operatorId : operatorIds) {
      Integer rank = ranks.get(operatorId);
      if (rank != null && (max == null || rank > max))
        max = rank;
    }
    return max;
  }
}
