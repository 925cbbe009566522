package org.fpbeditor.layout.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.apache.log4j.Logger;
import org.fpbeditor.common.ProcessOperator;
import org.fpbeditor.common.State;

/**
 * Orders process operators into ranks with a layered topological sort. Operator A precedes B if
 * some state is an output of A and an input of B. Cycles are broken by forcing the remaining
 * operator with the lowest in-degree (then the lowest id) into the current rank, so the sort
 * always terminates with a total order.
 */
public class RankSequencer {

  private static final Logger LOG = Logger.getLogger(RankSequencer.class);

  /**
   * Ranks the operators that appear in at least one flow or usage; the others are left unranked.
   */
  public Ranking rank(List<ProcessOperator> operators, List<State> states, ConnectivityGraph graph) {
    Map<String, Set<String>> successors = new LinkedHashMap<>();
    Map<String, Integer> inDegree = new LinkedHashMap<>();
    for (ProcessOperator operator : operators) {
      if (!graph.isReferenced(operator.getId()))
        continue;
      successors.put(operator.getId(), new TreeSet<String>());
      inDegree.put(operator.getId(), 0);
    }

    // precedence edges are induced by the states linking an output to an input
    for (State state : states) {
      for (String source : graph.getSourceOperators(state.getId())) {
        for (String target : graph.getTargetOperators(state.getId())) {
          if (source.equals(target) || !successors.containsKey(source)
              || !successors.containsKey(target))
            continue;
          if (successors.get(source).add(target))
            inDegree.put(target, inDegree.get(target) + 1);
        }
      }
    }

    Map<String, Integer> ranks = new LinkedHashMap<>();
    List<String> order = new ArrayList<>();
    Set<String> remaining = new TreeSet<>(successors.keySet());
    int currentRank = 0;
    int forced = 0;
    while (!remaining.isEmpty()) {
      List<String> ready = new ArrayList<>();
      for (String operatorId : remaining) {
        if (inDegree.get(operatorId) == 0)
          ready.add(operatorId);
      }
      if (ready.isEmpty()) {
        ready.add(pickCycleBreaker(remaining, inDegree));
        forced++;
      }

      for (String operatorId : ready) {
        order.add(operatorId);
        ranks.put(operatorId, currentRank);
        remaining.remove(operatorId);
      }
      for (String operatorId : ready) {
        for (String successor : successors.get(operatorId)) {
          if (remaining.contains(successor))
            inDegree.put(successor, inDegree.get(successor) - 1);
        }
      }
      currentRank++;
    }

    if (LOG.isDebugEnabled())
      LOG.debug(ranks.size() + " operators ranked into " + currentRank + " ranks, " + forced
          + " cycle(s) broken.");
    return new Ranking(ranks, order);
  }

  private static String pickCycleBreaker(Set<String> remaining, Map<String, Integer> inDegree) {
    List<String> candidates = new ArrayList<>(remaining);
    // remaining is id-sorted, so the first lowest in-degree also has the lowest id
    String best = candidates.get(0);
    for (String candidate : candidates) {
      if (inDegree.get(candidate) < inDegree.get(best))
        best = candidate;
    }
    return best;
  }

  /**
   * @return the operators grouped by rank, each group in id order.
   */
  public static List<List<String>> layers(Ranking ranking) {
    List<List<String>> layers = new ArrayList<>();
    for (int rank = 0; rank <= ranking.getMaxRank(); rank++) {
      layers.add(new ArrayList<String>());
    }
    for (String operatorId : ranking.getOrder()) {
      layers.get(ranking.getRank(operatorId)).add(operatorId);
    }
    return layers;
  }
}
