package org.fpbeditor.layout.classify;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;
import org.fpbeditor.common.State;
import org.fpbeditor.layout.graph.ConnectivityGraph;
import org.fpbeditor.layout.graph.Ranking;

/**
 * Classifies the states of a system and ties each of them to the ranks it is drawn next to.
 */
public class AffinityAssigner {

  private static final Logger LOG = Logger.getLogger(AffinityAssigner.class);

  private final StateClassifier classifier;

  public AffinityAssigner() {
    this(new StateClassifier());
  }

  public AffinityAssigner(StateClassifier classifier) {
    this.classifier = classifier;
  }

  /**
   * @return the affinity of every state, in state order.
   */
  public Map<String, Affinity> assign(List<State> states, ConnectivityGraph graph, Ranking ranking) {
    Map<String, Affinity> affinities = new LinkedHashMap<>();
    Map<Category, Integer> counts = new EnumMap<>(Category.class);
    for (State state : states) {
      Category category = classifier.classify(state, graph, ranking);
      affinities.put(state.getId(), assign(state, category, graph, ranking));
      Integer count = counts.get(category);
      counts.put(category, (count == null) ? 1 : count + 1);
    }
    if (LOG.isDebugEnabled())
      LOG.debug("State categories: " + counts);
    return affinities;
  }

  Affinity assign(State state, Category category, ConnectivityGraph graph, Ranking ranking) {
    List<String> sources = graph.getSourceOperators(state.getId());
    List<String> targets = graph.getTargetOperators(state.getId());
    Integer sourceRank = ranking.getMaxRank(sources);
    Integer targetRank = ranking.getMinRank(targets);

    switch (category) {
      case BOUNDARY_LEFT:
        return new Affinity(category, firstOf(targetRank, ranking.getMinRank(sources), 0), 0, 0);
      case BOUNDARY_RIGHT:
        return new Affinity(category, firstOf(sourceRank, ranking.getMaxRank(targets), 0), 0, 0);
      case INTERNAL:
        int source = firstOf(sourceRank, targetRank, 0);
        int target = (targetRank != null) ? targetRank : source + 1;
        return new Affinity(category, source, source, target);
      default:
        return new Affinity(category, 0, 0, 0);
    }
  }

  private static int firstOf(Integer first, Integer second, int fallback) {
    if (first != null)
      return first;
    return (second != null) ? second : fallback;
  }
}
