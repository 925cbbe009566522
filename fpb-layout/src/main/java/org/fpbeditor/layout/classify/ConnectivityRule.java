package org.fpbeditor.layout.classify;

import org.fpbeditor.common.State;
import org.fpbeditor.layout.graph.ConnectivityGraph;
import org.fpbeditor.layout.graph.Ranking;

/**
 * Classifies an unhinted state by its operator connections. Always decides, so it closes the
 * chain.
 */
public class ConnectivityRule implements ClassificationRule {

  @Override
  public Category classify(State state, ConnectivityGraph graph, Ranking ranking) {
    String stateId = state.getId();
    if (graph.isIntermediate(stateId))
      return Category.INTERNAL;
    if (graph.isPureSource(stateId))
      return BoundarySides.inputSide(state, graph.getTargetOperators(stateId), ranking);
    if (graph.isPureSink(stateId))
      return BoundarySides.outputSide(state, graph.getSourceOperators(stateId), ranking);

    // referenced, but only by edges that do not end at an operator of this system
    return Category.BOUNDARY_TOP;
  }
}
