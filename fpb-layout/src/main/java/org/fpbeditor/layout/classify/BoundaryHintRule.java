package org.fpbeditor.layout.classify;

import org.fpbeditor.common.Placement;
import org.fpbeditor.common.State;
import org.fpbeditor.common.StateType;
import org.fpbeditor.layout.graph.ConnectivityGraph;
import org.fpbeditor.layout.graph.Ranking;

/**
 * Picks the side of a state hinted to sit on the boundary from its flow direction.
 */
public class BoundaryHintRule implements ClassificationRule {

  @Override
  public Category classify(State state, ConnectivityGraph graph, Ranking ranking) {
    if (state.getPlacement() != Placement.BOUNDARY)
      return null;

    String stateId = state.getId();
    if (graph.isPureSource(stateId))
      return BoundarySides.inputSide(state, graph.getTargetOperators(stateId), ranking);
    if (graph.isPureSink(stateId))
      return BoundarySides.outputSide(state, graph.getSourceOperators(stateId), ranking);
    return (state.getStateType() == StateType.PRODUCT) ? Category.BOUNDARY_TOP
        : Category.BOUNDARY_LEFT;
  }
}
