package org.fpbeditor.layout.classify;

import org.fpbeditor.common.State;
import org.fpbeditor.layout.graph.ConnectivityGraph;
import org.fpbeditor.layout.graph.Ranking;

/**
 * Takes an explicit side or internal hint verbatim.
 */
public class DirectionalHintRule implements ClassificationRule {

  @Override
  public Category classify(State state, ConnectivityGraph graph, Ranking ranking) {
    if (state.getPlacement() == null)
      return null;
    return Category.fromPlacement(state.getPlacement());
  }
}
