package org.fpbeditor.layout.classify;

import org.fpbeditor.common.State;
import org.fpbeditor.layout.graph.ConnectivityGraph;
import org.fpbeditor.layout.graph.Ranking;

/**
 * A state no edge refers to has nothing to be placed next to, whatever its hint says.
 */
public class UnreferencedRule implements ClassificationRule {

  @Override
  public Category classify(State state, ConnectivityGraph graph, Ranking ranking) {
    return graph.isReferenced(state.getId()) ? null : Category.DISCONNECTED;
  }
}
