package org.fpbeditor.layout.classify;

import org.fpbeditor.common.State;
import org.fpbeditor.layout.graph.ConnectivityGraph;
import org.fpbeditor.layout.graph.Ranking;

/**
 * One step of the state classification chain.
 */
public interface ClassificationRule {

  /**
   * @return the category of the state, or null if this rule does not decide it.
   */
  Category classify(State state, ConnectivityGraph graph, Ranking ranking);
}
