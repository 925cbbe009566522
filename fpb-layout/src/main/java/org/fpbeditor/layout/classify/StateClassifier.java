package org.fpbeditor.layout.classify;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.fpbeditor.common.State;
import org.fpbeditor.layout.graph.ConnectivityGraph;
import org.fpbeditor.layout.graph.Ranking;

/**
 * Assigns each state one of the six placement categories by running an ordered rule chain; the
 * first rule returning a category wins.
 */
public class StateClassifier {

  private final List<ClassificationRule> rules;

  public StateClassifier() {
    this(Arrays.<ClassificationRule> asList(new UnreferencedRule(), new DirectionalHintRule(),
        new BoundaryHintRule(), new ConnectivityRule()));
  }

  public StateClassifier(List<ClassificationRule> rules) {
    this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
  }

  public List<ClassificationRule> getRules() {
    return rules;
  }

  public Category classify(State state, ConnectivityGraph graph, Ranking ranking) {
    for (ClassificationRule rule : rules) {
      Category category = rule.classify(state, graph, ranking);
      if (category != null)
        return category;
    }
    return Category.DISCONNECTED;
  }
}
