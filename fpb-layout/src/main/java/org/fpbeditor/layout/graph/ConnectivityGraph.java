package org.fpbeditor.layout.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.fpbeditor.common.Flow;
import org.fpbeditor.common.ProcessOperator;
import org.fpbeditor.common.State;
import org.fpbeditor.common.Usage;
import org.fpbeditor.layout.SystemSlice;

/**
 * Adjacency of the states and process operators of one system, derived from its flows and
 * usages. Edges whose endpoints are not a state and an operator of the system are only recorded
 * in the referenced set.
 */
public class ConnectivityGraph {

  private final Map<String, List<String>> stateTargets;
  private final Map<String, List<String>> stateSources;
  private final Map<String, List<String>> operatorInputs;
  private final Map<String, List<String>> operatorOutputs;
  private final Map<String, String> resourceOperators;
  private final Set<String> referenced;

  private ConnectivityGraph() {
    this.stateTargets = new LinkedHashMap<>();
    this.stateSources = new LinkedHashMap<>();
    this.operatorInputs = new LinkedHashMap<>();
    this.operatorOutputs = new LinkedHashMap<>();
    this.resourceOperators = new LinkedHashMap<>();
    this.referenced = new HashSet<>();
  }

  public static ConnectivityGraph build(SystemSlice slice) {
    return build(slice.getStates(), slice.getProcessOperators(), slice.getFlows(),
        slice.getUsages());
  }

  public static ConnectivityGraph build(List<State> states, List<ProcessOperator> operators,
      List<Flow> flows, List<Usage> usages) {
    ConnectivityGraph graph = new ConnectivityGraph();
    for (State state : states) {
      graph.stateTargets.put(state.getId(), new ArrayList<String>());
      graph.stateSources.put(state.getId(), new ArrayList<String>());
    }
    for (ProcessOperator operator : operators) {
      graph.operatorInputs.put(operator.getId(), new ArrayList<String>());
      graph.operatorOutputs.put(operator.getId(), new ArrayList<String>());
    }

    for (Flow flow : flows) {
      String source = flow.getSourceId();
      String target = flow.getTargetId();
      graph.referenced.add(source);
      graph.referenced.add(target);

      if (graph.stateTargets.containsKey(source) && graph.operatorInputs.containsKey(target)) {
        graph.stateTargets.get(source).add(target);
        graph.operatorInputs.get(target).add(source);
      }
      else if (graph.operatorOutputs.containsKey(source) && graph.stateSources.containsKey(target)) {
        graph.stateSources.get(target).add(source);
        graph.operatorOutputs.get(source).add(target);
      }
    }

    for (Usage usage : usages) {
      graph.referenced.add(usage.getProcessOperatorId());
      graph.referenced.add(usage.getTechnicalResourceId());
      graph.resourceOperators.put(usage.getTechnicalResourceId(), usage.getProcessOperatorId());
    }
    return graph;
  }

  /**
   * @return the operators the state flows into, in flow order.
   */
  public List<String> getTargetOperators(String stateId) {
    return lookup(stateTargets, stateId);
  }

  /**
   * @return the operators the state receives flows from, in flow order.
   */
  public List<String> getSourceOperators(String stateId) {
    return lookup(stateSources, stateId);
  }

  public List<String> getInputStates(String operatorId) {
    return lookup(operatorInputs, operatorId);
  }

  public List<String> getOutputStates(String operatorId) {
    return lookup(operatorOutputs, operatorId);
  }

  /**
   * @return the operator the resource is bound to, or null if no usage names the resource.
   */
  public String getBoundOperator(String resourceId) {
    return resourceOperators.get(resourceId);
  }

  /**
   * @return true if the id appears as an endpoint of any flow or usage.
   */
  public boolean isReferenced(String id) {
    return referenced.contains(id);
  }

  public boolean isPureSource(String stateId) {
    return !getTargetOperators(stateId).isEmpty() && getSourceOperators(stateId).isEmpty();
  }

  public boolean isPureSink(String stateId) {
    return !getSourceOperators(stateId).isEmpty() && getTargetOperators(stateId).isEmpty();
  }

  public boolean isIntermediate(String stateId) {
    return !getSourceOperators(stateId).isEmpty() && !getTargetOperators(stateId).isEmpty();
  }

  private static List<String> lookup(Map<String, List<String>> map, String id) {
    List<String> ids = map.get(id);
    return (ids == null) ? Collections.<String> emptyList() : Collections.unmodifiableList(ids);
  }
}
