package org.fpbeditor.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.fpbeditor.common.Element;
import org.fpbeditor.common.Flow;
import org.fpbeditor.common.ProcessModel;
import org.fpbeditor.common.ProcessOperator;
import org.fpbeditor.common.State;
import org.fpbeditor.common.TechnicalResource;
import org.fpbeditor.common.Usage;

/**
 * The part of a process model that belongs to one system, laid out independently of the other
 * systems. A null id stands for the implicit group of untagged elements.
 */
public class SystemSlice {

  private final String id;
  private final String label;
  private final List<State> states;
  private final List<ProcessOperator> processOperators;
  private final List<TechnicalResource> technicalResources;
  private final List<Flow> flows;
  private final List<Usage> usages;

  public SystemSlice(String id, String label, List<State> states,
      List<ProcessOperator> processOperators, List<TechnicalResource> technicalResources,
      List<Flow> flows, List<Usage> usages) {
    this.id = id;
    this.label = label;
    this.states = Collections.unmodifiableList(new ArrayList<>(states));
    this.processOperators = Collections.unmodifiableList(new ArrayList<>(processOperators));
    this.technicalResources = Collections.unmodifiableList(new ArrayList<>(technicalResources));
    this.flows = Collections.unmodifiableList(new ArrayList<>(flows));
    this.usages = Collections.unmodifiableList(new ArrayList<>(usages));
  }

  /**
   * Cuts the elements of the given system out of the model, keeping their declaration order.
   */
  public static SystemSlice of(ProcessModel model, String systemId, String label) {
    List<Flow> flows = new ArrayList<>();
    for (Flow flow : model.getFlows()) {
      if (Objects.equals(flow.getSystemId(), systemId))
        flows.add(flow);
    }
    List<Usage> usages = new ArrayList<>();
    for (Usage usage : model.getUsages()) {
      if (Objects.equals(usage.getSystemId(), systemId))
        usages.add(usage);
    }
    return new SystemSlice(systemId, label, select(model.getStates(), systemId),
        select(model.getProcessOperators(), systemId),
        select(model.getTechnicalResources(), systemId), flows, usages);
  }

  private static <T extends Element> List<T> select(List<T> elements, String systemId) {
    List<T> selected = new ArrayList<>();
    for (T element : elements) {
      if (Objects.equals(element.getSystemId(), systemId))
        selected.add(element);
    }
    return selected;
  }

  public String getId() {
    return id;
  }

  public String getLabel() {
    return label;
  }

  public List<State> getStates() {
    return states;
  }

  public List<ProcessOperator> getProcessOperators() {
    return processOperators;
  }

  public List<TechnicalResource> getTechnicalResources() {
    return technicalResources;
  }

  public List<Flow> getFlows() {
    return flows;
  }

  public List<Usage> getUsages() {
    return usages;
  }

  public boolean isEmpty() {
    return states.isEmpty() && processOperators.isEmpty() && technicalResources.isEmpty();
  }

  @Override
  public String toString() {
    return (id == null) ? label : id;
  }
}
