package org.fpbeditor.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * A complete process description: the nodes and edges of all systems, in the order the producer
 * declared them. That order is kept everywhere since the layout uses it to break ties between
 * siblings.
 */
public class ProcessModel {

  public static final String DEFAULT_TITLE = "Untitled Process";

  private static final Logger LOG = Logger.getLogger(ProcessModel.class);

  private final String title;
  private final List<SystemLimit> systemLimits;
  private final List<State> states;
  private final List<ProcessOperator> processOperators;
  private final List<TechnicalResource> technicalResources;
  private final List<Flow> flows;
  private final List<Usage> usages;
  private final List<String> errors;
  private final List<String> warnings;

  public ProcessModel() {
    this(DEFAULT_TITLE);
  }

  public ProcessModel(String title) {
    this.title = title;
    this.systemLimits = new ArrayList<>();
    this.states = new ArrayList<>();
    this.processOperators = new ArrayList<>();
    this.technicalResources = new ArrayList<>();
    this.flows = new ArrayList<>();
    this.usages = new ArrayList<>();
    this.errors = new ArrayList<>();
    this.warnings = new ArrayList<>();
  }

  public ProcessModel(JSONObject jsModel) throws JSONException {
    this(jsModel.optString("title", DEFAULT_TITLE));

    JSONArray jsLimits = JsonFields.optJSONArray(jsModel, "systemLimits", "system_limits");
    for (int i = 0; jsLimits != null && i < jsLimits.length(); i++) {
      systemLimits.add(new SystemLimit(jsLimits.getJSONObject(i)));
    }
    JSONArray jsStates = jsModel.optJSONArray("states");
    for (int i = 0; jsStates != null && i < jsStates.length(); i++) {
      states.add(new State(jsStates.getJSONObject(i)));
    }
    JSONArray jsOperators = JsonFields.optJSONArray(jsModel, "processOperators",
        "process_operators");
    for (int i = 0; jsOperators != null && i < jsOperators.length(); i++) {
      processOperators.add(new ProcessOperator(jsOperators.getJSONObject(i)));
    }
    JSONArray jsResources = JsonFields.optJSONArray(jsModel, "technicalResources",
        "technical_resources");
    for (int i = 0; jsResources != null && i < jsResources.length(); i++) {
      technicalResources.add(new TechnicalResource(jsResources.getJSONObject(i)));
    }
    JSONArray jsFlows = jsModel.optJSONArray("flows");
    for (int i = 0; jsFlows != null && i < jsFlows.length(); i++) {
      flows.add(new Flow(jsFlows.getJSONObject(i)));
    }
    JSONArray jsUsages = jsModel.optJSONArray("usages");
    for (int i = 0; jsUsages != null && i < jsUsages.length(); i++) {
      usages.add(new Usage(jsUsages.getJSONObject(i)));
    }
    JSONArray jsErrors = jsModel.optJSONArray("errors");
    for (int i = 0; jsErrors != null && i < jsErrors.length(); i++) {
      errors.add(jsErrors.getString(i));
    }
    JSONArray jsWarnings = jsModel.optJSONArray("warnings");
    for (int i = 0; jsWarnings != null && i < jsWarnings.length(); i++) {
      warnings.add(jsWarnings.getString(i));
    }
  }

  /**
   * Reads a model from its JSON text.
   * 
   * @throws ModelFormatException
   *           if the text is not a valid model, or uses an unknown state type, placement or flow
   *           type.
   */
  public static ProcessModel parse(String json) throws ModelFormatException {
    try {
      ProcessModel model = new ProcessModel(new JSONObject(json));
      LOG.debug("Model '" + model.title + "' read: " + model.states.size() + " states, "
          + model.processOperators.size() + " operators, " + model.technicalResources.size()
          + " resources, " + model.flows.size() + " flows, " + model.usages.size() + " usages.");
      return model;
    }
    catch (JSONException | IllegalArgumentException ex) {
      throw new ModelFormatException("Invalid process model: " + ex.getMessage(), ex);
    }
  }

  public String getTitle() {
    return title;
  }

  public List<SystemLimit> getSystemLimits() {
    return Collections.unmodifiableList(systemLimits);
  }

  public List<State> getStates() {
    return Collections.unmodifiableList(states);
  }

  public List<ProcessOperator> getProcessOperators() {
    return Collections.unmodifiableList(processOperators);
  }

  public List<TechnicalResource> getTechnicalResources() {
    return Collections.unmodifiableList(technicalResources);
  }

  public List<Flow> getFlows() {
    return Collections.unmodifiableList(flows);
  }

  public List<Usage> getUsages() {
    return Collections.unmodifiableList(usages);
  }

  /**
   * @return the messages of the upstream validator; they never affect the layout.
   */
  public List<String> getErrors() {
    return Collections.unmodifiableList(errors);
  }

  public List<String> getWarnings() {
    return Collections.unmodifiableList(warnings);
  }

  public ProcessModel addSystemLimit(SystemLimit systemLimit) {
    systemLimits.add(systemLimit);
    return this;
  }

  public ProcessModel addState(State state) {
    states.add(state);
    return this;
  }

  public ProcessModel addProcessOperator(ProcessOperator operator) {
    processOperators.add(operator);
    return this;
  }

  public ProcessModel addTechnicalResource(TechnicalResource resource) {
    technicalResources.add(resource);
    return this;
  }

  public ProcessModel addFlow(Flow flow) {
    flows.add(flow);
    return this;
  }

  public ProcessModel addUsage(Usage usage) {
    usages.add(usage);
    return this;
  }

  public ProcessModel addError(String error) {
    errors.add(error);
    return this;
  }

  public ProcessModel addWarning(String warning) {
    warnings.add(warning);
    return this;
  }

  /**
   * @return the number of nodes of all kinds.
   */
  public int getElementCount() {
    return states.size() + processOperators.size() + technicalResources.size();
  }

  public JSONObject toJSON() throws JSONException {
    JSONObject json = new JSONObject();
    json.put("title", title);

    JSONArray jsLimits = new JSONArray();
    for (SystemLimit limit : systemLimits) {
      jsLimits.put(limit.toJSON());
    }
    json.put("systemLimits", jsLimits);

    json.put("states", toJSON(states));
    json.put("processOperators", toJSON(processOperators));
    json.put("technicalResources", toJSON(technicalResources));

    JSONArray jsFlows = new JSONArray();
    for (Flow flow : flows) {
      jsFlows.put(flow.toJSON());
    }
    json.put("flows", jsFlows);

    JSONArray jsUsages = new JSONArray();
    for (Usage usage : usages) {
      jsUsages.put(usage.toJSON());
    }
    json.put("usages", jsUsages);

    json.put("errors", new JSONArray(errors));
    json.put("warnings", new JSONArray(warnings));
    return json;
  }

  private static JSONArray toJSON(List<? extends Element> elements) throws JSONException {
    JSONArray jsElements = new JSONArray();
    for (Element element : elements) {
      jsElements.put(element.toJSON());
    }
    return jsElements;
  }

  @Override
  public String toString() {
    return title;
  }
}
