package org.fpbeditor.layout;

import org.fpbeditor.common.Flow;
import org.fpbeditor.common.Placement;
import org.fpbeditor.common.ProcessModel;
import org.fpbeditor.common.ProcessOperator;
import org.fpbeditor.common.State;
import org.fpbeditor.common.StateType;
import org.fpbeditor.common.SystemLimit;
import org.fpbeditor.common.TechnicalResource;
import org.fpbeditor.common.Usage;

/**
 * Small process models shared by the layout tests.
 */
public final class Models {

  private Models() {}

  public static State product(String id) {
    return new State(id, id, StateType.PRODUCT);
  }

  public static State energy(String id) {
    return new State(id, id, StateType.ENERGY);
  }

  public static State state(String id, StateType type, Placement placement) {
    return new State(id, id, type, placement, null);
  }

  public static ProcessOperator operator(String id) {
    return new ProcessOperator(id, id);
  }

  public static Flow flow(String sourceId, String targetId) {
    return new Flow(sourceId + "->" + targetId, sourceId, targetId);
  }

  /**
   * s1 -> p1 -> s2
   */
  public static ProcessModel singleOperator() {
    return new ProcessModel("single").addState(product("s1")).addState(product("s2"))
        .addProcessOperator(operator("p1")).addFlow(flow("s1", "p1")).addFlow(flow("p1", "s2"));
  }

  /**
   * in -> p1 -> m -> p2 -> out
   */
  public static ProcessModel chain() {
    return new ProcessModel("chain").addState(product("in")).addState(product("m"))
        .addState(product("out")).addProcessOperator(operator("p1"))
        .addProcessOperator(operator("p2")).addFlow(flow("in", "p1")).addFlow(flow("p1", "m"))
        .addFlow(flow("m", "p2")).addFlow(flow("p2", "out"));
  }

  /**
   * p1 -> m -> p2 -> f -> p1, with f flowing back to the first rank.
   */
  public static ProcessModel feedbackLoop() {
    return new ProcessModel("loop").addState(product("in")).addState(product("m"))
        .addState(product("f")).addState(product("out")).addProcessOperator(operator("p1"))
        .addProcessOperator(operator("p2")).addFlow(flow("in", "p1")).addFlow(flow("p1", "m"))
        .addFlow(flow("m", "p2")).addFlow(flow("p2", "f")).addFlow(flow("f", "p1"))
        .addFlow(flow("p2", "out"));
  }

  /**
   * Two tagged systems without shared nodes.
   */
  public static ProcessModel twoSystems() {
    ProcessModel model = new ProcessModel("two systems");
    model.addSystemLimit(new SystemLimit("sys1", "First"));
    model.addSystemLimit(new SystemLimit("sys2", "Second"));
    for (String system : new String[] { "sys1", "sys2" }) {
      String in = system + ".in";
      String op = system + ".p";
      String out = system + ".out";
      model.addState(new State(in, in, StateType.PRODUCT, null, system));
      model.addState(new State(out, out, StateType.PRODUCT, null, system));
      model.addProcessOperator(new ProcessOperator(op, op, system));
      model.addFlow(new Flow(in + "-f", in, op, null, system));
      model.addFlow(new Flow(out + "-f", op, out, null, system));
    }
    return model;
  }

  /**
   * A model touching every placement rule. Ranks: mix and sort 0, cool 1, heat-up 2, pack 3;
   * back1 and back2 flow back up. It covers boundary hints on all sides, forward and feedback
   * intermediates, parallel operators, bound and unbound resources, disconnected nodes.
   */
  public static ProcessModel everything() {
    ProcessModel model = new ProcessModel("everything");
    model.addState(product("raw")).addState(product("extra")).addState(energy("power"))
        .addState(state("info", StateType.INFORMATION, Placement.BOUNDARY))
        .addState(state("hint-top", StateType.ENERGY, Placement.BOUNDARY_TOP))
        .addState(state("hint-bottom", StateType.PRODUCT, Placement.BOUNDARY_BOTTOM))
        .addState(state("hint-right", StateType.ENERGY, Placement.BOUNDARY_RIGHT))
        .addState(product("m1")).addState(product("m2")).addState(product("m3"))
        .addState(product("m4"))
        .addState(product("back1")).addState(product("back2")).addState(energy("heat"))
        .addState(product("result")).addState(product("lonely"));
    model.addProcessOperator(operator("mix")).addProcessOperator(operator("sort"))
        .addProcessOperator(operator("heat-up"))
        .addProcessOperator(operator("cool")).addProcessOperator(operator("pack"))
        .addProcessOperator(operator("idle"));
    model.addTechnicalResource(new TechnicalResource("mixer", "Mixer"))
        .addTechnicalResource(new TechnicalResource("oven", "Oven"))
        .addTechnicalResource(new TechnicalResource("fridge", "Fridge"))
        .addTechnicalResource(new TechnicalResource("spare", "Spare"));

    model.addFlow(flow("raw", "mix")).addFlow(flow("extra", "mix"))
        .addFlow(flow("power", "heat-up")).addFlow(flow("info", "mix"))
        .addFlow(flow("hint-top", "mix")).addFlow(flow("pack", "hint-bottom"))
        .addFlow(flow("hint-right", "cool"))
        .addFlow(flow("mix", "m1")).addFlow(flow("m1", "heat-up"))
        .addFlow(flow("mix", "m2")).addFlow(flow("m2", "cool"))
        .addFlow(flow("raw", "sort")).addFlow(flow("sort", "m4")).addFlow(flow("m4", "pack"))
        .addFlow(flow("heat-up", "m3")).addFlow(flow("cool", "m3")).addFlow(flow("m3", "pack"))
        .addFlow(flow("pack", "back1")).addFlow(flow("back1", "heat-up"))
        .addFlow(flow("heat-up", "back2")).addFlow(flow("back2", "cool"))
        .addFlow(flow("heat-up", "heat")).addFlow(flow("pack", "result"));
    model.addUsage(new Usage("u1", "mix", "mixer")).addUsage(new Usage("u2", "heat-up", "oven"))
        .addUsage(new Usage("u3", "cool", "fridge"));
    return model;
  }
}
