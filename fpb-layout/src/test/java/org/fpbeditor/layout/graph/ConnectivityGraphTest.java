package org.fpbeditor.layout.graph;

import java.util.Arrays;
import java.util.Collections;

import org.fpbeditor.common.ProcessModel;
import org.fpbeditor.common.TechnicalResource;
import org.fpbeditor.common.Usage;
import org.fpbeditor.layout.Models;
import org.fpbeditor.layout.SystemSlice;
import org.junit.Assert;
import org.junit.Test;

public class ConnectivityGraphTest {

  private static ConnectivityGraph build(ProcessModel model) {
    return ConnectivityGraph.build(SystemSlice.of(model, null, "System"));
  }

  @Test
  public void testAdjacency() {
    ConnectivityGraph graph = build(Models.chain());

    Assert.assertEquals(Arrays.asList("p1"), graph.getTargetOperators("in"));
    Assert.assertTrue(graph.getSourceOperators("in").isEmpty());
    Assert.assertEquals(Arrays.asList("p1"), graph.getSourceOperators("m"));
    Assert.assertEquals(Arrays.asList("p2"), graph.getTargetOperators("m"));
    Assert.assertEquals(Arrays.asList("in"), graph.getInputStates("p1"));
    Assert.assertEquals(Arrays.asList("m"), graph.getOutputStates("p1"));
    Assert.assertEquals(Arrays.asList("out"), graph.getOutputStates("p2"));
  }

  @Test
  public void testStateRoles() {
    ConnectivityGraph graph = build(Models.chain());

    Assert.assertTrue(graph.isPureSource("in"));
    Assert.assertFalse(graph.isPureSink("in"));
    Assert.assertTrue(graph.isIntermediate("m"));
    Assert.assertTrue(graph.isPureSink("out"));
    Assert.assertFalse(graph.isIntermediate("out"));
  }

  @Test
  public void testReferenced() {
    ProcessModel model = Models.singleOperator().addState(Models.product("alone"))
        .addProcessOperator(Models.operator("idle"))
        .addTechnicalResource(new TechnicalResource("tool", "Tool"))
        .addUsage(new Usage("u", "idle", "tool"));
    ConnectivityGraph graph = build(model);

    Assert.assertTrue(graph.isReferenced("s1"));
    Assert.assertTrue(graph.isReferenced("p1"));
    Assert.assertTrue(graph.isReferenced("idle"));
    Assert.assertTrue(graph.isReferenced("tool"));
    Assert.assertFalse(graph.isReferenced("alone"));
    Assert.assertEquals("idle", graph.getBoundOperator("tool"));
  }

  @Test
  public void testLastUsageBinds() {
    ProcessModel model = Models.chain().addTechnicalResource(new TechnicalResource("tool", "Tool"))
        .addUsage(new Usage("u1", "p1", "tool")).addUsage(new Usage("u2", "p2", "tool"));
    Assert.assertEquals("p2", build(model).getBoundOperator("tool"));
  }

  @Test
  public void testDanglingReferences() {
    ProcessModel model = Models.singleOperator().addFlow(Models.flow("ghost", "p1"))
        .addFlow(Models.flow("s1", "nowhere"));
    ConnectivityGraph graph = build(model);

    Assert.assertEquals(Arrays.asList("s1"), graph.getInputStates("p1"));
    Assert.assertEquals(Arrays.asList("p1"), graph.getTargetOperators("s1"));
    Assert.assertTrue(graph.isReferenced("ghost"));
    Assert.assertEquals(Collections.emptyList(), graph.getTargetOperators("ghost"));
    Assert.assertNull(graph.getBoundOperator("ghost"));
  }
}
