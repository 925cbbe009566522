package org.fpbeditor.common;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Assert;
import org.junit.Test;

public class ProcessModelTest {

  private static final String MODEL = "{"
      + "\"title\": \"Coffee\","
      + "\"systemLimits\": [{\"id\": \"sys1\", \"label\": \"Kitchen\"}],"
      + "\"states\": ["
      + "  {\"id\": \"beans\", \"label\": \"Beans\", \"stateType\": \"product\", \"systemId\": \"sys1\"},"
      + "  {\"id\": \"power\", \"stateType\": \"energy\", \"placement\": \"boundary-left\"},"
      + "  {\"id\": \"coffee\", \"label\": \"Coffee\", \"stateType\": \"product\"}"
      + "],"
      + "\"processOperators\": [{\"id\": \"brew\", \"label\": \"Brew\", \"systemId\": \"sys1\"}],"
      + "\"technicalResources\": [{\"id\": \"machine\", \"label\": \"Machine\"}],"
      + "\"flows\": ["
      + "  {\"id\": \"f1\", \"sourceId\": \"beans\", \"targetId\": \"brew\", \"flowType\": \"flow\"},"
      + "  {\"id\": \"f2\", \"sourceId\": \"brew\", \"targetId\": \"coffee\", \"flowType\": \"parallelFlow\"},"
      + "  {\"id\": \"f3\", \"sourceId\": \"power\", \"targetId\": \"brew\"}"
      + "],"
      + "\"usages\": [{\"id\": \"u1\", \"processOperatorId\": \"brew\", \"technicalResourceId\": \"machine\"}],"
      + "\"errors\": [],"
      + "\"warnings\": [\"no output energy\"]"
      + "}";

  @Test
  public void testParse() throws ModelFormatException {
    ProcessModel model = ProcessModel.parse(MODEL);

    Assert.assertEquals("Coffee", model.getTitle());
    Assert.assertEquals(1, model.getSystemLimits().size());
    Assert.assertEquals("Kitchen", model.getSystemLimits().get(0).getLabel());
    Assert.assertEquals(5, model.getElementCount());
    Assert.assertEquals(1, model.getWarnings().size());
    Assert.assertTrue(model.getErrors().isEmpty());

    State beans = model.getStates().get(0);
    Assert.assertEquals("beans", beans.getId());
    Assert.assertEquals(StateType.PRODUCT, beans.getStateType());
    Assert.assertNull(beans.getPlacement());
    Assert.assertEquals("sys1", beans.getSystemId());
    Assert.assertEquals(ElementKind.STATE, beans.getKind());

    State power = model.getStates().get(1);
    Assert.assertEquals(Placement.BOUNDARY_LEFT, power.getPlacement());
    Assert.assertEquals("power", power.getLabel());
    Assert.assertNull(power.getSystemId());

    Assert.assertEquals(FlowType.PARALLEL, model.getFlows().get(1).getFlowType());
    Assert.assertEquals(FlowType.FLOW, model.getFlows().get(2).getFlowType());

    Usage usage = model.getUsages().get(0);
    Assert.assertEquals("brew", usage.getProcessOperatorId());
    Assert.assertEquals("machine", usage.getTechnicalResourceId());
  }

  @Test
  public void testProducerOrderKept() throws ModelFormatException {
    ProcessModel model = ProcessModel.parse(MODEL);
    String[] expected = { "beans", "power", "coffee" };
    for (int i = 0; i < expected.length; i++) {
      Assert.assertEquals(expected[i], model.getStates().get(i).getId());
    }
  }

  @Test
  public void testEmptyObject() throws ModelFormatException {
    ProcessModel model = ProcessModel.parse("{}");
    Assert.assertEquals(ProcessModel.DEFAULT_TITLE, model.getTitle());
    Assert.assertEquals(0, model.getElementCount());
    Assert.assertTrue(model.getFlows().isEmpty());
  }

  @Test
  public void testToJSON() throws Exception {
    ProcessModel model = new ProcessModel("Test")
        .addState(new State("s1", "Input", StateType.INFORMATION, Placement.BOUNDARY_TOP, "a"))
        .addProcessOperator(new ProcessOperator("p1", "Work", "a"))
        .addFlow(new Flow("f1", "s1", "p1", FlowType.ALTERNATIVE, "a"))
        .addError("broken");

    JSONObject json = model.toJSON();
    Assert.assertEquals("Test", json.getString("title"));

    JSONObject jsState = json.getJSONArray("states").getJSONObject(0);
    Assert.assertEquals("information", jsState.getString("stateType"));
    Assert.assertEquals("boundary-top", jsState.getString("placement"));
    Assert.assertEquals("a", jsState.getString("systemId"));

    JSONObject jsFlow = json.getJSONArray("flows").getJSONObject(0);
    Assert.assertEquals("alternativeFlow", jsFlow.getString("flowType"));

    JSONArray jsErrors = json.getJSONArray("errors");
    Assert.assertEquals("broken", jsErrors.getString(0));

    ProcessModel copy = ProcessModel.parse(json.toString());
    Assert.assertEquals(Placement.BOUNDARY_TOP, copy.getStates().get(0).getPlacement());
    Assert.assertEquals(FlowType.ALTERNATIVE, copy.getFlows().get(0).getFlowType());
  }

  @Test
  public void testParseSnakeCase() throws ModelFormatException {
    String json = "{"
        + "\"title\": \"Coffee\","
        + "\"system_limits\": [{\"id\": \"sys1\", \"label\": \"Kitchen\","
        + "  \"identification\": {\"unique_ident\": \"sys1\"}, \"line_number\": 1}],"
        + "\"states\": ["
        + "  {\"id\": \"beans\", \"label\": \"Beans\", \"state_type\": \"product\","
        + "   \"placement\": null, \"system_id\": \"sys1\", \"line_number\": 2},"
        + "  {\"id\": \"power\", \"label\": \"Power\", \"state_type\": \"energy\","
        + "   \"placement\": \"boundary-left\", \"system_id\": null}"
        + "],"
        + "\"process_operators\": [{\"id\": \"brew\", \"label\": \"Brew\","
        + "  \"system_id\": \"sys1\"}],"
        + "\"technical_resources\": [{\"id\": \"machine\", \"label\": \"Machine\"}],"
        + "\"flows\": ["
        + "  {\"id\": \"f1\", \"source_ref\": \"beans\", \"target_ref\": \"brew\","
        + "   \"flow_type\": \"alternativeFlow\", \"system_id\": \"sys1\"},"
        + "  {\"id\": \"f2\", \"source_ref\": \"power\", \"target_ref\": \"brew\"}"
        + "],"
        + "\"usages\": [{\"id\": \"u1\", \"process_operator_ref\": \"brew\","
        + "  \"technical_resource_ref\": \"machine\", \"system_id\": null}],"
        + "\"errors\": [], \"warnings\": []"
        + "}";
    ProcessModel model = ProcessModel.parse(json);

    Assert.assertEquals("Kitchen", model.getSystemLimits().get(0).getLabel());
    Assert.assertEquals(1, model.getProcessOperators().size());
    Assert.assertEquals(1, model.getTechnicalResources().size());

    State beans = model.getStates().get(0);
    Assert.assertEquals(StateType.PRODUCT, beans.getStateType());
    Assert.assertNull(beans.getPlacement());
    Assert.assertEquals("sys1", beans.getSystemId());
    State power = model.getStates().get(1);
    Assert.assertEquals(Placement.BOUNDARY_LEFT, power.getPlacement());
    Assert.assertNull(power.getSystemId());

    Flow f1 = model.getFlows().get(0);
    Assert.assertEquals("beans", f1.getSourceId());
    Assert.assertEquals("brew", f1.getTargetId());
    Assert.assertEquals(FlowType.ALTERNATIVE, f1.getFlowType());
    Assert.assertEquals("sys1", f1.getSystemId());
    Assert.assertEquals(FlowType.FLOW, model.getFlows().get(1).getFlowType());

    Usage usage = model.getUsages().get(0);
    Assert.assertEquals("brew", usage.getProcessOperatorId());
    Assert.assertEquals("machine", usage.getTechnicalResourceId());
    Assert.assertNull(usage.getSystemId());
  }

  @Test(expected = ModelFormatException.class)
  public void testFlowWithoutSource() throws ModelFormatException {
    ProcessModel.parse("{\"flows\": [{\"id\": \"f\", \"target_ref\": \"p\"}]}");
  }

  @Test(expected = ModelFormatException.class)
  public void testInvalidJson() throws ModelFormatException {
    ProcessModel.parse("{\"states\": [");
  }

  @Test(expected = ModelFormatException.class)
  public void testUnknownStateType() throws ModelFormatException {
    ProcessModel.parse("{\"states\": [{\"id\": \"s\", \"stateType\": \"liquid\"}]}");
  }

  @Test(expected = ModelFormatException.class)
  public void testMissingStateType() throws ModelFormatException {
    ProcessModel.parse("{\"states\": [{\"id\": \"s\"}]}");
  }

  @Test
  public void testCodes() {
    Assert.assertEquals(Placement.BOUNDARY, Placement.fromCode("boundary"));
    Assert.assertFalse(Placement.BOUNDARY.isDirectional());
    Assert.assertTrue(Placement.INTERNAL.isDirectional());
    Assert.assertEquals(StateType.ENERGY, StateType.fromCode("energy"));
    Assert.assertEquals("technicalResource", ElementKind.TECHNICAL_RESOURCE.getCode());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownPlacement() {
    Placement.fromCode("middle");
  }
}
