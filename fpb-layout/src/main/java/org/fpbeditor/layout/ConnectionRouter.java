package org.fpbeditor.layout;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.fpbeditor.common.Flow;
import org.fpbeditor.common.Usage;
import org.fpbeditor.layout.classify.Affinity;
import org.fpbeditor.layout.classify.Category;

/**
 * Emits one connection per flow and usage of a system, with attachment hints derived from the
 * categories of the states involved.
 */
public class ConnectionRouter {

  public List<Connection> route(SystemSlice slice, Map<String, Affinity> affinities) {
    List<Connection> connections = new ArrayList<>();
    for (Flow flow : slice.getFlows()) {
      connections.add(route(flow, affinities));
    }
    for (Usage usage : slice.getUsages()) {
      connections.add(new Connection(usage.getId(), usage.getProcessOperatorId(),
          usage.getTechnicalResourceId(), null, true, null, null));
    }
    return connections;
  }

  Connection route(Flow flow, Map<String, Affinity> affinities) {
    Affinity source = affinities.get(flow.getSourceId());
    Affinity target = affinities.get(flow.getTargetId());
    Side sourceSide = null;
    Side targetSide = null;

    if (source != null && source.getCategory() == Category.BOUNDARY_TOP)
      sourceSide = Side.BOTTOM;
    if (target != null && target.getCategory() == Category.BOUNDARY_BOTTOM)
      targetSide = Side.TOP;

    // feedback lanes lie left of the operator column
    if (target != null && target.isFeedback()) {
      sourceSide = Side.LEFT;
      targetSide = Side.BOTTOM;
    }
    else if (source != null && source.isFeedback()) {
      sourceSide = Side.TOP;
      targetSide = Side.LEFT;
    }

    return new Connection(flow.getId(), flow.getSourceId(), flow.getTargetId(),
        flow.getFlowType(), false, sourceSide, targetSide);
  }
}
