package org.fpbeditor.layout;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;
import org.fpbeditor.common.Element;
import org.fpbeditor.common.ProcessModel;
import org.fpbeditor.common.SystemLimit;
import org.fpbeditor.layout.classify.Affinity;
import org.fpbeditor.layout.classify.AffinityAssigner;
import org.fpbeditor.layout.graph.ConnectivityGraph;
import org.fpbeditor.layout.graph.RankSequencer;
import org.fpbeditor.layout.graph.Ranking;
import org.fpbeditor.layout.geometry.CoordinateEngine;
import org.fpbeditor.layout.geometry.Extent;
import org.fpbeditor.layout.geometry.SystemPlacement;

/**
 * Lays out every system of a model top to bottom and places the systems side by side.
 * 
 * Systems are processed in this order: the declared system limits, then system ids that are only
 * used by elements (in order of first use), then the untagged elements. Each system starts right
 * of the previous one, separated by the system gap.
 * 
 * The layout only reads the model and holds nothing but its configuration, so one instance can
 * serve any number of threads.
 */
public class VerticalFlowLayout implements DiagramLayout {

  public static final String DEFAULT_SYSTEM_LABEL = "System";

  private static final Logger LOG = Logger.getLogger(VerticalFlowLayout.class);

  private final LayoutConfig config;
  private final RankSequencer rankSequencer;
  private final AffinityAssigner affinityAssigner;
  private final CoordinateEngine coordinateEngine;
  private final ConnectionRouter connectionRouter;

  public VerticalFlowLayout() {
    this(LayoutConfig.defaults());
  }

  public VerticalFlowLayout(LayoutConfig config) {
    this.config = config;
    this.rankSequencer = new RankSequencer();
    this.affinityAssigner = new AffinityAssigner();
    this.coordinateEngine = new CoordinateEngine(config);
    this.connectionRouter = new ConnectionRouter();
  }

  @Override
  public LayoutConfig getConfig() {
    return config;
  }

  @Override
  public Diagram process(ProcessModel model) {
    List<PositionedElement> elements = new ArrayList<>();
    List<Connection> connections = new ArrayList<>();
    List<SystemBoundary> boundaries = new ArrayList<>();

    double offsetX = 0;
    for (SystemSlice slice : slice(model)) {
      if (slice.isEmpty())
        continue;

      ConnectivityGraph graph = ConnectivityGraph.build(slice);
      Ranking ranking = rankSequencer.rank(slice.getProcessOperators(), slice.getStates(), graph);
      Map<String, Affinity> affinities = affinityAssigner.assign(slice.getStates(), graph, ranking);
      SystemPlacement placement = coordinateEngine.place(slice, graph, ranking, affinities, offsetX);

      // wide top or bottom rows may reach left of the offset
      Extent extent = placement.getExtent();
      if (extent.getMinX() < offsetX) {
        placement = placement.translate(offsetX - extent.getMinX(), 0);
        extent = placement.getExtent();
      }

      elements.addAll(placement.getElements());
      connections.addAll(connectionRouter.route(slice, affinities));
      if (placement.getBoundary() != null)
        boundaries.add(placement.getBoundary());
      offsetX = extent.getMaxX() + config.getSystemGap();
    }

    LOG.debug("Layout of '" + model.getTitle() + "' done: " + elements.size() + " elements, "
        + connections.size() + " connections, " + boundaries.size() + " systems.");
    return new Diagram(elements, connections, boundaries);
  }

  /**
   * Splits the model into its systems, in layout order.
   */
  public static List<SystemSlice> slice(ProcessModel model) {
    Map<String, String> labels = new LinkedHashMap<>();
    for (SystemLimit limit : model.getSystemLimits()) {
      if (!labels.containsKey(limit.getId()))
        labels.put(limit.getId(), limit.getLabel());
    }

    boolean hasUntagged = false;
    List<Element> all = new ArrayList<>();
    all.addAll(model.getStates());
    all.addAll(model.getProcessOperators());
    all.addAll(model.getTechnicalResources());
    for (Element element : all) {
      String systemId = element.getSystemId();
      if (systemId == null)
        hasUntagged = true;
      else if (!labels.containsKey(systemId))
        labels.put(systemId, systemId);
    }

    List<SystemSlice> slices = new ArrayList<>();
    for (Map.Entry<String, String> entry : labels.entrySet()) {
      slices.add(SystemSlice.of(model, entry.getKey(), entry.getValue()));
    }
    if (hasUntagged)
      slices.add(SystemSlice.of(model, null, DEFAULT_SYSTEM_LABEL));
    return slices;
  }
}
