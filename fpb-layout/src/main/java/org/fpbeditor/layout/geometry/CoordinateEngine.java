package org.fpbeditor.layout.geometry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.apache.log4j.Logger;
import org.fpbeditor.common.ElementKind;
import org.fpbeditor.common.ProcessOperator;
import org.fpbeditor.common.State;
import org.fpbeditor.common.TechnicalResource;
import org.fpbeditor.layout.LayoutConfig;
import org.fpbeditor.layout.PositionedElement;
import org.fpbeditor.layout.SystemBoundary;
import org.fpbeditor.layout.SystemSlice;
import org.fpbeditor.layout.classify.Affinity;
import org.fpbeditor.layout.graph.ConnectivityGraph;
import org.fpbeditor.layout.graph.RankSequencer;
import org.fpbeditor.layout.graph.Ranking;

/**
 * Computes the rectangles of one system.
 * 
 * Operators form a column of rank rows, top to bottom. Operators sharing a rank sit side by side,
 * centered in the column. Forward intermediate states fill the gap beneath their source rank, one
 * sub-row per (source rank, target rank) pair. Feedback states get a lane each, left of the
 * column. Left and right boundary states are stacked beside the row of their rank, top and
 * bottom boundary states are lined up on the boundary edge. Disconnected states and operators
 * form an overflow row below the ranks, inside the boundary, so the row sits above any bottom
 * boundary states on the lower edge. Technical resources line up right of the boundary, level with
 * the operator they are used by.
 */
public class CoordinateEngine {

  public static final double STATE_WIDTH = 55;
  public static final double STATE_HEIGHT = 50;
  public static final double OPERATOR_WIDTH = 150;
  public static final double OPERATOR_HEIGHT = 80;
  public static final double RESOURCE_WIDTH = 150;
  public static final double RESOURCE_HEIGHT = 80;

  /** Vertical gap around each sub-row of forward intermediate states */
  public static final double INTERNAL_GAP = 40;

  /** Extra space between the core and a boundary edge carrying top or bottom states */
  public static final double BOUNDARY_MARGIN = 40;

  private static final Logger LOG = Logger.getLogger(CoordinateEngine.class);

  private final LayoutConfig config;
  private final BoundaryCalculator boundaryCalculator;

  public CoordinateEngine(LayoutConfig config) {
    this.config = config;
    this.boundaryCalculator = new BoundaryCalculator(config);
  }

  /**
   * @param offsetX
   *          the left edge of the area available to the system.
   */
  public SystemPlacement place(SystemSlice slice, ConnectivityGraph graph, Ranking ranking,
      Map<String, Affinity> affinities, double offsetX) {
    return new Pass(slice, graph, ranking, affinities, offsetX).run();
  }

  /**
   * The working state of a single placement run.
   */
  private class Pass {

    private final SystemSlice slice;
    private final ConnectivityGraph graph;
    private final Ranking ranking;
    private final Map<String, Affinity> affinities;
    private final double startX;
    private final double startY;
    private final double gap;

    private final List<State> top = new ArrayList<>();
    private final List<State> bottom = new ArrayList<>();
    private final SortedMap<Integer, List<State>> left = new TreeMap<>();
    private final SortedMap<Integer, List<State>> right = new TreeMap<>();
    private final SortedMap<Integer, SortedMap<Integer, List<State>>> forward = new TreeMap<>();
    private final List<State> feedback = new ArrayList<>();
    private final List<State> disconnectedStates = new ArrayList<>();
    private final List<ProcessOperator> disconnectedOperators = new ArrayList<>();
    private final Map<String, ProcessOperator> operatorsById = new HashMap<>();

    private final List<PositionedElement> elements = new ArrayList<>();
    private final Map<String, PositionedElement> placedOperators = new HashMap<>();
    private final Map<Integer, double[]> forwardRowY = new HashMap<>();
    private final Extent core = new Extent();

    private List<List<String>> layers;
    private double[] operatorY;
    private double coreLeft;
    private double coreWidth;
    private double rowsTop;
    private double rowsBottom;

    Pass(SystemSlice slice, ConnectivityGraph graph, Ranking ranking,
        Map<String, Affinity> affinities, double offsetX) {
      this.slice = slice;
      this.graph = graph;
      this.ranking = ranking;
      this.affinities = affinities;
      this.startX = offsetX + config.getPadding();
      this.startY = config.getPadding();
      this.gap = config.getHorizontalGap();
    }

    SystemPlacement run() {
      sortStates();
      sortOperators();
      measureColumn();
      measureRows();

      placeOperators();
      placeForwardStates();
      placeFeedbackStates();
      placeOverflow();

      SystemBoundary boundary = computeBoundary();
      if (boundary != null)
        placeBoundaryStates(boundary);
      placeResources(boundary);

      if (LOG.isDebugEnabled())
        LOG.debug("System " + slice + ": " + layers.size() + " ranks, " + elements.size()
            + " elements, boundary " + boundary);
      return new SystemPlacement(elements, boundary);
    }

    private void sortStates() {
      for (State state : slice.getStates()) {
        Affinity affinity = affinities.get(state.getId());
        if (affinity == null) {
          disconnectedStates.add(state);
          continue;
        }
        switch (affinity.getCategory()) {
          case BOUNDARY_TOP:
            top.add(state);
            break;
          case BOUNDARY_BOTTOM:
            bottom.add(state);
            break;
          case BOUNDARY_LEFT:
            bucket(left, affinity.getRank()).add(state);
            break;
          case BOUNDARY_RIGHT:
            bucket(right, affinity.getRank()).add(state);
            break;
          case INTERNAL:
            if (affinity.isForward()) {
              SortedMap<Integer, List<State>> slots = forward.get(affinity.getSourceRank());
              if (slots == null) {
                slots = new TreeMap<>();
                forward.put(affinity.getSourceRank(), slots);
              }
              bucket(slots, affinity.getTargetRank()).add(state);
            }
            else {
              feedback.add(state);
            }
            break;
          default:
            disconnectedStates.add(state);
        }
      }
    }

    private void sortOperators() {
      layers = RankSequencer.layers(ranking);
      for (ProcessOperator operator : slice.getProcessOperators()) {
        operatorsById.put(operator.getId(), operator);
        if (!ranking.isRanked(operator.getId()))
          disconnectedOperators.add(operator);
      }
    }

    private void measureColumn() {
      double widest = OPERATOR_WIDTH;
      for (List<String> layer : layers) {
        widest = Math.max(widest, CenteredDistribution.span(layer.size(), OPERATOR_WIDTH, gap));
      }
      for (SortedMap<Integer, List<State>> slots : forward.values()) {
        for (List<State> row : slots.values()) {
          widest = Math.max(widest, CenteredDistribution.span(row.size(), STATE_WIDTH, gap));
        }
      }
      coreWidth = widest;

      double leftSpace = feedback.size() * (STATE_WIDTH + gap);
      if (!left.isEmpty())
        leftSpace += STATE_WIDTH + gap;
      coreLeft = startX + leftSpace;
    }

    private void measureRows() {
      int rowCount = Math.max(ranking.getMaxRank() + 1, 1);
      operatorY = new double[rowCount];
      rowsTop = startY + (top.isEmpty() ? 0 : STATE_HEIGHT + config.getVerticalGap());

      double y = rowsTop;
      for (int rank = 0; rank < rowCount; rank++) {
        int sideCount = Math.max(size(left, rank), size(right, rank));
        double rowHeight = Math.max(OPERATOR_HEIGHT,
            CenteredDistribution.span(sideCount, STATE_HEIGHT, gap));
        operatorY[rank] = y + (rowHeight - OPERATOR_HEIGHT) / 2;
        y += rowHeight;

        SortedMap<Integer, List<State>> slots = forward.get(rank);
        if (slots != null) {
          double[] subRows = new double[slots.size()];
          for (int i = 0; i < subRows.length; i++) {
            y += INTERNAL_GAP;
            subRows[i] = y;
            y += STATE_HEIGHT;
          }
          y += INTERNAL_GAP;
          forwardRowY.put(rank, subRows);
        }
        else if (rank < rowCount - 1) {
          y += config.getVerticalGap();
        }
      }
      rowsBottom = y;
    }

    private double getCoreCenterX() {
      return coreLeft + coreWidth / 2;
    }

    private void placeOperators() {
      for (int rank = 0; rank < layers.size(); rank++) {
        List<String> layer = layers.get(rank);
        double[] xs = CenteredDistribution.distribute(layer.size(), OPERATOR_WIDTH, gap,
            getCoreCenterX());
        for (int i = 0; i < xs.length; i++) {
          PositionedElement element = operatorElement(operatorsById.get(layer.get(i)), xs[i],
              operatorY[rank]);
          placedOperators.put(element.getId(), element);
          addCore(element);
        }
      }
    }

    private void placeForwardStates() {
      for (Map.Entry<Integer, SortedMap<Integer, List<State>>> entry : forward.entrySet()) {
        double[] subRows = forwardRowY.get(entry.getKey());
        int row = 0;
        for (List<State> states : entry.getValue().values()) {
          double[] xs = CenteredDistribution.distribute(states.size(), STATE_WIDTH, gap,
              getCoreCenterX());
          for (int i = 0; i < xs.length; i++) {
            addCore(stateElement(states.get(i), xs[i], subRows[row]));
          }
          row++;
        }
      }
    }

    private void placeFeedbackStates() {
      for (int lane = 0; lane < feedback.size(); lane++) {
        State state = feedback.get(lane);
        Affinity affinity = affinities.get(state.getId());
        int upper = Math.min(affinity.getSourceRank(), affinity.getTargetRank());
        int lower = Math.max(affinity.getSourceRank(), affinity.getTargetRank());
        double y = (operatorY[upper] + OPERATOR_HEIGHT + operatorY[lower]) / 2 - STATE_HEIGHT / 2;
        double x = coreLeft - (lane + 1) * (STATE_WIDTH + gap);
        addCore(stateElement(state, x, y));
      }
    }

    private void placeOverflow() {
      if (disconnectedStates.isEmpty() && disconnectedOperators.isEmpty())
        return;

      boolean hasRows = !core.isEmpty() || !left.isEmpty() || !right.isEmpty();
      double y = hasRows ? rowsBottom + config.getVerticalGap() : rowsTop;
      double x = coreLeft;
      for (State state : disconnectedStates) {
        addCore(stateElement(state, x, y));
        x += STATE_WIDTH + gap;
      }
      for (ProcessOperator operator : disconnectedOperators) {
        addCore(operatorElement(operator, x, y));
        x += OPERATOR_WIDTH + gap;
      }
    }

    private SystemBoundary computeBoundary() {
      if (slice.getStates().isEmpty() && slice.getProcessOperators().isEmpty())
        return null;

      if (core.isEmpty())
        core.include(coreLeft, operatorY[0], coreWidth, OPERATOR_HEIGHT);
      // the side stacks may be taller than their operator row
      includeStacks(left);
      includeStacks(right);

      Extent box = boundaryCalculator.compute(core, !left.isEmpty(), !right.isEmpty(),
          top.size(), bottom.size());
      return new SystemBoundary(slice.getId(), slice.getLabel(), box.getMinX(), box.getMinY(),
          box.getWidth(), box.getHeight());
    }

    private void includeStacks(SortedMap<Integer, List<State>> stacks) {
      for (Map.Entry<Integer, List<State>> entry : stacks.entrySet()) {
        double span = CenteredDistribution.span(entry.getValue().size(), STATE_HEIGHT, gap);
        double center = operatorY[entry.getKey()] + OPERATOR_HEIGHT / 2;
        core.include(getCoreCenterX(), center - span / 2, 0, span);
      }
    }

    private void placeBoundaryStates(SystemBoundary boundary) {
      double[] topXs = CenteredDistribution.distribute(top.size(), STATE_WIDTH, gap,
          boundary.getCenterX());
      for (int i = 0; i < topXs.length; i++) {
        elements.add(stateElement(top.get(i), topXs[i], boundary.getY() - STATE_HEIGHT / 2));
      }

      double[] bottomXs = CenteredDistribution.distribute(bottom.size(), STATE_WIDTH, gap,
          boundary.getCenterX());
      for (int i = 0; i < bottomXs.length; i++) {
        elements.add(stateElement(bottom.get(i), bottomXs[i],
            boundary.getBottom() - STATE_HEIGHT / 2));
      }

      placeStacks(left, boundary.getX() - STATE_WIDTH / 2);
      placeStacks(right, boundary.getRight() - STATE_WIDTH / 2);
    }

    private void placeStacks(SortedMap<Integer, List<State>> stacks, double x) {
      for (Map.Entry<Integer, List<State>> entry : stacks.entrySet()) {
        List<State> states = entry.getValue();
        double center = operatorY[entry.getKey()] + OPERATOR_HEIGHT / 2;
        double[] ys = CenteredDistribution.distribute(states.size(), STATE_HEIGHT, gap, center);
        for (int i = 0; i < ys.length; i++) {
          elements.add(stateElement(states.get(i), x, ys[i]));
        }
      }
    }

    private void placeResources(SystemBoundary boundary) {
      List<TechnicalResource> resources = slice.getTechnicalResources();
      if (resources.isEmpty())
        return;

      double columnX = startX;
      double unboundTop = startY;
      if (boundary != null) {
        columnX = boundary.getRight() + config.getResourceOffset();
        if (!right.isEmpty())
          columnX = Math.max(columnX, boundary.getRight() + STATE_WIDTH / 2 + gap);
        unboundTop = operatorY[0];
      }

      // resources used by operators of the same rank sit side by side
      Map<Integer, Integer> perRank = new HashMap<>();
      int widest = 0;
      for (TechnicalResource resource : resources) {
        PositionedElement operator = placedOperators.get(graph.getBoundOperator(resource.getId()));
        if (operator != null)
          widest = Math.max(widest, increment(perRank, ranking.getRank(operator.getId())));
      }

      perRank.clear();
      double unboundX = columnX + widest * (RESOURCE_WIDTH + gap);
      int unbound = 0;
      for (TechnicalResource resource : resources) {
        PositionedElement operator = placedOperators.get(graph.getBoundOperator(resource.getId()));
        if (operator != null) {
          int index = increment(perRank, ranking.getRank(operator.getId())) - 1;
          double y = operator.getY() + (OPERATOR_HEIGHT - RESOURCE_HEIGHT) / 2;
          elements.add(resourceElement(resource, columnX + index * (RESOURCE_WIDTH + gap), y));
        }
        else {
          double y = unboundTop + unbound * (RESOURCE_HEIGHT + gap);
          elements.add(resourceElement(resource, unboundX, y));
          unbound++;
        }
      }
    }

    private void addCore(PositionedElement element) {
      elements.add(element);
      core.include(element);
    }
  }

  private static <T> List<T> bucket(SortedMap<Integer, List<T>> map, int key) {
    List<T> list = map.get(key);
    if (list == null) {
      list = new ArrayList<>();
      map.put(key, list);
    }
    return list;
  }

  private static int size(SortedMap<Integer, ? extends List<?>> map, int key) {
    List<?> list = map.get(key);
    return (list == null) ? 0 : list.size();
  }

  private static int increment(Map<Integer, Integer> counts, int key) {
    Integer count = counts.get(key);
    int next = (count == null) ? 1 : count + 1;
    counts.put(key, next);
    return next;
  }

  private static PositionedElement stateElement(State state, double x, double y) {
    return new PositionedElement(state.getId(), ElementKind.STATE, state.getLabel(), x, y,
        STATE_WIDTH, STATE_HEIGHT, state.getStateType());
  }

  private static PositionedElement operatorElement(ProcessOperator operator, double x, double y) {
    return new PositionedElement(operator.getId(), ElementKind.PROCESS_OPERATOR,
        operator.getLabel(), x, y, OPERATOR_WIDTH, OPERATOR_HEIGHT, null);
  }

  private static PositionedElement resourceElement(TechnicalResource resource, double x, double y) {
    return new PositionedElement(resource.getId(), ElementKind.TECHNICAL_RESOURCE,
        resource.getLabel(), x, y, RESOURCE_WIDTH, RESOURCE_HEIGHT, null);
  }
}
