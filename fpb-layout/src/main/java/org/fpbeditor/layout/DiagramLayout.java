package org.fpbeditor.layout;

import org.fpbeditor.common.ProcessModel;

/**
 * Turns a process model into a positioned diagram. Implementations keep no state between calls.
 */
public interface DiagramLayout {

  LayoutConfig getConfig();

  Diagram process(ProcessModel model);
}
