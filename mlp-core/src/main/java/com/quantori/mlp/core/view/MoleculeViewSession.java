package com.quantori.mlp.core.view;

import com.quantori.mlp.api.model.MoleculeGraph;
import com.quantori.mlp.api.render.PerspectiveProjector;
import com.quantori.mlp.api.render.RenderFrame;
import com.quantori.mlp.api.render.RenderPort;
import com.quantori.mlp.api.render.ViewRotation;
import com.quantori.mlp.core.configuration.MoleculeLayoutConfiguration;
import com.quantori.mlp.core.layout.LayoutSnapshot;
import lombok.extern.slf4j.Slf4j;

/**
 * State of one interactive viewer: the normalized graph on display and the current rotation.
 *
 * <p>Rotating only re-projects the cached graph. Coordinates are computed once per structure, by
 * whoever produced the snapshot.
 */
@Slf4j
public class MoleculeViewSession {

  private final PerspectiveProjector projector;
  private final double autoRotateDegrees;
  private MoleculeGraph graph = MoleculeGraph.empty();
  private LayoutSnapshot snapshot;
  private ViewRotation rotation = ViewRotation.NONE;
  private boolean autoRotate = true;

  public MoleculeViewSession(MoleculeLayoutConfiguration configuration) {
    this(new PerspectiveProjector(configuration.getView()), configuration.getAutoRotateDegrees());
  }

  public MoleculeViewSession(PerspectiveProjector projector, double autoRotateDegrees) {
    this.projector = projector;
    this.autoRotateDegrees = autoRotateDegrees;
  }

  public void show(LayoutSnapshot layout) {
    this.snapshot = layout;
    this.graph = layout.graph();
  }

  /**
   * Displays an already normalized graph.
   *
   * @param normalized graph to display, null clears the view
   */
  public void show(MoleculeGraph normalized) {
    this.snapshot = null;
    this.graph = normalized == null ? MoleculeGraph.empty() : normalized;
  }

  public MoleculeGraph getGraph() {
    return graph;
  }

  public LayoutSnapshot getSnapshot() {
    return snapshot;
  }

  public ViewRotation getRotation() {
    return rotation;
  }

  /**
   * Replaces the rotation. Non-finite angles are ignored.
   *
   * @param newRotation rotation to use
   * @return true if the rotation was applied
   */
  public boolean setRotation(ViewRotation newRotation) {
    if (newRotation == null || !newRotation.isFinite()) {
      log.warn("Ignoring invalid rotation {}", newRotation);
      return false;
    }
    rotation = newRotation;
    return true;
  }

  public boolean drag(double deltaX, double deltaY) {
    if (!Double.isFinite(deltaX) || !Double.isFinite(deltaY)) {
      log.warn("Ignoring invalid drag ({}, {})", deltaX, deltaY);
      return false;
    }
    return setRotation(rotation.dragBy(deltaX, deltaY));
  }

  /**
   * Advances the automatic spin by one tick. Nothing turns while auto rotation is off or the view
   * is empty.
   */
  public void autoRotateTick() {
    if (autoRotate && !graph.isEmpty()) {
      setRotation(rotation.turnYaw(autoRotateDegrees));
    }
  }

  public boolean isAutoRotate() {
    return autoRotate;
  }

  public void setAutoRotate(boolean autoRotate) {
    this.autoRotate = autoRotate;
  }

  public void reset() {
    rotation = ViewRotation.NONE;
  }

  public RenderFrame frame() {
    return projector.project(graph, rotation);
  }

  public RenderFrame render(RenderPort port) {
    RenderFrame frame = frame();
    frame.renderTo(port);
    return frame;
  }
}
