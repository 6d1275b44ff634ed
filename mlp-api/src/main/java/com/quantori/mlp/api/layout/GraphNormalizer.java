package com.quantori.mlp.api.layout;

import com.quantori.mlp.api.model.Atom;
import com.quantori.mlp.api.model.MoleculeGraph;

/**
 * Centres a graph on the origin and scales it so that the longest side of its axis-aligned
 * bounding box equals {@link LayoutSettings#getTargetSize()}.
 */
public class GraphNormalizer {

  private final double targetSize;

  public GraphNormalizer() {
    this(LayoutSettings.DEFAULT);
  }

  public GraphNormalizer(LayoutSettings settings) {
    this.targetSize = settings.getTargetSize();
  }

  /**
   * Normalizes coordinates in place. A graph whose atoms all share one position is only moved to
   * the origin.
   *
   * @param graph graph to normalize
   * @return the same graph instance
   */
  public MoleculeGraph normalize(MoleculeGraph graph) {
    if (graph.isEmpty()) {
      return graph;
    }
    BoundingBox box = BoundingBox.of(graph);
    double maxExtent = box.maxExtent();
    double scale = maxExtent > 0 ? targetSize / maxExtent : 1.0;
    double cx = box.centerX();
    double cy = box.centerY();
    double cz = box.centerZ();
    for (Atom atom : graph.getAtoms()) {
      atom.setX((atom.getX() - cx) * scale);
      atom.setY((atom.getY() - cy) * scale);
      atom.setZ((atom.getZ() - cz) * scale);
    }
    return graph;
  }
}
