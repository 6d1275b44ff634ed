package com.quantori.mlp.api.render;

import java.util.ArrayList;
import java.util.List;

/**
 * Primitives of one projected view in painter's order: every bond segment sorted by depth, then
 * every atom marker sorted by depth.
 *
 * @param rotation  rotation the frame was projected with
 * @param viewScale view units per layout unit
 * @param bonds     bond segments in ascending depth
 * @param atoms     atom markers in ascending depth
 */
public record RenderFrame(
    ViewRotation rotation, double viewScale, List<BondSegment> bonds, List<AtomMarker> atoms) {

  public RenderFrame {
    bonds = List.copyOf(bonds);
    atoms = List.copyOf(atoms);
  }

  public boolean isEmpty() {
    return atoms.isEmpty();
  }

  /**
   * All primitives in drawing order.
   *
   * @return bond segments followed by atom markers
   */
  public List<RenderPrimitive> primitives() {
    List<RenderPrimitive> primitives = new ArrayList<>(bonds.size() + atoms.size());
    primitives.addAll(bonds);
    primitives.addAll(atoms);
    return primitives;
  }

  public void renderTo(RenderPort port) {
    if (isEmpty()) {
      port.drawPlaceholder();
      return;
    }
    primitives().forEach(primitive -> primitive.drawOn(port));
  }
}
