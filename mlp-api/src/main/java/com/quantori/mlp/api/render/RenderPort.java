package com.quantori.mlp.api.render;

/**
 * Drawing surface a frame is replayed onto, e.g. an SVG writer, a canvas or an image exporter.
 * Primitives arrive back to front.
 */
public interface RenderPort {

  void drawBond(BondSegment segment);

  void drawAtom(AtomMarker marker);

  /**
   * Called instead of any primitive when the frame has no atoms.
   */
  default void drawPlaceholder() {
  }
}
