package com.quantori.mlp.api.render;

/**
 * One draw call of a frame.
 */
public interface RenderPrimitive {

  /**
   * Rotated depth {@code z'} the primitive was sorted by.
   *
   * @return depth along the viewing axis
   */
  double depth();

  void drawOn(RenderPort port);
}
