package com.quantori.mlp.api.render;

/**
 * One straight stroke of a bond. Double and triple bonds are drawn as several parallel segments.
 *
 * @param bondIndex   index of the bond in its graph
 * @param order       order of the bond the segment belongs to
 * @param offsetIndex position across the bond: 0 for the centre line, +1 / -1 for the side lines
 * @param viewX1      start, x
 * @param viewY1      start, y
 * @param viewX2      end, x
 * @param viewY2      end, y
 * @param depth       mean rotated z of the two bonded atoms
 * @param strokeWidth line width
 * @param opacity     stroke opacity in {@code [0, 1]}
 */
public record BondSegment(
    int bondIndex,
    int order,
    int offsetIndex,
    double viewX1,
    double viewY1,
    double viewX2,
    double viewY2,
    double depth,
    double strokeWidth,
    double opacity) implements RenderPrimitive {

  @Override
  public void drawOn(RenderPort port) {
    port.drawBond(this);
  }
}
