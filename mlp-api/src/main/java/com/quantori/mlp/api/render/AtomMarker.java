package com.quantori.mlp.api.render;

/**
 * A labelled sphere drawn for one atom.
 *
 * @param atomIndex   index of the atom in its graph
 * @param element     element symbol used as the label
 * @param viewX       projected centre, x
 * @param viewY       projected centre, y (grows downwards)
 * @param depth       rotated z of the atom
 * @param depthFactor perspective factor {@code D / (D + depth)}
 * @param radius      marker radius
 * @param opacity     fill opacity in {@code [0, 1]}
 * @param fontSize    label size
 * @param emphasized  whether the atom is near enough for the strong shadow
 * @param style       fill colours
 */
public record AtomMarker(
    int atomIndex,
    String element,
    double viewX,
    double viewY,
    double depth,
    double depthFactor,
    double radius,
    double opacity,
    double fontSize,
    boolean emphasized,
    ElementStyle style) implements RenderPrimitive {

  @Override
  public void drawOn(RenderPort port) {
    port.drawAtom(this);
  }
}
