package com.quantori.mlp.api.render;

import java.util.Map;

/**
 * Radial fill of an atom marker, from the highlight in the middle to the shade at the rim.
 *
 * @param highlight centre colour as {@code #rrggbb}
 * @param shade     rim colour as {@code #rrggbb}
 */
public record ElementStyle(String highlight, String shade) {

  public static final ElementStyle CARBON = new ElementStyle("#888888", "#444444");

  private static final Map<String, ElementStyle> STYLES = Map.of(
      "C", CARBON,
      "O", new ElementStyle("#ff6666", "#dd0000"),
      "N", new ElementStyle("#6666ff", "#0000dd"),
      "S", new ElementStyle("#ffff66", "#dddd00"),
      "H", new ElementStyle("#ffffff", "#cccccc"),
      "P", new ElementStyle("#ff8800", "#cc6600"));

  /**
   * Looks up the fill of an element.
   *
   * @param element element symbol
   * @return the element's style, carbon's for elements without one
   */
  public static ElementStyle forElement(String element) {
    if (element == null) {
      return CARBON;
    }
    return STYLES.getOrDefault(element, CARBON);
  }
}
