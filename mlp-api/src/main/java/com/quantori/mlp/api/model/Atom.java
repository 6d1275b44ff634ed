package com.quantori.mlp.api.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An atom of a molecule graph. Coordinates stay at the origin until the graph is embedded.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Atom {
  private String element;
  private double x;
  private double y;
  private double z;

  public Atom(String element) {
    this.element = element;
  }

  public Atom copy() {
    return new Atom(element, x, y, z);
  }

  public double distanceTo(Atom other) {
    double dx = other.x - x;
    double dy = other.y - y;
    double dz = other.z - z;
    return Math.sqrt(dx * dx + dy * dy + dz * dz);
  }
}
