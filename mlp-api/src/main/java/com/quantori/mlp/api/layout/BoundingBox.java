package com.quantori.mlp.api.layout;

import com.quantori.mlp.api.model.Atom;
import com.quantori.mlp.api.model.MoleculeGraph;

/**
 * Axis-aligned bounding box of the atoms of a graph.
 */
public record BoundingBox(double minX, double maxX, double minY, double maxY, double minZ, double maxZ) {

  /**
   * Measures a graph.
   *
   * @param graph graph with at least one atom
   * @return the box enclosing every atom
   */
  public static BoundingBox of(MoleculeGraph graph) {
    if (graph.isEmpty()) {
      throw new IllegalArgumentException("Bounding box of an empty graph is undefined");
    }
    double minX = Double.POSITIVE_INFINITY;
    double minY = Double.POSITIVE_INFINITY;
    double minZ = Double.POSITIVE_INFINITY;
    double maxX = Double.NEGATIVE_INFINITY;
    double maxY = Double.NEGATIVE_INFINITY;
    double maxZ = Double.NEGATIVE_INFINITY;
    for (Atom atom : graph.getAtoms()) {
      minX = Math.min(minX, atom.getX());
      maxX = Math.max(maxX, atom.getX());
      minY = Math.min(minY, atom.getY());
      maxY = Math.max(maxY, atom.getY());
      minZ = Math.min(minZ, atom.getZ());
      maxZ = Math.max(maxZ, atom.getZ());
    }
    return new BoundingBox(minX, maxX, minY, maxY, minZ, maxZ);
  }

  public double extentX() {
    return maxX - minX;
  }

  public double extentY() {
    return maxY - minY;
  }

  public double extentZ() {
    return maxZ - minZ;
  }

  public double maxExtent() {
    return Math.max(extentX(), Math.max(extentY(), extentZ()));
  }

  public double centerX() {
    return (minX + maxX) / 2;
  }

  public double centerY() {
    return (minY + maxY) / 2;
  }

  public double centerZ() {
    return (minZ + maxZ) / 2;
  }
}
