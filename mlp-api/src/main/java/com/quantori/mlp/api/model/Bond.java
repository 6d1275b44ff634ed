package com.quantori.mlp.api.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A bond between two atoms of the same graph, referenced by their indices.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Bond {
  public static final int SINGLE = 1;
  public static final int DOUBLE = 2;
  public static final int TRIPLE = 3;

  private int from;
  private int to;
  private int order;

  public Bond copy() {
    return new Bond(from, to, order);
  }

  /**
   * Checks that both ends reference atoms of a graph with {@code atomCount} atoms and that the bond
   * is not a loop.
   *
   * @param atomCount number of atoms in the owning graph
   * @return true if the bond can be drawn and embedded
   */
  public boolean connectsAtomsWithin(int atomCount) {
    return from != to && from >= 0 && to >= 0 && from < atomCount && to < atomCount;
  }

  /**
   * Brings an arbitrary order into the supported {@code 1..3} range.
   *
   * @param order requested order
   * @return the nearest supported order
   */
  public static int clampOrder(int order) {
    return Math.max(SINGLE, Math.min(TRIPLE, order));
  }
}
