package com.quantori.mlp.api.layout;

import com.quantori.mlp.api.model.MoleculeGraph;

/**
 * Computes 3D coordinates for the atoms of a graph.
 */
public interface MoleculeEmbedder {

  /**
   * Assigns coordinates in place. Atom and bond identity and order are left untouched.
   *
   * @param graph graph to embed
   * @return the same graph instance
   */
  MoleculeGraph embed(MoleculeGraph graph);
}
