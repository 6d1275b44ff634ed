package com.quantori.mlp.api.parser;

import com.quantori.mlp.api.model.MoleculeGraph;

/**
 * Reads a structural line notation into an atom / bond graph with zeroed coordinates.
 *
 * <p>Implementations are lenient: malformed input gives a partial or empty graph, never an
 * exception.
 */
public interface StructureParser {

  /**
   * Parses a notation.
   *
   * @param notation line notation, may be null or blank
   * @return the graph read so far; empty if nothing could be read
   */
  default MoleculeGraph parse(String notation) {
    return parseWithWarnings(notation).graph();
  }

  /**
   * Parses a notation and reports what was skipped.
   *
   * @param notation line notation, may be null or blank
   * @return graph and warnings
   */
  ParseOutcome parseWithWarnings(String notation);
}
