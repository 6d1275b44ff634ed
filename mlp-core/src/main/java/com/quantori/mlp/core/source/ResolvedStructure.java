package com.quantori.mlp.core.source;

import com.quantori.mlp.api.model.MoleculeGraph;
import com.quantori.mlp.api.parser.ParseWarning;
import java.util.List;

/**
 * Normalized graph chosen for a request.
 *
 * @param source   where its coordinates came from
 * @param graph    normalized graph, possibly empty
 * @param warnings parse warnings, empty unless the graph was computed
 */
public record ResolvedStructure(CoordinateSource source, MoleculeGraph graph, List<ParseWarning> warnings) {

  public ResolvedStructure {
    warnings = List.copyOf(warnings);
  }

  public static ResolvedStructure provided(CoordinateSource source, MoleculeGraph graph) {
    return new ResolvedStructure(source, graph, List.of());
  }
}
