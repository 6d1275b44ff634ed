package com.quantori.mlp.core.layout;

import com.quantori.mlp.api.model.MoleculeGraph;
import com.quantori.mlp.api.parser.ParseWarning;
import com.quantori.mlp.core.source.CoordinateSource;
import com.quantori.mlp.core.source.ResolvedStructure;
import java.util.List;

/**
 * Layout result kept by {@link LayoutActor}. Later generations supersede earlier ones.
 */
public record LayoutSnapshot(
    long generation, String notation, CoordinateSource source, MoleculeGraph graph, List<ParseWarning> warnings) {

  public LayoutSnapshot {
    warnings = List.copyOf(warnings);
  }

  static LayoutSnapshot of(long generation, String notation, ResolvedStructure structure) {
    return new LayoutSnapshot(generation, notation, structure.source(), structure.graph(), structure.warnings());
  }
}
