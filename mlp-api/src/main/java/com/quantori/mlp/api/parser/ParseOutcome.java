package com.quantori.mlp.api.parser;

import com.quantori.mlp.api.model.MoleculeGraph;
import java.util.List;

/**
 * Graph read from a notation together with the warnings collected on the way.
 */
public record ParseOutcome(MoleculeGraph graph, List<ParseWarning> warnings) {

  public ParseOutcome {
    warnings = List.copyOf(warnings);
  }

  public boolean isClean() {
    return warnings.isEmpty();
  }
}
