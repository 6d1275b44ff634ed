package com.quantori.mlp.core.source;

import com.quantori.mlp.api.model.MoleculeGraph;
import lombok.Builder;
import lombok.Value;

/**
 * Everything known about a structure to show: its notation and, optionally, coordinates other
 * services already produced for it.
 */
@Value
@Builder
public class StructureRequest {
  String notation;
  /** Shown next to the structure only. */
  String displayName;
  /** Conformer of a compound record, if one was fetched. */
  MoleculeGraph suppliedGraph;
  /** Geometry proposed by an AI service, if it was asked. */
  MoleculeGraph suggestedGraph;

  public static StructureRequest of(String notation) {
    return StructureRequest.builder().notation(notation).build();
  }
}
