package com.quantori.mlp.core.source;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Origin of the 3D coordinates shown for a structure.
 */
@Getter
@RequiredArgsConstructor
public enum CoordinateSource {
  /**
   * Laid out locally from the line notation by the force-directed embedder.
   */
  COMPUTED("computed", true),
  /**
   * Conformer supplied by a compound database record.
   */
  EXTERNALLY_SUPPLIED("external", false),
  /**
   * Geometry suggested by a generative AI service.
   */
  AI_SUGGESTED("ai", false);

  @JsonValue private final String value;
  private final boolean localLayoutRequired;
}
