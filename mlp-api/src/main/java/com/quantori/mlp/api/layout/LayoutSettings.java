package com.quantori.mlp.api.layout;

import lombok.Builder;
import lombok.Value;

/**
 * Constants of the force-directed simulation and of the normalization box. Distances are in
 * layout units, before normalization.
 */
@Value
@Builder(toBuilder = true)
public class LayoutSettings {
  public static final LayoutSettings DEFAULT = LayoutSettings.builder().build();

  @Builder.Default int iterations = 240;
  @Builder.Default double idealBondLength = 2.2;
  @Builder.Default double springStrength = 0.25;
  @Builder.Default double repulsionStrength = 1.5;
  @Builder.Default double minSeparation = 1.2;
  @Builder.Default double separationPush = 0.6;
  /** Floor applied to every measured distance before dividing by it. */
  @Builder.Default double minDistance = 0.1;
  @Builder.Default double initialDamping = 0.55;
  /** Amount the damping falls by between the first and the last iteration. */
  @Builder.Default double dampingDecay = 0.35;
  /** Total angle swept by the seed spiral, in radians. */
  @Builder.Default double spiralSweep = 4 * Math.PI;
  /** Spiral radius is this factor times the square root of the atom count. */
  @Builder.Default double spiralRadiusFactor = 1.8;
  /** Depth range the seed spiral spans along z. */
  @Builder.Default double spiralDepth = 3.0;
  /** Length of the longest bounding-box axis after normalization. */
  @Builder.Default double targetSize = 2.0;

  public double dampingAt(int iteration) {
    return initialDamping - ((double) iteration / iterations) * dampingDecay;
  }
}
