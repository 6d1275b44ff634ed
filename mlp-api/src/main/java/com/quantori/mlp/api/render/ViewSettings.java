package com.quantori.mlp.api.render;

import lombok.Builder;
import lombok.Value;

/**
 * Camera and drawing constants of the perspective viewer. Lengths are view units of a square view
 * box whose centre is the projection centre.
 */
@Value
@Builder(toBuilder = true)
public class ViewSettings {
  public static final ViewSettings DEFAULT = ViewSettings.builder().build();

  /** Camera distance {@code D} in {@code f = D / (D + z')}. */
  @Builder.Default double perspectiveDistance = 6.0;
  @Builder.Default double viewBoxSize = 500.0;
  @Builder.Default double defaultViewScale = 50.0;
  @Builder.Default double atomRadius = 16.0;
  @Builder.Default double minStrokeWidth = 3.0;
  @Builder.Default double strokeWidthPerOrder = 2.5;
  @Builder.Default double doubleBondOffset = 3.5;
  @Builder.Default double tripleBondOffset = 4.5;
  @Builder.Default double labelFontSize = 14.0;
  @Builder.Default double minLabelFontSize = 12.0;
  /** Atoms with a larger depth factor get the emphasized (strong shadow) style. */
  @Builder.Default double emphasisDepthFactor = 0.9;

  public double centerX() {
    return viewBoxSize / 2;
  }

  public double centerY() {
    return viewBoxSize / 2;
  }
}
