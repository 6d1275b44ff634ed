package com.quantori.mlp.core.configuration;

import com.quantori.mlp.api.layout.LayoutSettings;
import com.quantori.mlp.api.render.ViewSettings;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Settings of the layout platform read from the {@code mlp} block of a HOCON configuration.
 * Defaults live in {@code reference.conf}.
 */
@Slf4j
@Value
public class MoleculeLayoutConfiguration {
  public static final String ROOT_PATH = "mlp";

  LayoutSettings layout;
  ViewSettings view;
  double autoRotateDegrees;
  WorkerProperties worker;

  public static MoleculeLayoutConfiguration load() {
    return load(ConfigFactory.load());
  }

  public static MoleculeLayoutConfiguration load(Config config) {
    Config root = config.withFallback(ConfigFactory.defaultReference()).getConfig(ROOT_PATH);
    Config layout = root.getConfig("layout");
    Config view = root.getConfig("view");
    Config worker = root.getConfig("worker");

    MoleculeLayoutConfiguration configuration = new MoleculeLayoutConfiguration(
        layoutSettings(layout),
        viewSettings(view),
        view.getDouble("auto-rotate-degrees"),
        WorkerProperties.builder()
            .systemName(worker.getString("system-name"))
            .inlineAtomLimit(worker.getInt("inline-atom-limit"))
            .askTimeout(worker.getDuration("ask-timeout"))
            .build());
    log.debug("Loaded layout configuration: {}", configuration);
    return configuration;
  }

  private static LayoutSettings layoutSettings(Config layout) {
    return LayoutSettings.builder()
        .iterations(layout.getInt("iterations"))
        .idealBondLength(layout.getDouble("ideal-bond-length"))
        .springStrength(layout.getDouble("spring-strength"))
        .repulsionStrength(layout.getDouble("repulsion-strength"))
        .minSeparation(layout.getDouble("min-separation"))
        .separationPush(layout.getDouble("separation-push"))
        .minDistance(layout.getDouble("min-distance"))
        .initialDamping(layout.getDouble("initial-damping"))
        .dampingDecay(layout.getDouble("damping-decay"))
        .spiralSweep(layout.getDouble("spiral-sweep"))
        .spiralRadiusFactor(layout.getDouble("spiral-radius-factor"))
        .spiralDepth(layout.getDouble("spiral-depth"))
        .targetSize(layout.getDouble("target-size"))
        .build();
  }

  private static ViewSettings viewSettings(Config view) {
    return ViewSettings.builder()
        .perspectiveDistance(view.getDouble("perspective-distance"))
        .viewBoxSize(view.getDouble("view-box-size"))
        .defaultViewScale(view.getDouble("default-view-scale"))
        .atomRadius(view.getDouble("atom-radius"))
        .minStrokeWidth(view.getDouble("min-stroke-width"))
        .strokeWidthPerOrder(view.getDouble("stroke-width-per-order"))
        .doubleBondOffset(view.getDouble("double-bond-offset"))
        .tripleBondOffset(view.getDouble("triple-bond-offset"))
        .labelFontSize(view.getDouble("label-font-size"))
        .minLabelFontSize(view.getDouble("min-label-font-size"))
        .emphasisDepthFactor(view.getDouble("emphasis-depth-factor"))
        .build();
  }
}
