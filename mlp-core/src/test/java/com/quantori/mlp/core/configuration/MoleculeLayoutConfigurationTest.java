package com.quantori.mlp.core.configuration;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.core.Is.is;

import com.quantori.mlp.api.layout.LayoutSettings;
import com.quantori.mlp.api.render.ViewSettings;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class MoleculeLayoutConfigurationTest {

  @Test
  void referenceDefaultsMatchBuiltInSettings() {
    MoleculeLayoutConfiguration configuration = MoleculeLayoutConfiguration.load(ConfigFactory.empty());

    assertThat(configuration.getLayout(), is(equalTo(LayoutSettings.DEFAULT)));
    assertThat(configuration.getView(), is(equalTo(ViewSettings.DEFAULT)));
    assertThat(configuration.getAutoRotateDegrees(), is(0.5));
    assertThat(configuration.getWorker().getSystemName(), is("mlp-layout-system"));
    assertThat(configuration.getWorker().getInlineAtomLimit(), is(40));
    assertThat(configuration.getWorker().getAskTimeout(), is(Duration.ofMinutes(1)));
  }

  @Test
  void overridesReplaceSingleKeys() {
    MoleculeLayoutConfiguration configuration = MoleculeLayoutConfiguration.load(ConfigFactory.parseString(
        "mlp.layout.iterations = 60\n"
            + "mlp.view.perspective-distance = 8\n"
            + "mlp.view.double-bond-offset = 5\n"
            + "mlp.view.emphasis-depth-factor = 0.95\n"
            + "mlp.layout.spiral-sweep = 3.14\n"
            + "mlp.worker.inline-atom-limit = 5"));

    assertThat(configuration.getLayout().getIterations(), is(60));
    assertThat(configuration.getLayout().getIdealBondLength(), is(2.2));
    assertThat(configuration.getView().getPerspectiveDistance(), is(8.0));
    assertThat(configuration.getView().getDoubleBondOffset(), is(5.0));
    assertThat(configuration.getView().getEmphasisDepthFactor(), is(0.95));
    assertThat(configuration.getView().getTripleBondOffset(), is(4.5));
    assertThat(configuration.getLayout().getSpiralSweep(), is(3.14));
    assertThat(configuration.getWorker().getInlineAtomLimit(), is(5));
  }

  @Test
  void configuredViewSettingsReachTheProjector() {
    MoleculeLayoutConfiguration configuration = MoleculeLayoutConfiguration.load(ConfigFactory.parseString(
        "mlp.view.min-stroke-width = 1\n"
            + "mlp.view.stroke-width-per-order = 4\n"
            + "mlp.view.label-font-size = 20\n"
            + "mlp.view.min-label-font-size = 8"));

    ViewSettings view = configuration.getView();

    assertThat(view.getMinStrokeWidth(), is(1.0));
    assertThat(view.getStrokeWidthPerOrder(), is(4.0));
    assertThat(view.getLabelFontSize(), is(20.0));
    assertThat(view.getMinLabelFontSize(), is(8.0));
  }
}
