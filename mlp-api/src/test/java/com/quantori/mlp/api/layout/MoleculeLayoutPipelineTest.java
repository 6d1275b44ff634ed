package com.quantori.mlp.api.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.quantori.mlp.api.model.Atom;
import com.quantori.mlp.api.model.Bond;
import com.quantori.mlp.api.model.MoleculeGraph;
import com.quantori.mlp.api.parser.LineNotationParser;
import com.quantori.mlp.api.render.AtomMarker;
import com.quantori.mlp.api.render.PerspectiveProjector;
import com.quantori.mlp.api.render.RenderFrame;
import com.quantori.mlp.api.render.ViewRotation;
import java.util.List;
import org.junit.jupiter.api.Test;

class MoleculeLayoutPipelineTest {

  private final MoleculeLayoutPipeline pipeline = new MoleculeLayoutPipeline();

  @Test
  void ethanolEndToEnd() {
    MoleculeGraph graph = pipeline.layout("CCO");

    assertThat(graph.getAtoms()).extracting(Atom::getElement).containsExactly("C", "C", "O");
    assertThat(BoundingBox.of(graph).maxExtent()).isCloseTo(2.0, within(1e-9));
    // embedding is deterministic, so a second run gives the raw extent the pipeline normalized
    MoleculeGraph raw = new ForceDirectedEmbedder().embed(new LineNotationParser().parse("CCO"));
    double expected = LayoutSettings.DEFAULT.getIdealBondLength()
        * LayoutSettings.DEFAULT.getTargetSize() / BoundingBox.of(raw).maxExtent();
    for (Bond bond : graph.getBonds()) {
      double length = graph.atom(bond.getFrom()).distanceTo(graph.atom(bond.getTo()));
      assertThat(length).isBetween(expected * 0.6, expected * 1.4);
    }

    RenderFrame frame = new PerspectiveProjector().project(graph, ViewRotation.NONE);
    List<AtomMarker> atoms = frame.atoms();
    assertThat(atoms).hasSize(3);
    for (AtomMarker marker : atoms) {
      assertThat(Double.isFinite(marker.viewX())).isTrue();
      assertThat(Double.isFinite(marker.viewY())).isTrue();
    }
    for (int i = 0; i < atoms.size(); i++) {
      for (int j = i + 1; j < atoms.size(); j++) {
        double dx = atoms.get(i).viewX() - atoms.get(j).viewX();
        double dy = atoms.get(i).viewY() - atoms.get(j).viewY();
        assertThat(Math.hypot(dx, dy)).isGreaterThan(1.0);
      }
    }
  }

  @Test
  void emptyNotationGivesEmptyGraph() {
    assertThat(pipeline.layout("").isEmpty()).isTrue();
  }
}
