package com.quantori.mlp.api.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.quantori.mlp.api.layout.MoleculeLayoutPipeline;
import com.quantori.mlp.api.model.Atom;
import com.quantori.mlp.api.model.Bond;
import com.quantori.mlp.api.model.MoleculeGraph;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PerspectiveProjectorTest {

  private final PerspectiveProjector projector = new PerspectiveProjector();

  @Mock
  private RenderPort port;

  @Test
  void atomsComeOutInAscendingDepth() {
    MoleculeGraph graph = graphOf(
        List.of(new Atom("C", 0, 0, 1), new Atom("O", 1, 0, -1), new Atom("N", -1, 0, 0)),
        List.of());

    RenderFrame frame = projector.project(graph, ViewRotation.NONE);

    assertThat(frame.atoms()).extracting(AtomMarker::atomIndex).containsExactly(1, 2, 0);
  }

  @ParameterizedTest
  @CsvSource({"0,0", "30,45", "-80,200", "90,0", "0,90"})
  void depthNeverDecreasesAlongTheFrame(double pitch, double yaw) {
    MoleculeGraph graph = new MoleculeLayoutPipeline().layout("CC(=O)Nc1ccc(O)cc1");

    RenderFrame frame = projector.project(graph, pitch, yaw, 50);

    assertThat(frame.atoms()).hasSize(graph.atomCount());
    for (int i = 1; i < frame.atoms().size(); i++) {
      assertThat(frame.atoms().get(i).depth()).isGreaterThanOrEqualTo(frame.atoms().get(i - 1).depth());
    }
    for (int i = 1; i < frame.bonds().size(); i++) {
      assertThat(frame.bonds().get(i).depth()).isGreaterThanOrEqualTo(frame.bonds().get(i - 1).depth());
    }
    for (AtomMarker marker : frame.atoms()) {
      assertThat(Double.isFinite(marker.viewX()) && Double.isFinite(marker.viewY())).isTrue();
    }
  }

  @Test
  void yawTurnsAboutVerticalAxis() {
    MoleculeGraph graph = graphOf(List.of(new Atom("C", 1, 0, 0)), List.of());

    AtomMarker marker = projector.project(graph, 0, 90, 50).atoms().get(0);

    // x moves into -z, which brings the atom closer and enlarges it
    assertThat(marker.depth()).isCloseTo(-1.0, within(1e-9));
    assertThat(marker.depthFactor()).isCloseTo(6.0 / 5.0, within(1e-9));
    assertThat(marker.viewX()).isCloseTo(250.0, within(1e-9));
    assertThat(marker.radius()).isCloseTo(16 * 1.2, within(1e-9));
    assertThat(marker.emphasized()).isTrue();
  }

  @Test
  void pitchTurnsAboutHorizontalAxis() {
    MoleculeGraph graph = graphOf(List.of(new Atom("C", 0, 1, 0)), List.of());

    AtomMarker marker = projector.project(graph, 90, 0, 50).atoms().get(0);

    assertThat(marker.depth()).isCloseTo(1.0, within(1e-9));
    assertThat(marker.viewY()).isCloseTo(250.0, within(1e-9));
    assertThat(marker.fontSize()).isCloseTo(12.0, within(1e-9));
    assertThat(marker.emphasized()).isFalse();
  }

  @Test
  void projectsAroundViewBoxCentre() {
    MoleculeGraph graph = graphOf(List.of(new Atom("S", 1, 1, 0)), List.of());

    AtomMarker marker = projector.project(graph, ViewRotation.NONE).atoms().get(0);

    assertThat(marker.viewX()).isCloseTo(300.0, within(1e-9));
    assertThat(marker.viewY()).isCloseTo(200.0, within(1e-9));
    assertThat(marker.style()).isEqualTo(ElementStyle.forElement("S"));
  }

  @Test
  void singleBondIsOneSegment() {
    RenderFrame frame = projector.project(horizontalBond(Bond.SINGLE), ViewRotation.NONE);

    assertThat(frame.bonds()).hasSize(1);
    BondSegment segment = frame.bonds().get(0);
    assertThat(segment.viewY1()).isCloseTo(250.0, within(1e-9));
    assertThat(segment.strokeWidth()).isCloseTo(3.0, within(1e-9));
    assertThat(segment.opacity()).isCloseTo(1.0, within(1e-9));
  }

  @Test
  void doubleBondIsTwoParallelSegments() {
    RenderFrame frame = projector.project(horizontalBond(Bond.DOUBLE), ViewRotation.NONE);

    assertThat(frame.bonds()).extracting(BondSegment::offsetIndex).containsExactly(1, -1);
    assertThat(frame.bonds()).extracting(BondSegment::viewY1).containsExactly(253.5, 246.5);
    assertThat(frame.bonds()).allSatisfy(segment -> {
      assertThat(segment.viewY2()).isEqualTo(segment.viewY1());
      assertThat(segment.strokeWidth()).isCloseTo(4.0, within(1e-9));
    });
  }

  @Test
  void tripleBondHasCentreAndTwoSideSegments() {
    RenderFrame frame = projector.project(horizontalBond(Bond.TRIPLE), ViewRotation.NONE);

    assertThat(frame.bonds()).extracting(BondSegment::offsetIndex).containsExactly(0, 1, -1);
    assertThat(frame.bonds()).extracting(BondSegment::viewY1).containsExactly(250.0, 254.5, 245.5);
    assertThat(frame.bonds().get(0).strokeWidth()).isCloseTo(7.5 * 0.8, within(1e-9));
    assertThat(frame.bonds().get(1).strokeWidth()).isCloseTo(7.5 * 0.7, within(1e-9));
    assertThat(frame.bonds().get(1).opacity()).isCloseTo(0.9, within(1e-9));
  }

  @Test
  void bondSeenEndOnStaysFinite() {
    MoleculeGraph graph = graphOf(
        List.of(new Atom("C", 0, 0, 1), new Atom("C", 0, 0, -1)),
        List.of(new Bond(0, 1, Bond.DOUBLE)));

    RenderFrame frame = projector.project(graph, ViewRotation.NONE);

    assertThat(frame.bonds()).hasSize(2).allSatisfy(segment -> {
      assertThat(segment.viewX1()).isEqualTo(250.0);
      assertThat(segment.viewY1()).isEqualTo(250.0);
    });
  }

  @Test
  void framesReplayBondsBeforeAtoms() {
    RenderFrame frame = projector.project(horizontalBond(Bond.DOUBLE), ViewRotation.NONE);

    frame.renderTo(port);

    InOrder inOrder = inOrder(port);
    inOrder.verify(port, times(2)).drawBond(any());
    inOrder.verify(port, times(2)).drawAtom(any());
    verify(port, never()).drawPlaceholder();
  }

  @Test
  void emptyGraphRendersPlaceholder() {
    RenderFrame frame = projector.project(MoleculeGraph.empty(), ViewRotation.NONE);

    frame.renderTo(port);

    assertThat(frame.isEmpty()).isTrue();
    verify(port).drawPlaceholder();
    verify(port, never()).drawAtom(any());
  }

  private static MoleculeGraph horizontalBond(int order) {
    return graphOf(
        List.of(new Atom("C", -1, 0, 0), new Atom("O", 1, 0, 0)),
        List.of(new Bond(0, 1, order)));
  }

  private static MoleculeGraph graphOf(List<Atom> atoms, List<Bond> bonds) {
    return new MoleculeGraph(new ArrayList<>(atoms), new ArrayList<>(bonds));
  }
}
