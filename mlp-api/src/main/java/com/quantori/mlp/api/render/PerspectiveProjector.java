package com.quantori.mlp.api.render;

import com.quantori.mlp.api.model.Atom;
import com.quantori.mlp.api.model.Bond;
import com.quantori.mlp.api.model.MoleculeGraph;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns a normalized graph into a depth-sorted frame for a given rotation.
 *
 * <p>Atoms are rotated about Y by the yaw, then about X by the pitch, and projected with the depth
 * factor {@code f = D / (D + z')}. Bonds are emitted in ascending mean {@code z'} and atoms in
 * ascending {@code z'}, and a later primitive is drawn over an earlier one.
 *
 * <p>The projector never embeds or normalizes, it reads coordinates as they are. Angles must be
 * finite; checking them is left to the caller.
 */
public class PerspectiveProjector {

  private final ViewSettings settings;

  public PerspectiveProjector() {
    this(ViewSettings.DEFAULT);
  }

  public PerspectiveProjector(ViewSettings settings) {
    this.settings = settings;
  }

  public ViewSettings getSettings() {
    return settings;
  }

  public RenderFrame project(MoleculeGraph graph, ViewRotation rotation) {
    return project(graph, rotation.pitch(), rotation.yaw(), settings.getDefaultViewScale());
  }

  /**
   * Projects every atom and bond of a graph.
   *
   * @param graph     normalized graph
   * @param pitchDeg  rotation about X in degrees
   * @param yawDeg    rotation about Y in degrees
   * @param viewScale view units per layout unit
   * @return the frame in painter's order
   */
  public RenderFrame project(MoleculeGraph graph, double pitchDeg, double yawDeg, double viewScale) {
    List<Atom> atoms = graph.getAtoms();
    Projected[] projected = new Projected[atoms.size()];
    Camera camera = new Camera(Math.toRadians(pitchDeg), Math.toRadians(yawDeg), viewScale);
    for (int i = 0; i < projected.length; i++) {
      projected[i] = camera.project(atoms.get(i));
    }

    List<BondSegment> segments = projectBonds(graph.getBonds(), projected);
    List<AtomMarker> markers = projectAtoms(atoms, projected);
    return new RenderFrame(ViewRotation.of(pitchDeg, yawDeg), viewScale, segments, markers);
  }

  private List<AtomMarker> projectAtoms(List<Atom> atoms, Projected[] projected) {
    List<Integer> order = new ArrayList<>(atoms.size());
    for (int i = 0; i < atoms.size(); i++) {
      order.add(i);
    }
    order.sort(Comparator.comparingDouble(i -> projected[i].depth()));

    List<AtomMarker> markers = new ArrayList<>(atoms.size());
    for (int index : order) {
      Projected p = projected[index];
      String element = atoms.get(index).getElement();
      markers.add(new AtomMarker(
          index,
          element,
          p.viewX(),
          p.viewY(),
          p.depth(),
          p.factor(),
          settings.getAtomRadius() * p.factor(),
          clampOpacity(0.9 + p.factor() * 0.1),
          Math.max(settings.getMinLabelFontSize(), settings.getLabelFontSize() * p.factor()),
          p.factor() > settings.getEmphasisDepthFactor(),
          ElementStyle.forElement(element)));
    }
    return markers;
  }

  private List<BondSegment> projectBonds(List<Bond> bonds, Projected[] projected) {
    List<Integer> order = new ArrayList<>(bonds.size());
    for (int i = 0; i < bonds.size(); i++) {
      if (bonds.get(i).connectsAtomsWithin(projected.length)) {
        order.add(i);
      }
    }
    order.sort(Comparator.comparingDouble(i -> bondDepth(bonds.get(i), projected)));

    List<BondSegment> segments = new ArrayList<>();
    for (int index : order) {
      Bond bond = bonds.get(index);
      addSegments(segments, index, bond, projected[bond.getFrom()], projected[bond.getTo()]);
    }
    return segments;
  }

  private void addSegments(List<BondSegment> segments, int index, Bond bond, Projected from, Projected to) {
    double depth = (from.depth() + to.depth()) / 2;
    double factor = (from.factor() + to.factor()) / 2;
    int order = Bond.clampOrder(bond.getOrder());
    double width = Math.max(settings.getMinStrokeWidth(), order * settings.getStrokeWidthPerOrder() * factor);
    double opacity = clampOpacity(0.7 + factor * 0.3);

    if (order == Bond.SINGLE) {
      segments.add(segment(index, order, 0, from, to, 0, 0, depth, width, opacity));
      return;
    }

    double dx = to.viewX() - from.viewX();
    double dy = to.viewY() - from.viewY();
    double length = Math.sqrt(dx * dx + dy * dy);
    double offset = (order == Bond.DOUBLE ? settings.getDoubleBondOffset() : settings.getTripleBondOffset()) * factor;
    // endpoints projected onto one point have no direction to offset from
    double ox = length > 0 ? (-dy / length) * offset : 0;
    double oy = length > 0 ? (dx / length) * offset : 0;

    if (order == Bond.DOUBLE) {
      segments.add(segment(index, order, 1, from, to, ox, oy, depth, width * 0.8, opacity));
      segments.add(segment(index, order, -1, from, to, -ox, -oy, depth, width * 0.8, opacity));
    } else {
      double sideOpacity = clampOpacity(0.6 + factor * 0.3);
      segments.add(segment(index, order, 0, from, to, 0, 0, depth, width * 0.8, opacity));
      segments.add(segment(index, order, 1, from, to, ox, oy, depth, width * 0.7, sideOpacity));
      segments.add(segment(index, order, -1, from, to, -ox, -oy, depth, width * 0.7, sideOpacity));
    }
  }

  private static BondSegment segment(int index, int order, int offsetIndex, Projected from, Projected to,
                                     double ox, double oy, double depth, double width, double opacity) {
    return new BondSegment(index, order, offsetIndex,
        from.viewX() + ox, from.viewY() + oy, to.viewX() + ox, to.viewY() + oy, depth, width, opacity);
  }

  private static double bondDepth(Bond bond, Projected[] projected) {
    return (projected[bond.getFrom()].depth() + projected[bond.getTo()].depth()) / 2;
  }

  private static double clampOpacity(double opacity) {
    return Math.max(0, Math.min(1, opacity));
  }

  private final class Camera {
    private final double sinPitch;
    private final double cosPitch;
    private final double sinYaw;
    private final double cosYaw;
    private final double viewScale;

    private Camera(double pitch, double yaw, double viewScale) {
      this.sinPitch = Math.sin(pitch);
      this.cosPitch = Math.cos(pitch);
      this.sinYaw = Math.sin(yaw);
      this.cosYaw = Math.cos(yaw);
      this.viewScale = viewScale;
    }

    private Projected project(Atom atom) {
      double x = atom.getX() * cosYaw + atom.getZ() * sinYaw;
      double z = -atom.getX() * sinYaw + atom.getZ() * cosYaw;
      double y = atom.getY() * cosPitch - z * sinPitch;
      z = atom.getY() * sinPitch + z * cosPitch;

      double d = settings.getPerspectiveDistance();
      double factor = d / (d + z);
      return new Projected(
          settings.centerX() + x * viewScale * factor,
          settings.centerY() - y * viewScale * factor,
          z,
          factor);
    }
  }

  private record Projected(double viewX, double viewY, double depth, double factor) {}
}
