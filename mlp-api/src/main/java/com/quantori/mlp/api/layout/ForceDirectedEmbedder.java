package com.quantori.mlp.api.layout;

import com.quantori.mlp.api.model.Atom;
import com.quantori.mlp.api.model.Bond;
import com.quantori.mlp.api.model.MoleculeGraph;
import java.util.Arrays;
import java.util.List;

/**
 * Force-directed 3D layout.
 *
 * <p>Atoms are seeded on an expanding spiral and then relaxed for a fixed number of iterations:
 * every pair of atoms repels with an inverse-square force (plus an extra push when closer than the
 * minimum separation), every bond acts as a spring towards the ideal bond length, and the summed
 * forces move the atoms with a damping that falls linearly over the run.
 *
 * <p>The result depends only on the atom and bond order of the input, two runs over equal graphs
 * give equal coordinates. The cost is {@code O(iterations * atoms^2)}.
 */
public class ForceDirectedEmbedder implements MoleculeEmbedder {

  private final LayoutSettings settings;

  public ForceDirectedEmbedder() {
    this(LayoutSettings.DEFAULT);
  }

  public ForceDirectedEmbedder(LayoutSettings settings) {
    this.settings = settings;
  }

  @Override
  public MoleculeGraph embed(MoleculeGraph graph) {
    List<Atom> atoms = graph.getAtoms();
    if (atoms.isEmpty()) {
      return graph;
    }
    seed(atoms);
    if (atoms.size() < 2) {
      return graph;
    }

    int n = atoms.size();
    double[] fx = new double[n];
    double[] fy = new double[n];
    double[] fz = new double[n];
    for (int iteration = 0; iteration < settings.getIterations(); iteration++) {
      Arrays.fill(fx, 0);
      Arrays.fill(fy, 0);
      Arrays.fill(fz, 0);

      repel(atoms, fx, fy, fz);
      pullBonds(atoms, graph.getBonds(), fx, fy, fz);

      double damping = settings.dampingAt(iteration);
      for (int i = 0; i < n; i++) {
        Atom atom = atoms.get(i);
        atom.setX(atom.getX() + fx[i] * damping);
        atom.setY(atom.getY() + fy[i] * damping);
        atom.setZ(atom.getZ() + fz[i] * damping);
      }
    }
    return graph;
  }

  private void seed(List<Atom> atoms) {
    int n = atoms.size();
    if (n == 1) {
      Atom atom = atoms.get(0);
      atom.setX(0);
      atom.setY(0);
      atom.setZ(0);
      return;
    }
    double radius = settings.getSpiralRadiusFactor() * Math.sqrt(n);
    for (int i = 0; i < n; i++) {
      double t = (double) i / n;
      double angle = t * settings.getSpiralSweep();
      double r = t * radius;
      Atom atom = atoms.get(i);
      atom.setX(Math.cos(angle) * r);
      atom.setY(Math.sin(angle) * r);
      atom.setZ((t - 0.5) * settings.getSpiralDepth());
    }
  }

  private void repel(List<Atom> atoms, double[] fx, double[] fy, double[] fz) {
    int n = atoms.size();
    for (int i = 0; i < n; i++) {
      Atom a = atoms.get(i);
      for (int j = i + 1; j < n; j++) {
        Atom b = atoms.get(j);
        double dx = b.getX() - a.getX();
        double dy = b.getY() - a.getY();
        double dz = b.getZ() - a.getZ();
        double dist = distance(dx, dy, dz);

        double force = settings.getRepulsionStrength() / (dist * dist);
        if (dist < settings.getMinSeparation()) {
          force += (settings.getMinSeparation() - dist) * settings.getSeparationPush();
        }
        double ux = dx / dist;
        double uy = dy / dist;
        double uz = dz / dist;
        fx[i] -= ux * force;
        fy[i] -= uy * force;
        fz[i] -= uz * force;
        fx[j] += ux * force;
        fy[j] += uy * force;
        fz[j] += uz * force;
      }
    }
  }

  private void pullBonds(List<Atom> atoms, List<Bond> bonds, double[] fx, double[] fy, double[] fz) {
    int n = atoms.size();
    for (Bond bond : bonds) {
      if (!bond.connectsAtomsWithin(n)) {
        continue;
      }
      Atom a = atoms.get(bond.getFrom());
      Atom b = atoms.get(bond.getTo());
      double dx = b.getX() - a.getX();
      double dy = b.getY() - a.getY();
      double dz = b.getZ() - a.getZ();
      double dist = distance(dx, dy, dz);

      double force = (dist - settings.getIdealBondLength()) * settings.getSpringStrength();
      double ux = dx / dist;
      double uy = dy / dist;
      double uz = dz / dist;
      fx[bond.getFrom()] += ux * force;
      fy[bond.getFrom()] += uy * force;
      fz[bond.getFrom()] += uz * force;
      fx[bond.getTo()] -= ux * force;
      fy[bond.getTo()] -= uy * force;
      fz[bond.getTo()] -= uz * force;
    }
  }

  private double distance(double dx, double dy, double dz) {
    return Math.max(Math.sqrt(dx * dx + dy * dy + dz * dz), settings.getMinDistance());
  }
}
