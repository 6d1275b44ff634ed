package com.quantori.mlp.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Atom / bond graph of a molecule.
 *
 * <p>Every bond references atoms by their position in {@link #getAtoms()}. Duplicate bonds between
 * the same pair of atoms are kept as they are. The graph is mutated while it is being built and
 * embedded; once normalized it is treated as read-only by its consumers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MoleculeGraph {
  private List<Atom> atoms = new ArrayList<>();
  private List<Bond> bonds = new ArrayList<>();

  public static MoleculeGraph empty() {
    return new MoleculeGraph();
  }

  /**
   * Appends an atom with zeroed coordinates.
   *
   * @param element element symbol
   * @return index of the new atom
   */
  public int addAtom(String element) {
    atoms.add(new Atom(element));
    return atoms.size() - 1;
  }

  public Bond addBond(int from, int to, int order) {
    Bond bond = new Bond(from, to, order);
    bonds.add(bond);
    return bond;
  }

  public Atom atom(int index) {
    return atoms.get(index);
  }

  public int atomCount() {
    return atoms.size();
  }

  public int bondCount() {
    return bonds.size();
  }

  @JsonIgnore
  public boolean isEmpty() {
    return atoms.isEmpty();
  }

  /**
   * Checks the graph invariant: every bond connects two distinct atoms of this graph.
   *
   * @return true if all bonds are within range
   */
  public boolean hasValidBonds() {
    int atomCount = atoms.size();
    return bonds.stream().allMatch(bond -> bond.connectsAtomsWithin(atomCount));
  }

  /**
   * Deep copy, so the copy can be embedded without touching this instance.
   *
   * @return an independent graph with equal content
   */
  public MoleculeGraph copy() {
    List<Atom> atomsCopy = new ArrayList<>(atoms.size());
    atoms.forEach(atom -> atomsCopy.add(atom.copy()));
    List<Bond> bondsCopy = new ArrayList<>(bonds.size());
    bonds.forEach(bond -> bondsCopy.add(bond.copy()));
    return new MoleculeGraph(atomsCopy, bondsCopy);
  }
}
