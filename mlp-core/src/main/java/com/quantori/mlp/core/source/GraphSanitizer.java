package com.quantori.mlp.core.source;

import com.quantori.mlp.api.model.Atom;
import com.quantori.mlp.api.model.Bond;
import com.quantori.mlp.api.model.ElementTable;
import com.quantori.mlp.api.model.MoleculeGraph;
import java.util.Objects;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

/**
 * Repairs graphs that come from outside the parser so they satisfy the graph invariant.
 */
@UtilityClass
public final class GraphSanitizer {

  /**
   * Drops bonds that do not connect two distinct atoms, clamps bond orders into {@code 1..3} and
   * replaces missing atoms and blank element symbols with carbon.
   *
   * @param graph graph to repair in place
   * @return the same graph instance
   */
  public static MoleculeGraph sanitize(MoleculeGraph graph) {
    graph.getAtoms().replaceAll(atom -> {
      if (atom == null) {
        return new Atom(ElementTable.CARBON);
      }
      atom.setElement(StringUtils.defaultIfBlank(StringUtils.trim(atom.getElement()), ElementTable.CARBON));
      return atom;
    });
    int atomCount = graph.atomCount();
    graph.getBonds().removeIf(bond -> bond == null || !bond.connectsAtomsWithin(atomCount));
    graph.getBonds().forEach(bond -> bond.setOrder(Bond.clampOrder(bond.getOrder())));
    return graph;
  }

  /**
   * Checks that a graph can be shown as it is: it has atoms, valid bonds and finite coordinates.
   *
   * @param graph graph to check, may be null
   * @return true if the graph is usable without a local layout
   */
  public static boolean isDisplayable(MoleculeGraph graph) {
    if (graph == null || graph.getAtoms() == null || graph.getBonds() == null || graph.isEmpty()) {
      return false;
    }
    for (Atom atom : graph.getAtoms()) {
      if (atom == null || !Double.isFinite(atom.getX()) || !Double.isFinite(atom.getY())
          || !Double.isFinite(atom.getZ())) {
        return false;
      }
    }
    return graph.getBonds().stream().noneMatch(Objects::isNull) && graph.hasValidBonds();
  }
}
