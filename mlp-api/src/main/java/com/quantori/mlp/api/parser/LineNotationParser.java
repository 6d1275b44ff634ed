package com.quantori.mlp.api.parser;

import com.quantori.mlp.api.model.Bond;
import com.quantori.mlp.api.model.ElementTable;
import com.quantori.mlp.api.model.MoleculeGraph;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Permissive single pass reader of SMILES-like line notations.
 *
 * <p>Understands element atoms (with {@code Cl} and {@code Br} as the two-letter ones), lower-case
 * aromatic atoms, {@code =} and {@code #} bond orders, single digit ring-closure labels and
 * parenthesised branches. Everything else is skipped with a {@link ParseWarning}. Stereo marks,
 * charges, isotopes, bracket atoms and {@code %nn} labels are not interpreted.
 *
 * <p>A bond symbol changes the order of the bond created before it, so {@code CC=O} reads as a
 * double C-C bond followed by a single C-O bond.
 */
@Slf4j
public class LineNotationParser implements StructureParser {

  @Override
  public ParseOutcome parseWithWarnings(String notation) {
    String input = notation == null ? "" : notation;
    Scan scan = new Scan(input);
    scan.run();
    if (!scan.warnings.isEmpty()) {
      log.debug("Parsed '{}' with {} warnings: {}", input, scan.warnings.size(), scan.warnings);
    }
    return new ParseOutcome(scan.graph, scan.warnings);
  }

  private static final class Scan {
    private final String input;
    private final MoleculeGraph graph = MoleculeGraph.empty();
    private final List<ParseWarning> warnings = new ArrayList<>();
    private final Deque<Integer> branchStack = new ArrayDeque<>();
    // ordered by label so that end-of-input warnings come out in a stable order
    private final Map<Character, Integer> openRings = new TreeMap<>();
    private int currentAtom = -1;
    private int pendingOrder = 0;
    private int pendingOrderPosition = -1;

    private Scan(String input) {
      this.input = input;
    }

    private void run() {
      int i = 0;
      while (i < input.length()) {
        i = step(i);
      }
      finish();
    }

    /**
     * Handles the token starting at {@code i}.
     *
     * @return offset of the next token
     */
    private int step(int i) {
      char c = input.charAt(i);
      if (Character.isUpperCase(c) && c <= 'Z') {
        return readElement(i);
      }
      if (ElementTable.AROMATIC_SYMBOLS.contains(c)) {
        addAtom(String.valueOf(Character.toUpperCase(c)));
        return i + 1;
      }
      switch (c) {
        case '=' -> setBondOrder(Bond.DOUBLE, i);
        case '#' -> setBondOrder(Bond.TRIPLE, i);
        case '(' -> branchStack.push(currentAtom);
        case ')' -> closeBranch(i);
        default -> {
          if (c >= '0' && c <= '9') {
            ringLabel(c, i);
          } else {
            warn(ParseWarningType.UNKNOWN_CHARACTER, i, String.valueOf(c));
          }
        }
      }
      return i + 1;
    }

    private int readElement(int i) {
      char c = input.charAt(i);
      if (i + 1 < input.length() && Character.isLowerCase(input.charAt(i + 1))) {
        String pair = input.substring(i, i + 2);
        if (ElementTable.isNotationSymbol(pair)) {
          addAtom(pair);
          return i + 2;
        }
      }
      String symbol = String.valueOf(c);
      if (!ElementTable.isNotationSymbol(symbol)) {
        warn(ParseWarningType.UNKNOWN_ELEMENT, i, symbol);
      }
      addAtom(ElementTable.resolveNotationSymbol(symbol));
      return i + 1;
    }

    private void addAtom(String element) {
      int index = graph.addAtom(element);
      if (currentAtom >= 0) {
        graph.addBond(currentAtom, index, takePendingOrder());
      }
      currentAtom = index;
    }

    /**
     * Sets the order of the most recently created bond. A symbol read before any bond exists is
     * kept for the first bond instead.
     */
    private void setBondOrder(int order, int position) {
      List<Bond> bonds = graph.getBonds();
      if (!bonds.isEmpty()) {
        bonds.get(bonds.size() - 1).setOrder(order);
        return;
      }
      pendingOrder = order;
      pendingOrderPosition = position;
    }

    private int takePendingOrder() {
      int order = pendingOrder == 0 ? Bond.SINGLE : pendingOrder;
      pendingOrder = 0;
      pendingOrderPosition = -1;
      return order;
    }

    private void closeBranch(int position) {
      if (branchStack.isEmpty()) {
        warn(ParseWarningType.UNMATCHED_BRANCH_CLOSE, position, ")");
        return;
      }
      currentAtom = branchStack.pop();
    }

    private void ringLabel(char label, int position) {
      if (currentAtom < 0) {
        warn(ParseWarningType.RING_LABEL_WITHOUT_ATOM, position, String.valueOf(label));
        return;
      }
      Integer opening = openRings.remove(label);
      if (opening == null) {
        openRings.put(label, currentAtom);
      } else if (opening == currentAtom) {
        warn(ParseWarningType.SELF_RING_CLOSURE, position, String.valueOf(label));
      } else {
        graph.addBond(opening, currentAtom, takePendingOrder());
      }
    }

    private void finish() {
      int end = input.length();
      openRings.keySet().forEach(label ->
          warn(ParseWarningType.UNCLOSED_RING, end, String.valueOf(label)));
      for (int i = 0; i < branchStack.size(); i++) {
        warn(ParseWarningType.UNCLOSED_BRANCH, end, "(");
      }
      if (pendingOrder != 0) {
        warn(ParseWarningType.DANGLING_BOND_SYMBOL, pendingOrderPosition,
            pendingOrder == Bond.TRIPLE ? "#" : "=");
      }
    }

    private void warn(ParseWarningType type, int position, String token) {
      warnings.add(new ParseWarning(type, position, token));
    }
  }
}
