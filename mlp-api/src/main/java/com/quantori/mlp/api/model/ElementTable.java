package com.quantori.mlp.api.model;

import java.util.Map;
import java.util.Set;
import lombok.experimental.UtilityClass;

/**
 * Element symbols understood by the pipeline.
 */
@UtilityClass
public final class ElementTable {

  public static final String CARBON = "C";

  /** Symbols the line-notation parser recognises. Anything else is drawn as carbon. */
  public static final Set<String> NOTATION_SYMBOLS =
      Set.of("C", "N", "O", "S", "P", "F", "Cl", "Br", "I", "H");

  /** Lower-case aromatic atoms and the element each one folds to. */
  public static final Set<Character> AROMATIC_SYMBOLS = Set.of('c', 'n', 'o', 'p', 's');

  private static final String[] SYMBOLS_BY_ATOMIC_NUMBER = {
      null,
      "H", "He",
      "Li", "Be", "B", "C", "N", "O", "F", "Ne",
      "Na", "Mg", "Al", "Si", "P", "S", "Cl", "Ar",
      "K", "Ca", "Sc", "Ti", "V", "Cr", "Mn", "Fe", "Co", "Ni", "Cu", "Zn",
      "Ga", "Ge", "As", "Se", "Br", "Kr"
  };

  private static final Map<Integer, String> HEAVY_SYMBOLS = Map.of(53, "I");

  public static boolean isNotationSymbol(String symbol) {
    return NOTATION_SYMBOLS.contains(symbol);
  }

  /**
   * Maps a parsed symbol to the element stored in the graph.
   *
   * @param symbol symbol as read from the notation, already case folded
   * @return the symbol itself if known, otherwise carbon
   */
  public static String resolveNotationSymbol(String symbol) {
    return isNotationSymbol(symbol) ? symbol : CARBON;
  }

  /**
   * Maps an atomic number, as used by conformer records, to an element symbol.
   *
   * @param atomicNumber atomic number
   * @return element symbol, carbon for numbers outside the table
   */
  public static String symbolOfAtomicNumber(int atomicNumber) {
    if (atomicNumber > 0 && atomicNumber < SYMBOLS_BY_ATOMIC_NUMBER.length) {
      return SYMBOLS_BY_ATOMIC_NUMBER[atomicNumber];
    }
    return HEAVY_SYMBOLS.getOrDefault(atomicNumber, CARBON);
  }
}
