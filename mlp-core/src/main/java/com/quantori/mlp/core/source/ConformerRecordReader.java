package com.quantori.mlp.core.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantori.mlp.api.model.Atom;
import com.quantori.mlp.api.model.Bond;
import com.quantori.mlp.api.model.ElementTable;
import com.quantori.mlp.api.model.MoleculeGraph;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the first 3D conformer of a PubChem style compound record.
 *
 * <p>The record lists atoms as parallel arrays of ids ({@code atoms.aid}) and atomic numbers
 * ({@code atoms.element}), coordinates as {@code coords[].conformers[].x/y/z} and bonds as
 * {@code bonds.aid1/aid2/order}. A full {@code PC_Compounds} response is accepted too, its first
 * compound is read.
 */
@Slf4j
public class ConformerRecordReader {

  private final MoleculeGraphSerDe serDe;

  public ConformerRecordReader() {
    this(new MoleculeGraphSerDe());
  }

  public ConformerRecordReader(MoleculeGraphSerDe serDe) {
    this.serDe = serDe;
  }

  /**
   * Reads a record document.
   *
   * @param json record or {@code PC_Compounds} response
   * @return the conformer graph, empty if the document has no usable 3D conformer
   */
  public Optional<MoleculeGraph> read(String json) {
    try {
      return read(serDe.readTree(json));
    } catch (StructureFormatException e) {
      log.warn("Compound record could not be read: {}", e.getMessage());
      return Optional.empty();
    }
  }

  public Optional<MoleculeGraph> read(JsonNode document) {
    JsonNode record = document;
    if (document.path("PC_Compounds").isArray()) {
      record = document.path("PC_Compounds").path(0);
    }
    JsonNode ids = record.path("atoms").path("aid");
    JsonNode elements = record.path("atoms").path("element");
    if (!ids.isArray() || !elements.isArray() || ids.isEmpty() || elements.size() != ids.size()) {
      log.debug("Compound record has no atom list");
      return Optional.empty();
    }

    JsonNode conformer = findConformer(record.path("coords"));
    if (conformer == null) {
      log.debug("Compound record has no 3D conformer");
      return Optional.empty();
    }
    JsonNode xs = conformer.path("x");
    JsonNode ys = conformer.path("y");
    JsonNode zs = conformer.path("z");
    if (xs.size() != ids.size() || ys.size() != ids.size() || zs.size() != ids.size()) {
      log.debug("Conformer coordinates do not match the atom list");
      return Optional.empty();
    }

    MoleculeGraph graph = MoleculeGraph.empty();
    Map<Integer, Integer> indexById = new HashMap<>();
    for (int i = 0; i < ids.size(); i++) {
      indexById.put(ids.get(i).asInt(), i);
      graph.getAtoms().add(new Atom(
          ElementTable.symbolOfAtomicNumber(elements.get(i).asInt()),
          xs.get(i).asDouble(),
          ys.get(i).asDouble(),
          zs.get(i).asDouble()));
    }

    JsonNode bonds = record.path("bonds");
    JsonNode firstIds = bonds.path("aid1");
    JsonNode secondIds = bonds.path("aid2");
    JsonNode orders = bonds.path("order");
    for (int i = 0; i < firstIds.size(); i++) {
      Integer from = indexById.get(firstIds.get(i).asInt());
      Integer to = indexById.get(secondIds.path(i).asInt(-1));
      if (from == null || to == null) {
        continue;
      }
      graph.addBond(from, to, orders.path(i).asInt(Bond.SINGLE));
    }
    return Optional.of(GraphSanitizer.sanitize(graph));
  }

  private static JsonNode findConformer(JsonNode coords) {
    for (JsonNode entry : coords) {
      JsonNode conformer = entry.path("conformers").path(0);
      if (conformer.path("x").isArray() && conformer.path("y").isArray() && conformer.path("z").isArray()) {
        return conformer;
      }
    }
    return null;
  }
}
