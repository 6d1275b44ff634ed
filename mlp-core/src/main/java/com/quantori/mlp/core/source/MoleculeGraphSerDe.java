package com.quantori.mlp.core.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantori.mlp.api.model.MoleculeGraph;

/**
 * JSON form of {@link MoleculeGraph} shared with viewers and exporters:
 * {@code {"atoms":[{"element","x","y","z"}],"bonds":[{"from","to","order"}]}}. Unknown fields are
 * ignored when reading.
 */
public class MoleculeGraphSerDe {
  private static final ObjectMapper objectMapper = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public String serialize(MoleculeGraph graph) {
    try {
      return objectMapper.writeValueAsString(graph);
    } catch (JsonProcessingException e) {
      throw new StructureFormatException("Unable to write molecule graph", e);
    }
  }

  public MoleculeGraph deserialize(String json) {
    return fromTree(readTree(json));
  }

  public JsonNode readTree(String json) {
    if (json == null) {
      throw new StructureFormatException("Structure document is missing");
    }
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new StructureFormatException("Structure document is not valid JSON", e);
    }
  }

  public MoleculeGraph fromTree(JsonNode node) {
    try {
      return objectMapper.treeToValue(node, MoleculeGraph.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new StructureFormatException("Structure document is not a molecule graph", e);
    }
  }
}
