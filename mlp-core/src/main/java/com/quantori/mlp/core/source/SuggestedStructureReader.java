package com.quantori.mlp.core.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantori.mlp.api.model.MoleculeGraph;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads a structure proposed by a text generating service. The reply is expected to hold a
 * {@link MoleculeGraph} JSON object, possibly wrapped in a Markdown code fence. Extra fields such as
 * colours or commentary are ignored.
 */
@Slf4j
public class SuggestedStructureReader {
  private static final String FENCE = "```";

  private final MoleculeGraphSerDe serDe;

  public SuggestedStructureReader() {
    this(new MoleculeGraphSerDe());
  }

  public SuggestedStructureReader(MoleculeGraphSerDe serDe) {
    this.serDe = serDe;
  }

  /**
   * Extracts a graph from a reply.
   *
   * @param reply raw reply text, may be null
   * @return sanitized graph, empty if the reply holds no well-formed structure
   */
  public Optional<MoleculeGraph> read(String reply) {
    String json = stripFence(reply);
    if (StringUtils.isBlank(json)) {
      return Optional.empty();
    }
    try {
      JsonNode node = serDe.readTree(json);
      if (!node.isObject() || !node.path("atoms").isArray() || !node.path("bonds").isArray()) {
        log.debug("Suggested structure has no atoms and bonds arrays");
        return Optional.empty();
      }
      return Optional.of(GraphSanitizer.sanitize(serDe.fromTree(node)));
    } catch (StructureFormatException e) {
      log.warn("Suggested structure could not be read: {}", e.getMessage());
      return Optional.empty();
    }
  }

  static String stripFence(String reply) {
    String text = StringUtils.trimToEmpty(reply);
    if (!text.startsWith(FENCE)) {
      return text;
    }
    // opening fence may carry a language tag, on its own line or not
    text = StringUtils.removeStartIgnoreCase(StringUtils.removeStart(text, FENCE), "json");
    return StringUtils.trim(StringUtils.removeEnd(StringUtils.trim(text), FENCE));
  }
}
