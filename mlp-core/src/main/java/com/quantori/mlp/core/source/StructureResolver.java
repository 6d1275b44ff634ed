package com.quantori.mlp.core.source;

import com.quantori.mlp.api.layout.MoleculeLayoutPipeline;
import com.quantori.mlp.api.model.MoleculeGraph;
import com.quantori.mlp.api.parser.ParseOutcome;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Chooses the coordinates to show for a request. A well-formed AI suggestion wins, then a supplied
 * conformer, and only when neither is usable the notation is laid out locally. The chosen graph is
 * always normalized, so every source is viewed at the same scale.
 */
@Slf4j
public class StructureResolver {

  private final MoleculeLayoutPipeline pipeline;

  public StructureResolver(MoleculeLayoutPipeline pipeline) {
    this.pipeline = pipeline;
  }

  public ResolvedStructure resolve(StructureRequest request) {
    return selectProvided(request).orElseGet(() -> compute(parse(request.getNotation())));
  }

  /**
   * Picks a structure that needs no local layout.
   *
   * @param request structure request
   * @return a normalized copy of the preferred provided graph, empty if none is displayable
   */
  public Optional<ResolvedStructure> selectProvided(StructureRequest request) {
    if (GraphSanitizer.isDisplayable(request.getSuggestedGraph())) {
      return Optional.of(provided(CoordinateSource.AI_SUGGESTED, request.getSuggestedGraph(), request));
    }
    if (GraphSanitizer.isDisplayable(request.getSuppliedGraph())) {
      return Optional.of(provided(CoordinateSource.EXTERNALLY_SUPPLIED, request.getSuppliedGraph(), request));
    }
    return Optional.empty();
  }

  public ParseOutcome parse(String notation) {
    return pipeline.getParser().parseWithWarnings(notation);
  }

  public ResolvedStructure compute(ParseOutcome outcome) {
    MoleculeGraph graph = pipeline.embedAndNormalize(outcome.graph());
    return new ResolvedStructure(CoordinateSource.COMPUTED, graph, outcome.warnings());
  }

  private ResolvedStructure provided(CoordinateSource source, MoleculeGraph graph, StructureRequest request) {
    log.debug("Using {} coordinates for '{}'", source.getValue(), request.getNotation());
    return ResolvedStructure.provided(source, pipeline.normalize(graph.copy()));
  }
}
