package com.quantori.mlp.api.layout;

import com.quantori.mlp.api.model.MoleculeGraph;
import com.quantori.mlp.api.parser.LineNotationParser;
import com.quantori.mlp.api.parser.ParseOutcome;
import com.quantori.mlp.api.parser.StructureParser;
import lombok.extern.slf4j.Slf4j;

/**
 * Parse, embed and normalize in one call. The result is ready for
 * {@link com.quantori.mlp.api.render.PerspectiveProjector}.
 */
@Slf4j
public class MoleculeLayoutPipeline {

  private final StructureParser parser;
  private final MoleculeEmbedder embedder;
  private final GraphNormalizer normalizer;

  public MoleculeLayoutPipeline() {
    this(LayoutSettings.DEFAULT);
  }

  public MoleculeLayoutPipeline(LayoutSettings settings) {
    this(new LineNotationParser(), new ForceDirectedEmbedder(settings), new GraphNormalizer(settings));
  }

  public MoleculeLayoutPipeline(StructureParser parser, MoleculeEmbedder embedder, GraphNormalizer normalizer) {
    this.parser = parser;
    this.embedder = embedder;
    this.normalizer = normalizer;
  }

  public StructureParser getParser() {
    return parser;
  }

  /**
   * Lays out a notation from scratch.
   *
   * @param notation line notation
   * @return normalized graph, empty if the notation holds no atoms
   */
  public MoleculeGraph layout(String notation) {
    return layout(parser.parseWithWarnings(notation));
  }

  public MoleculeGraph layout(ParseOutcome outcome) {
    return embedAndNormalize(outcome.graph());
  }

  /**
   * Embeds and normalizes a graph in place.
   *
   * @param graph graph with valid bonds
   * @return the same graph instance
   */
  public MoleculeGraph embedAndNormalize(MoleculeGraph graph) {
    long started = System.nanoTime();
    embedder.embed(graph);
    normalizer.normalize(graph);
    log.debug("Laid out {} atoms and {} bonds in {} ms",
        graph.atomCount(), graph.bondCount(), (System.nanoTime() - started) / 1_000_000);
    return graph;
  }

  public MoleculeGraph normalize(MoleculeGraph graph) {
    return normalizer.normalize(graph);
  }
}
