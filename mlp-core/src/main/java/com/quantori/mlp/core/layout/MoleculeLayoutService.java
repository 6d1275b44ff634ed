package com.quantori.mlp.core.layout;

import akka.actor.typed.ActorSystem;
import akka.actor.typed.javadsl.AskPattern;
import com.quantori.mlp.core.configuration.MoleculeLayoutConfiguration;
import com.quantori.mlp.core.source.StructureRequest;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import lombok.extern.slf4j.Slf4j;

/**
 * Asynchronous entry point to the layout actor.
 */
@Slf4j
public class MoleculeLayoutService implements AutoCloseable {
  private final ActorSystem<LayoutActor.Command> actorSystem;
  private final Duration askTimeout;

  public MoleculeLayoutService(MoleculeLayoutConfiguration configuration) {
    this(new LocalLayoutSystemProvider().actorTypedSystem(configuration), configuration.getWorker().getAskTimeout());
  }

  public MoleculeLayoutService(ActorSystem<LayoutActor.Command> actorSystem, Duration askTimeout) {
    this.actorSystem = actorSystem;
    this.askTimeout = askTimeout;
  }

  public CompletionStage<LayoutSnapshot> requestLayout(String notation) {
    return requestLayout(StructureRequest.of(notation));
  }

  /**
   * Lays out a structure. The stage fails with {@link LayoutSupersededException} if a newer request
   * was accepted before this one finished.
   *
   * @param request structure to lay out
   * @return the accepted snapshot
   */
  public CompletionStage<LayoutSnapshot> requestLayout(StructureRequest request) {
    log.debug("Requesting layout of '{}'", request.getNotation());
    return AskPattern.askWithStatus(
        actorSystem,
        replyTo -> new LayoutActor.RequestLayout(request, replyTo),
        askTimeout,
        actorSystem.scheduler());
  }

  public CompletionStage<Optional<LayoutSnapshot>> latestLayout() {
    return AskPattern.ask(
        actorSystem,
        LayoutActor.GetLatestLayout::new,
        askTimeout,
        actorSystem.scheduler());
  }

  @Override
  public void close() {
    actorSystem.terminate();
  }
}
