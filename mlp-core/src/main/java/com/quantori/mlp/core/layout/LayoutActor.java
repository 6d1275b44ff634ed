package com.quantori.mlp.core.layout;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.DispatcherSelector;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import akka.pattern.StatusReply;
import com.quantori.mlp.api.parser.ParseOutcome;
import com.quantori.mlp.core.source.ResolvedStructure;
import com.quantori.mlp.core.source.StructureRequest;
import com.quantori.mlp.core.source.StructureResolver;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Owns the current layout of a viewer.
 *
 * <p>Every request gets the next generation number. Small molecules are laid out while the message
 * is handled; larger ones on the blocking dispatcher, with the result piped back to the actor. A
 * result is cached only if no newer request arrived in the meantime, otherwise its requester gets
 * a {@link LayoutSupersededException}.
 */
public class LayoutActor extends AbstractBehavior<LayoutActor.Command> {

  private final StructureResolver resolver;
  private final int inlineAtomLimit;
  private final Executor blockingExecutor;
  private long generation;
  private LayoutSnapshot latest;

  private LayoutActor(ActorContext<Command> context, StructureResolver resolver, int inlineAtomLimit) {
    super(context);
    this.resolver = resolver;
    this.inlineAtomLimit = inlineAtomLimit;
    this.blockingExecutor = context.getSystem().dispatchers().lookup(DispatcherSelector.blocking());
  }

  public static Behavior<Command> create(StructureResolver resolver, int inlineAtomLimit) {
    return Behaviors.setup(ctx -> new LayoutActor(ctx, resolver, inlineAtomLimit));
  }

  @Override
  public Receive<Command> createReceive() {
    return newReceiveBuilder()
        .onMessage(RequestLayout.class, this::onRequestLayout)
        .onMessage(GetLatestLayout.class, this::onGetLatestLayout)
        .onMessage(LayoutFinished.class, this::onLayoutFinished)
        .build();
  }

  private Behavior<Command> onRequestLayout(RequestLayout cmd) {
    long requestGeneration = ++generation;
    StructureRequest request = cmd.request();
    Optional<ResolvedStructure> provided = resolver.selectProvided(request);
    if (provided.isPresent()) {
      accept(requestGeneration, request, provided.get(), cmd.replyTo());
      return this;
    }

    ParseOutcome outcome = resolver.parse(request.getNotation());
    int atomCount = outcome.graph().atomCount();
    if (atomCount <= inlineAtomLimit) {
      accept(requestGeneration, request, resolver.compute(outcome), cmd.replyTo());
      return this;
    }

    getContext().getLog().debug("Laying out {} atoms of generation {} in background", atomCount, requestGeneration);
    getContext().pipeToSelf(
        CompletableFuture.supplyAsync(() -> resolver.compute(outcome), blockingExecutor),
        (result, error) -> new LayoutFinished(requestGeneration, request, result, error, cmd.replyTo()));
    return this;
  }

  private Behavior<Command> onLayoutFinished(LayoutFinished cmd) {
    if (cmd.error() != null) {
      getContext().getLog().error("Layout of generation {} failed", cmd.generation(), cmd.error());
      cmd.replyTo().tell(StatusReply.error(cmd.error()));
      return this;
    }
    if (cmd.generation() != generation) {
      getContext().getLog().debug("Dropping layout of generation {}, current is {}", cmd.generation(), generation);
      cmd.replyTo().tell(StatusReply.error(new LayoutSupersededException(
          "Layout of generation " + cmd.generation() + " was superseded by generation " + generation)));
      return this;
    }
    accept(cmd.generation(), cmd.request(), cmd.result(), cmd.replyTo());
    return this;
  }

  private Behavior<Command> onGetLatestLayout(GetLatestLayout cmd) {
    cmd.replyTo().tell(Optional.ofNullable(latest));
    return this;
  }

  private void accept(long resultGeneration, StructureRequest request, ResolvedStructure structure,
                      ActorRef<StatusReply<LayoutSnapshot>> replyTo) {
    latest = LayoutSnapshot.of(resultGeneration, request.getNotation(), structure);
    replyTo.tell(StatusReply.success(latest));
  }

  public interface Command {
  }

  public record RequestLayout(StructureRequest request, ActorRef<StatusReply<LayoutSnapshot>> replyTo)
      implements Command {
  }

  public record GetLatestLayout(ActorRef<Optional<LayoutSnapshot>> replyTo) implements Command {
  }

  private record LayoutFinished(long generation, StructureRequest request, ResolvedStructure result,
                                Throwable error, ActorRef<StatusReply<LayoutSnapshot>> replyTo)
      implements Command {
  }
}
