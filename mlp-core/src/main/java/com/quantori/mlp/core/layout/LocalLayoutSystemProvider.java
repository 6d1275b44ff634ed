package com.quantori.mlp.core.layout;

import akka.actor.typed.ActorSystem;
import com.quantori.mlp.api.layout.MoleculeLayoutPipeline;
import com.quantori.mlp.core.configuration.MoleculeLayoutConfiguration;
import com.quantori.mlp.core.source.StructureResolver;

public class LocalLayoutSystemProvider implements LayoutSystemProvider {

  @Override
  public ActorSystem<LayoutActor.Command> actorTypedSystem(MoleculeLayoutConfiguration configuration) {
    StructureResolver resolver = new StructureResolver(new MoleculeLayoutPipeline(configuration.getLayout()));
    return ActorSystem.create(
        LayoutActor.create(resolver, configuration.getWorker().getInlineAtomLimit()),
        getSystemNameOrDefault(configuration.getWorker().getSystemName()));
  }
}
