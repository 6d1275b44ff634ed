package com.quantori.mlp.core.layout;

import akka.actor.typed.ActorSystem;
import com.quantori.mlp.core.configuration.MoleculeLayoutConfiguration;
import org.apache.commons.lang3.StringUtils;

public interface LayoutSystemProvider {
  String MLP_AKKA_SYSTEM = "mlp-layout-system";

  ActorSystem<LayoutActor.Command> actorTypedSystem(MoleculeLayoutConfiguration configuration);

  default String getSystemNameOrDefault(String systemName) {
    if (StringUtils.isNotEmpty(systemName)) {
      return systemName;
    } else {
      return MLP_AKKA_SYSTEM;
    }
  }
}
