package com.quantori.mlp.core.layout;

import static org.awaitility.Awaitility.await;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.core.Is.is;

import akka.actor.typed.ActorSystem;
import com.quantori.mlp.core.configuration.MoleculeLayoutConfiguration;
import com.quantori.mlp.core.source.CoordinateSource;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import scala.concurrent.Await;

class MoleculeLayoutServiceTest {

  @Test
  void laysOutAndCachesLatestResult() {
    MoleculeLayoutConfiguration configuration = MoleculeLayoutConfiguration.load(
        ConfigFactory.parseString("mlp.worker.system-name = \"mlp-service-test\""));
    try (MoleculeLayoutService service = new MoleculeLayoutService(configuration)) {
      LayoutSnapshot snapshot = service.requestLayout("CCO").toCompletableFuture().join();

      assertThat(snapshot.graph().atomCount(), is(3));
      assertThat(snapshot.source(), is(CoordinateSource.COMPUTED));
      await().atMost(Duration.ofSeconds(5)).until(() ->
          service.latestLayout().toCompletableFuture().join().map(LayoutSnapshot::generation),
          is(Optional.of(snapshot.generation())));
    }
  }

  @Test
  void localSystemUsesConfiguredName() throws Exception {
    MoleculeLayoutConfiguration configuration = MoleculeLayoutConfiguration.load(
        ConfigFactory.parseString("mlp.worker.system-name = \"mlp-provider-test\""));

    ActorSystem<LayoutActor.Command> system = null;
    try {
      system = new LocalLayoutSystemProvider().actorTypedSystem(configuration);

      assertThat(system, is(notNullValue()));
      assertThat(system.name(), is("mlp-provider-test"));
      assertThat(system.uptime(), is(greaterThanOrEqualTo(0L)));
    } finally {
      Objects.requireNonNull(system).terminate();
      Await.result(system.whenTerminated(), scala.concurrent.duration.Duration.apply(5, TimeUnit.SECONDS));
    }
  }

  @Test
  void blankSystemNameFallsBackToDefault() {
    LayoutSystemProvider provider = new LocalLayoutSystemProvider();

    assertThat(provider.getSystemNameOrDefault(""), is(LayoutSystemProvider.MLP_AKKA_SYSTEM));
    assertThat(provider.getSystemNameOrDefault("viewer"), is("viewer"));
  }
}
