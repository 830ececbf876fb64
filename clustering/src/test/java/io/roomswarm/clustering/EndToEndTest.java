package io.roomswarm.clustering;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.roomswarm.api.config.Batch;
import io.roomswarm.api.config.BatchBuilder;
import io.roomswarm.clustering.client.RestWorkerClient;
import io.roomswarm.clustering.orchestrator.Orchestrator;
import io.roomswarm.clustering.orchestrator.ParticipantOutcome;
import io.roomswarm.core.VertxBaseTest;
import io.roomswarm.core.credentials.GuestLoginFlow;
import io.roomswarm.core.credentials.SessionCredentialStore;
import io.roomswarm.core.driver.DefaultDriverFactory;
import io.roomswarm.core.session.ParticipantFactory;
import io.roomswarm.core.session.ParticipantTimeouts;
import io.roomswarm.core.test.FakeSessionBackend;
import io.roomswarm.internal.Properties;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxTestContext;

/**
 * Orchestrator driving two workers over REST, participants joining the in-process backend with the protocol strategy.
 */
public class EndToEndTest extends VertxBaseTest {
   private FakeSessionBackend backend;
   private final List<GatewayVerticle> workers = new ArrayList<>();

   @BeforeEach
   public void setup(VertxTestContext ctx) {
      Codecs.register(vertx);
      WebClient client = WebClient.create(vertx);
      cleanup.add(client::close);
      backend = new FakeSessionBackend(vertx);
      backend.start()
            .compose(nil -> deployWorker(client))
            .compose(nil -> deployWorker(client))
            .onComplete(ctx.succeedingThenComplete());
   }

   private Future<String> deployWorker(WebClient client) {
      ParticipantFactory factory = new ParticipantFactory(vertx, new DefaultDriverFactory(vertx, null, 5000),
            origin -> new SessionCredentialStore(vertx, new GuestLoginFlow(client, origin), null),
            ParticipantTimeouts.uniform(5000, 2000));
      GatewayVerticle worker = new GatewayVerticle(factory);
      workers.add(worker);
      return vertx.deployVerticle(worker, new DeploymentOptions().setConfig(new JsonObject()
            .put(Properties.GATEWAY_HOST, "localhost").put(Properties.GATEWAY_PORT, 0)));
   }

   @Test
   public void testBatchJoinsAndLeaves(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      BatchBuilder builder = BatchBuilder.builder()
            .sessionUrl(backend.sessionUrl("standup"))
            .runMillis(300)
            .timeoutMillis(10_000);
      workers.forEach(worker -> builder.addWorker("http://localhost:" + worker.actualPort()));
      builder.addParticipant("alice").addParticipant("bob");
      builder.addParticipant().username("carol").waitToJoinMillis(100).media(m -> m.video(false));
      Batch batch = builder.build();

      Orchestrator orchestrator = new Orchestrator(vertx, batch, ref -> new RestWorkerClient(vertx, ref), 50);
      cleanup.add(orchestrator::close);
      orchestrator.run().onComplete(ctx.succeeding(summary -> {
         ctx.verify(() -> {
            assertThat(summary.count(ParticipantOutcome.Outcome.JOINED)).isEqualTo(3);
            assertThat(backend.logins()).isEqualTo(3);
            assertThat(backend.frames()).contains("alice:join", "bob:join", "carol:join");
            assertThat(workers.get(0).registry().list()).hasSize(2);
            assertThat(workers.get(1).registry().list()).hasSize(1);
         });
         checkpoint.flag();
      }));
   }

   @Test
   public void testParticipantsLeaveWhenHoldEnds(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      Batch batch = BatchBuilder.builder()
            .sessionUrl(backend.sessionUrl("standup"))
            .addWorker("http://localhost:" + workers.get(0).actualPort())
            .runMillis(200)
            .timeoutMillis(10_000)
            .addParticipant("alice")
            .build();
      Orchestrator orchestrator = new Orchestrator(vertx, batch, ref -> new RestWorkerClient(vertx, ref), 50);
      cleanup.add(orchestrator::close);
      orchestrator.run().onComplete(ctx.succeeding(summary -> {
         ctx.verify(() -> {
            assertThat(summary.count(ParticipantOutcome.Outcome.JOINED)).isEqualTo(1);
            assertThat(backend.members()).isEmpty();
            assertThat(backend.frames()).contains("alice:leave");
         });
         checkpoint.flag();
      }));
   }
}
