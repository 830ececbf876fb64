package io.roomswarm.clustering.orchestrator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import org.junit.jupiter.api.Test;

import io.roomswarm.api.config.Batch;
import io.roomswarm.api.config.BatchBuilder;
import io.roomswarm.api.session.ParticipantState;
import io.roomswarm.clustering.orchestrator.ParticipantOutcome.Outcome;
import io.roomswarm.core.VertxBaseTest;
import io.vertx.junit5.VertxTestContext;

public class OrchestratorTest extends VertxBaseTest {
   private final List<StubWorkerClient> workers = new ArrayList<>();

   private BatchBuilder batch(int workerCount) {
      BatchBuilder builder = BatchBuilder.builder()
            .sessionUrl("https://meet.example.com/standup")
            .runMillis(0)
            .timeoutMillis(5000)
            .dispatchRetries(2)
            .dispatchBackoffMillis(10);
      for (int i = 0; i < workerCount; ++i) {
         builder.addWorker("http://worker-" + i + ":8080");
      }
      return builder;
   }

   private Orchestrator orchestrator(Batch batch, Consumer<StubWorkerClient> setup) {
      Orchestrator orchestrator = new Orchestrator(vertx, batch, ref -> {
         StubWorkerClient client = new StubWorkerClient(ref);
         setup.accept(client);
         workers.add(client);
         return client;
      }, 20);
      cleanup.add(orchestrator::close);
      return orchestrator;
   }

   private static ParticipantOutcome outcome(BatchSummary summary, String username) {
      return summary.outcomes().stream().filter(o -> o.username().equals(username)).findFirst().orElseThrow();
   }

   @Test
   public void testAllParticipantsJoin(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      Batch batch = batch(2).addParticipant("alice").addParticipant("bob").addParticipant("carol").build();
      orchestrator(batch, client -> {}).run().onComplete(ctx.succeeding(summary -> {
         ctx.verify(() -> {
            assertThat(summary.count(Outcome.JOINED)).isEqualTo(3);
            assertThat(summary.cancelled()).isFalse();
            assertThat(outcome(summary, "alice").worker()).isEqualTo("http://worker-0:8080");
            assertThat(outcome(summary, "bob").worker()).isEqualTo("http://worker-1:8080");
            assertThat(outcome(summary, "carol").worker()).isEqualTo("http://worker-0:8080");
            assertThat(workers.get(0).spawned).containsExactlyInAnyOrder("alice", "carol");
            assertThat(workers.get(1).spawned).containsExactly("bob");
            // no hold time: participants stay in the session
            assertThat(workers).allMatch(w -> w.deleted.isEmpty());
         });
         checkpoint.flag();
      }));
   }

   @Test
   public void testUnreachableWorkerIsRetried(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      Batch batch = batch(1).addParticipant("alice").build();
      orchestrator(batch, client -> client.unreachableSpawns = 1).run().onComplete(ctx.succeeding(summary -> {
         ctx.verify(() -> {
            ParticipantOutcome alice = outcome(summary, "alice");
            assertThat(alice.outcome()).isEqualTo(Outcome.JOINED);
            assertThat(alice.attempts()).isEqualTo(2);
         });
         checkpoint.flag();
      }));
   }

   @Test
   public void testRetryAfterLostResponseReusesParticipant(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      Batch batch = batch(1).runMillis(100).addParticipant("alice").build();
      orchestrator(batch, client -> client.lostResponses = 1).run().onComplete(ctx.succeeding(summary -> {
         ctx.verify(() -> {
            StubWorkerClient worker = workers.get(0);
            ParticipantOutcome alice = outcome(summary, "alice");
            assertThat(alice.outcome()).isEqualTo(Outcome.JOINED);
            assertThat(alice.attempts()).isEqualTo(2);
            // both attempts carried the same key, so only one participant exists and it is closed after the hold
            assertThat(worker.dispatchKeys).hasSize(2).doesNotContainNull();
            assertThat(worker.dispatchKeys.get(0)).isEqualTo(worker.dispatchKeys.get(1));
            assertThat(worker.spawned).containsExactly("alice");
            assertThat(worker.deleted).containsExactly(alice.participantId());
         });
         checkpoint.flag();
      }));
   }

   @Test
   public void testDispatchKeysDifferPerParticipant(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      Batch batch = batch(1).addParticipant("alice").addParticipant("bob").build();
      orchestrator(batch, client -> {}).run().onComplete(ctx.succeeding(summary -> {
         ctx.verify(() -> {
            assertThat(workers.get(0).dispatchKeys).hasSize(2).doesNotHaveDuplicates();
            assertThat(workers.get(0).spawned).containsExactlyInAnyOrder("alice", "bob");
         });
         checkpoint.flag();
      }));
   }

   @Test
   public void testRetriesExhausted(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      Batch batch = batch(1).addParticipant("alice").build();
      orchestrator(batch, client -> client.unreachableSpawns = 100).run().onComplete(ctx.succeeding(summary -> {
         ctx.verify(() -> {
            ParticipantOutcome alice = outcome(summary, "alice");
            assertThat(alice.outcome()).isEqualTo(Outcome.FAILED);
            assertThat(alice.attempts()).isEqualTo(3);
            assertThat(alice.participantId()).isNull();
            assertThat(alice.reason()).contains("after 3 attempt(s)").contains("Cannot reach");
         });
         checkpoint.flag();
      }));
   }

   @Test
   public void testJoinDelayBeyondTimeout(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      BatchBuilder builder = batch(1).timeoutMillis(500).addParticipant("alice");
      builder.addParticipant().username("late").waitToJoinMillis(500);
      orchestrator(builder.build(), client -> {}).run().onComplete(ctx.succeeding(summary -> {
         ctx.verify(() -> {
            assertThat(outcome(summary, "alice").outcome()).isEqualTo(Outcome.JOINED);
            ParticipantOutcome late = outcome(summary, "late");
            assertThat(late.outcome()).isEqualTo(Outcome.TIMED_OUT);
            assertThat(late.attempts()).isZero();
            assertThat(workers.get(0).spawned).containsExactly("alice");
         });
         checkpoint.flag();
      }));
   }

   @Test
   public void testFailedParticipant(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      Batch batch = batch(1).addParticipant("alice").addParticipant("bob").build();
      orchestrator(batch, client -> {
         client.states = identity -> identity.username().equals("bob") ? ParticipantState.FAILED : ParticipantState.ACTIVE;
         client.failureReason = "Session rejected the credential";
      }).run().onComplete(ctx.succeeding(summary -> {
         ctx.verify(() -> {
            assertThat(outcome(summary, "alice").outcome()).isEqualTo(Outcome.JOINED);
            ParticipantOutcome bob = outcome(summary, "bob");
            assertThat(bob.outcome()).isEqualTo(Outcome.FAILED);
            assertThat(bob.reason()).isEqualTo("Session rejected the credential");
            // already terminal on the worker
            assertThat(workers.get(0).deleted).isEmpty();
         });
         checkpoint.flag();
      }));
   }

   @Test
   public void testBatchTimeout(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      Batch batch = batch(1).timeoutMillis(300).addParticipant("alice").addParticipant("bob").build();
      orchestrator(batch, client -> client.states = identity ->
            identity.username().equals("bob") ? ParticipantState.AUTHENTICATED : ParticipantState.ACTIVE)
            .run().onComplete(ctx.succeeding(summary -> {
               ctx.verify(() -> {
                  assertThat(outcome(summary, "alice").outcome()).isEqualTo(Outcome.JOINED);
                  ParticipantOutcome bob = outcome(summary, "bob");
                  assertThat(bob.outcome()).isEqualTo(Outcome.TIMED_OUT);
                  assertThat(bob.reason()).contains("300 ms");
                  assertThat(workers.get(0).deleted).containsExactly(bob.participantId());
                  assertThat(summary.finishedAt() - summary.startedAt()).isGreaterThanOrEqualTo(300);
               });
               checkpoint.flag();
            }));
   }

   @Test
   public void testHoldTime(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      Batch batch = batch(2).runMillis(200).addParticipant("alice").addParticipant("bob").build();
      orchestrator(batch, client -> {}).run().onComplete(ctx.succeeding(summary -> {
         ctx.verify(() -> {
            assertThat(summary.count(Outcome.JOINED)).isEqualTo(2);
            assertThat(summary.finishedAt() - summary.startedAt()).isGreaterThanOrEqualTo(200);
            assertThat(workers.get(0).deleted).containsExactly(outcome(summary, "alice").participantId());
            assertThat(workers.get(1).deleted).containsExactly(outcome(summary, "bob").participantId());
         });
         checkpoint.flag();
      }));
   }

   @Test
   public void testCancel(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      BatchBuilder builder = batch(1).timeoutMillis(10_000).addParticipant("alice");
      builder.addParticipant().username("bob").waitToJoinMillis(5_000);
      Orchestrator orchestrator = orchestrator(builder.build(), client -> client.states = identity -> ParticipantState.AUTHENTICATED);
      orchestrator.run();
      vertx.setTimer(200, id -> orchestrator.cancel().onComplete(ctx.succeeding(summary -> {
         ctx.verify(() -> {
            assertThat(summary.cancelled()).isTrue();
            assertThat(summary.count(Outcome.FAILED)).isEqualTo(2);
            assertThat(outcome(summary, "alice").reason()).isEqualTo("Batch cancelled");
            // bob was never dispatched
            assertThat(outcome(summary, "bob").participantId()).isNull();
            assertThat(workers.get(0).spawned).containsExactly("alice");
            assertThat(workers.get(0).deleted).containsExactly(outcome(summary, "alice").participantId());
         });
         checkpoint.flag();
      })));
   }

   @Test
   public void testRunTwice(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      Orchestrator orchestrator = orchestrator(batch(1).addParticipant("alice").build(), client -> {});
      orchestrator.run().onComplete(ctx.succeeding(summary -> {
         ctx.verify(() -> {
            assertThatThrownBy(orchestrator::run).isInstanceOf(IllegalStateException.class);
            orchestrator.close();
            assertThat(workers.get(0).closed).isTrue();
         });
         checkpoint.flag();
      }));
   }
}
