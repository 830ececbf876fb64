package io.roomswarm.core.session;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import io.roomswarm.api.CredentialException;
import io.roomswarm.api.ErrorKind;
import io.roomswarm.api.InvalidStateException;
import io.roomswarm.api.ParticipantClosedException;
import io.roomswarm.api.UnreachableException;
import io.roomswarm.api.config.MediaSettings;
import io.roomswarm.api.config.ParticipantIdentity;
import io.roomswarm.api.config.StrategyKind;
import io.roomswarm.api.config.WebcamResolution;
import io.roomswarm.api.credentials.Credential;
import io.roomswarm.api.credentials.LoginFlow;
import io.roomswarm.api.session.Ack;
import io.roomswarm.api.session.Command;
import io.roomswarm.api.session.CommandKind;
import io.roomswarm.api.session.ErrorEvent;
import io.roomswarm.api.session.ParticipantEvent;
import io.roomswarm.api.session.ParticipantSnapshot;
import io.roomswarm.api.session.ParticipantState;
import io.roomswarm.api.session.StateChangedEvent;
import io.roomswarm.core.VertxBaseTest;
import io.roomswarm.core.credentials.SessionCredentialStore;
import io.roomswarm.core.test.ScriptedDriver;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.junit5.VertxTestContext;

public class ParticipantActorTest extends VertxBaseTest {
   private static final ParticipantIdentity ALICE = new ParticipantIdentity("alice", "https://meet.example.com/standup",
         MediaSettings.builder().video(false).build(), StrategyKind.PROTOCOL);

   private final AtomicInteger logins = new AtomicInteger();
   private final List<ParticipantEvent> events = new CopyOnWriteArrayList<>();

   private ParticipantActor actor(ScriptedDriver driver, long closeGrace) {
      return actor(driver, closeGrace, username -> Future.succeededFuture(
            new Credential(username, "token-" + logins.incrementAndGet(), Long.MAX_VALUE, true)));
   }

   private ParticipantActor actor(ScriptedDriver driver, long closeGrace, LoginFlow loginFlow) {
      SessionCredentialStore store = new SessionCredentialStore(vertx, loginFlow, null);
      ParticipantActor actor = new ParticipantActor("p-1", ALICE, vertx, vertx.getOrCreateContext(), driver, store,
            ParticipantTimeouts.uniform(2000, closeGrace));
      actor.subscribe(events::add);
      return actor;
   }

   private static Future<Void> awaitState(ParticipantActor actor, ParticipantState state) {
      Promise<Void> promise = Promise.promise();
      actor.subscribe(event -> {
         if (event instanceof StateChangedEvent && ((StateChangedEvent) event).to() == state) {
            promise.tryComplete();
         }
      });
      if (actor.state() == state) {
         promise.tryComplete();
      }
      return promise.future();
   }

   private List<String> transitions() {
      return events.stream().filter(StateChangedEvent.class::isInstance).map(StateChangedEvent.class::cast)
            .map(e -> e.from() + "->" + e.to()).collect(Collectors.toList());
   }

   @Test
   public void testLifecycle(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      ScriptedDriver driver = new ScriptedDriver();
      ParticipantActor actor = actor(driver, 1000);
      awaitState(actor, ParticipantState.ACTIVE).onComplete(ctx.succeeding(nil -> {
         ctx.verify(() -> {
            assertThat(transitions()).containsExactly("SPAWNED->AUTHENTICATED", "AUTHENTICATED->JOINED", "JOINED->ACTIVE");
            assertThat(driver.calls()).containsExactly("authenticate", "join", "startMedia");
            ParticipantSnapshot snapshot = actor.snapshot();
            assertThat(snapshot.state()).isEqualTo(ParticipantState.ACTIVE);
            assertThat(snapshot.media().audio()).isTrue();
            assertThat(snapshot.media().video()).isFalse();
         });
         checkpoint.flag();
      }));
      actor.start();
   }

   @Test
   public void testMediaCommandBeforeJoinIsRejected(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      Promise<Void> join = Promise.promise();
      ScriptedDriver driver = new ScriptedDriver().on("join", join::future);
      ParticipantActor actor = actor(driver, 1000);
      awaitState(actor, ParticipantState.AUTHENTICATED)
            .compose(nil -> actor.send(Command.of(CommandKind.TOGGLE_AUDIO)))
            .onComplete(ctx.failing(cause -> {
               ctx.verify(() -> {
                  assertThat(cause).isInstanceOf(InvalidStateException.class);
                  assertThat(ErrorKind.of(cause)).isEqualTo(ErrorKind.INVALID_STATE);
               });
               join.complete();
               checkpoint.flag();
            }));
      actor.start();
   }

   @Test
   public void testCommandsApplyInOrder(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      ScriptedDriver driver = new ScriptedDriver();
      ParticipantActor actor = actor(driver, 1000);
      awaitState(actor, ParticipantState.ACTIVE).compose(nil -> {
         Future<Ack> audio = actor.send(Command.of(CommandKind.TOGGLE_AUDIO));
         Future<Ack> video = actor.send(Command.of(CommandKind.TOGGLE_VIDEO));
         Future<Ack> resolution = actor.send(new Command(CommandKind.SET_RESOLUTION, "720p"));
         return audio.compose(a -> video).compose(v -> resolution);
      }).onComplete(ctx.succeeding(ack -> {
         ctx.verify(() -> {
            assertThat(ack).isEqualTo(Ack.APPLIED);
            assertThat(driver.calls()).containsExactly("authenticate", "join", "startMedia",
                  "toggle-audio=false", "toggle", "toggle-video=true", "toggle", "resolution=720p", "setResolution");
            assertThat(actor.snapshot().media().audio()).isFalse();
            assertThat(actor.snapshot().media().video()).isTrue();
            assertThat(actor.snapshot().media().resolution()).isEqualTo(WebcamResolution.P720);
         });
         checkpoint.flag();
      }));
      actor.start();
   }

   @Test
   public void testUnsupportedAndInvalidCommands(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      ScriptedDriver driver = new ScriptedDriver().unsupported(CommandKind.TOGGLE_BLUR);
      ParticipantActor actor = actor(driver, 1000);
      awaitState(actor, ParticipantState.ACTIVE)
            .compose(nil -> actor.send(Command.of(CommandKind.TOGGLE_BLUR)))
            .compose(ack -> {
               ctx.verify(() -> assertThat(ack).isEqualTo(Ack.NO_OP));
               return actor.send(new Command(CommandKind.SET_NOISE_SUPPRESSION, "very-loud"));
            })
            .onComplete(ctx.failing(cause -> {
               ctx.verify(() -> {
                  assertThat(ErrorKind.of(cause)).isEqualTo(ErrorKind.VALIDATION);
                  assertThat(actor.state()).isEqualTo(ParticipantState.ACTIVE);
                  assertThat(driver.calls()).doesNotContain("toggle", "setNoiseSuppression");
               });
               checkpoint.flag();
            }));
      actor.start();
   }

   @Test
   public void testFailedCommandKeepsParticipant(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      ScriptedDriver driver = new ScriptedDriver().on("toggle", () -> Future.failedFuture(new RuntimeException("button missing")));
      ParticipantActor actor = actor(driver, 1000);
      awaitState(actor, ParticipantState.ACTIVE)
            .compose(nil -> actor.send(Command.of(CommandKind.TOGGLE_SCREENSHARE)))
            .onComplete(ctx.failing(cause -> {
               ctx.verify(() -> {
                  assertThat(actor.state()).isEqualTo(ParticipantState.ACTIVE);
                  assertThat(actor.snapshot().media().screenshare()).isFalse();
                  assertThat(events).anyMatch(e -> e instanceof ErrorEvent && ((ErrorEvent) e).message().contains("button missing"));
               });
               checkpoint.flag();
            }));
      actor.start();
   }

   @Test
   public void testCloseIsIdempotent(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      Promise<Void> leave = Promise.promise();
      ScriptedDriver driver = new ScriptedDriver().on("leave", leave::future);
      ParticipantActor actor = actor(driver, 1000);
      awaitState(actor, ParticipantState.ACTIVE).compose(nil -> {
         Future<Ack> first = actor.close();
         // the second close arrives while the first one is still leaving
         Future<Ack> second = actor.close();
         vertx.setTimer(50, id -> leave.complete());
         return first.compose(a1 -> second.map(a2 -> {
            ctx.verify(() -> {
               assertThat(a1).isEqualTo(Ack.APPLIED);
               assertThat(a2).isEqualTo(Ack.APPLIED);
            });
            return null;
         }));
      }).compose(nil -> actor.close()).compose(ack -> {
         ctx.verify(() -> {
            assertThat(ack).isEqualTo(Ack.NO_OP);
            assertThat(actor.state()).isEqualTo(ParticipantState.CLOSED);
            assertThat(driver.calls()).containsExactly("authenticate", "join", "startMedia", "leave", "release");
            assertThat(transitions()).hasSize(4).last().isEqualTo("ACTIVE->CLOSED");
         });
         return actor.send(Command.of(CommandKind.TOGGLE_AUDIO));
      }).onComplete(ctx.failing(cause -> {
         ctx.verify(() -> assertThat(cause).isInstanceOf(ParticipantClosedException.class));
         checkpoint.flag();
      }));
      actor.start();
   }

   @Test
   public void testLeaveCommand(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      ScriptedDriver driver = new ScriptedDriver();
      ParticipantActor actor = actor(driver, 1000);
      awaitState(actor, ParticipantState.ACTIVE)
            .compose(nil -> actor.send(Command.of(CommandKind.LEAVE)))
            .onComplete(ctx.succeeding(ack -> {
               ctx.verify(() -> {
                  assertThat(ack).isEqualTo(Ack.APPLIED);
                  assertThat(actor.state()).isEqualTo(ParticipantState.CLOSED);
                  assertThat(actor.snapshot().reason()).isEqualTo("Left the session");
                  assertThat(actor.snapshot().lastActiveState()).isEqualTo(ParticipantState.ACTIVE);
               });
               checkpoint.flag();
            }));
      actor.start();
   }

   @Test
   public void testForcedTermination(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      // neither leave nor release ever completes
      ScriptedDriver driver = new ScriptedDriver()
            .on("leave", () -> Promise.<Void>promise().future())
            .on("release", () -> Promise.<Void>promise().future());
      ParticipantActor actor = actor(driver, 200);
      awaitState(actor, ParticipantState.ACTIVE)
            .compose(nil -> actor.close())
            .onComplete(ctx.succeeding(ack -> {
               ctx.verify(() -> {
                  ParticipantSnapshot snapshot = actor.snapshot();
                  assertThat(snapshot.state()).isEqualTo(ParticipantState.FAILED);
                  assertThat(snapshot.forced()).isTrue();
                  assertThat(snapshot.errorKind()).isEqualTo(ErrorKind.TIMEOUT);
                  assertThat(driver.calls()).contains("forceRelease");
               });
               checkpoint.flag();
            }));
      actor.start();
   }

   @Test
   public void testCloseWhileJoining(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      Promise<Void> join = Promise.promise();
      ScriptedDriver driver = new ScriptedDriver().on("join", join::future);
      ParticipantActor actor = actor(driver, 1000);
      awaitState(actor, ParticipantState.AUTHENTICATED).onComplete(ctx.succeeding(nil -> {
         actor.close().onComplete(ctx.succeeding(ack -> {
            ctx.verify(() -> {
               assertThat(ack).isEqualTo(Ack.APPLIED);
               assertThat(actor.state()).isEqualTo(ParticipantState.CLOSED);
               assertThat(transitions()).containsExactly("SPAWNED->AUTHENTICATED", "AUTHENTICATED->CLOSED");
               // not in the session yet: nothing to leave
               assertThat(driver.calls()).containsExactly("authenticate", "join", "release");
            });
            // the join finishing late changes nothing
            join.complete();
            vertx.setTimer(50, id -> {
               ctx.verify(() -> {
                  assertThat(actor.state()).isEqualTo(ParticipantState.CLOSED);
                  assertThat(transitions()).hasSize(2);
               });
               checkpoint.flag();
            });
         }));
      }));
      actor.start();
   }

   @Test
   public void testCloseAbortsPendingJoin(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      // the join never answers by itself; releasing the connection fails it
      Promise<Void> join = Promise.promise();
      ScriptedDriver driver = new ScriptedDriver()
            .on("join", join::future)
            .on("release", () -> {
               join.tryFail(new UnreachableException("Signaling connection closed"));
               return Future.succeededFuture();
            });
      ParticipantActor actor = actor(driver, 300);
      awaitState(actor, ParticipantState.AUTHENTICATED)
            .compose(nil -> actor.close())
            .onComplete(ctx.succeeding(ack -> {
               ctx.verify(() -> {
                  ParticipantSnapshot snapshot = actor.snapshot();
                  assertThat(ack).isEqualTo(Ack.APPLIED);
                  assertThat(snapshot.state()).isEqualTo(ParticipantState.CLOSED);
                  assertThat(snapshot.forced()).isFalse();
                  assertThat(snapshot.errorKind()).isNull();
                  assertThat(driver.calls()).containsExactly("authenticate", "join", "release");
               });
               // the grace timer must not fire after the orderly close
               vertx.setTimer(400, id -> {
                  ctx.verify(() -> {
                     assertThat(actor.state()).isEqualTo(ParticipantState.CLOSED);
                     assertThat(driver.calls()).doesNotContain("forceRelease");
                  });
                  checkpoint.flag();
               });
            }));
      actor.start();
   }

   @Test
   public void testLoginFailureNeverJoins(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      ScriptedDriver driver = new ScriptedDriver();
      ParticipantActor actor = actor(driver, 1000, username -> {
         logins.incrementAndGet();
         return Future.failedFuture(new UnreachableException("Login service returned 503"));
      });
      awaitState(actor, ParticipantState.FAILED).onComplete(ctx.succeeding(nil -> {
         ctx.verify(() -> {
            ParticipantSnapshot snapshot = actor.snapshot();
            assertThat(snapshot.errorKind()).isEqualTo(ErrorKind.CREDENTIAL);
            assertThat(snapshot.lastActiveState()).isEqualTo(ParticipantState.SPAWNED);
            assertThat(logins.get()).isEqualTo(2);
            assertThat(driver.calls()).doesNotContain("authenticate", "join");
            assertThat(transitions()).containsExactly("SPAWNED->FAILED");
         });
         checkpoint.flag();
      }));
      actor.start();
   }

   @Test
   public void testRejectedCredentialIsRefreshedOnce(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      AtomicInteger attempts = new AtomicInteger();
      ScriptedDriver driver = new ScriptedDriver().on("authenticate", () -> attempts.incrementAndGet() == 1
            ? Future.failedFuture(new CredentialException("token expired"))
            : Future.succeededFuture());
      ParticipantActor actor = actor(driver, 1000);
      awaitState(actor, ParticipantState.ACTIVE).onComplete(ctx.succeeding(nil -> {
         ctx.verify(() -> {
            assertThat(attempts.get()).isEqualTo(2);
            assertThat(logins.get()).isEqualTo(2);
         });
         checkpoint.flag();
      }));
      actor.start();
   }

   @Test
   public void testPersistentCredentialRejection(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      ScriptedDriver driver = new ScriptedDriver().on("authenticate", () -> Future.failedFuture(new CredentialException("banned")));
      ParticipantActor actor = actor(driver, 1000);
      awaitState(actor, ParticipantState.FAILED).onComplete(ctx.succeeding(nil -> {
         ctx.verify(() -> {
            ParticipantSnapshot snapshot = actor.snapshot();
            assertThat(snapshot.errorKind()).isEqualTo(ErrorKind.CREDENTIAL);
            assertThat(snapshot.lastActiveState()).isEqualTo(ParticipantState.SPAWNED);
            assertThat(snapshot.reason()).startsWith("Never authenticated");
            assertThat(logins.get()).isEqualTo(2);
         });
         checkpoint.flag();
      }));
      actor.start();
   }

   @Test
   public void testDisconnectFailsParticipant(VertxTestContext ctx) {
      var checkpoint = ctx.checkpoint();
      ScriptedDriver driver = new ScriptedDriver();
      ParticipantActor actor = actor(driver, 1000);
      awaitState(actor, ParticipantState.FAILED).onComplete(ctx.succeeding(nil -> {
         ctx.verify(() -> {
            ParticipantSnapshot snapshot = actor.snapshot();
            assertThat(snapshot.errorKind()).isEqualTo(ErrorKind.UNREACHABLE);
            assertThat(snapshot.lastActiveState()).isEqualTo(ParticipantState.ACTIVE);
            assertThat(snapshot.reason()).startsWith("Dropped after joining");
            assertThat(snapshot.forced()).isFalse();
         });
         checkpoint.flag();
      }));
      awaitState(actor, ParticipantState.ACTIVE).onComplete(ctx.succeeding(nil -> driver.disconnect(new UnreachableException("kicked"))));
      actor.start();
   }
}
