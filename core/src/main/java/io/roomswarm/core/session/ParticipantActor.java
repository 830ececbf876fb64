package io.roomswarm.core.session;

import java.util.ArrayDeque;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.roomswarm.api.CredentialException;
import io.roomswarm.api.ErrorKind;
import io.roomswarm.api.InvalidStateException;
import io.roomswarm.api.ParticipantClosedException;
import io.roomswarm.api.SimulatorException;
import io.roomswarm.api.config.NoiseSuppression;
import io.roomswarm.api.config.ParticipantIdentity;
import io.roomswarm.api.config.WebcamResolution;
import io.roomswarm.api.credentials.CredentialStore;
import io.roomswarm.api.driver.ParticipantDriver;
import io.roomswarm.api.session.Ack;
import io.roomswarm.api.session.Command;
import io.roomswarm.api.session.CommandKind;
import io.roomswarm.api.session.ErrorEvent;
import io.roomswarm.api.session.LogEvent;
import io.roomswarm.api.session.MediaChangedEvent;
import io.roomswarm.api.session.MediaState;
import io.roomswarm.api.session.Participant;
import io.roomswarm.api.session.ParticipantEvent;
import io.roomswarm.api.session.ParticipantSnapshot;
import io.roomswarm.api.session.ParticipantState;
import io.roomswarm.api.session.StateChangedEvent;
import io.roomswarm.api.session.Subscription;
import io.roomswarm.core.util.Futures;
import io.roomswarm.impl.Util;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

/**
 * One simulated participant. All state is confined to a single Vert.x context; the life-cycle steps
 * and queued commands run one at a time so there are no intra-participant races.
 */
public class ParticipantActor implements Participant {
   private static final Logger log = LogManager.getLogger(ParticipantActor.class);

   private final String id;
   private final ParticipantIdentity identity;
   private final Vertx vertx;
   private final Context context;
   private final ParticipantDriver driver;
   private final CredentialStore credentials;
   private final ParticipantTimeouts timeouts;
   private final ParticipantEvents events = new ParticipantEvents();
   private final long createdAt = System.currentTimeMillis();

   // written on the context only, volatile for snapshots taken from other threads
   private volatile ParticipantState state = ParticipantState.SPAWNED;
   private volatile ParticipantState lastActiveState = ParticipantState.SPAWNED;
   private volatile MediaState media = MediaState.OFF;
   private volatile String reason;
   private volatile ErrorKind errorKind;
   private volatile boolean forced;

   private final ArrayDeque<Pending> mailbox = new ArrayDeque<>();
   private boolean busy;
   private boolean inLifecycle;
   private boolean shuttingDown;
   private boolean joinedBackend;
   private Promise<Ack> closePromise;
   private long graceTimer = -1;

   public ParticipantActor(String id, ParticipantIdentity identity, Vertx vertx, Context context,
                           ParticipantDriver driver, CredentialStore credentials, ParticipantTimeouts timeouts) {
      this.id = id;
      this.identity = identity;
      this.vertx = vertx;
      this.context = context;
      this.driver = driver;
      this.credentials = credentials;
      this.timeouts = timeouts;
   }

   /**
    * Begins the life-cycle: authenticate, join and start media.
    */
   public void start() {
      context.runOnContext(nil -> {
         driver.disconnectHandler(cause -> context.runOnContext(nil2 -> onDisconnect(cause)));
         busy = true;
         inLifecycle = true;
         runLifecycle().onComplete(result -> {
            inLifecycle = false;
            if (closePromise != null) {
               // the close that arrived during the life-cycle has started the shutdown already
               return;
            }
            busy = false;
            if (result.failed()) {
               fail(result.cause());
            } else {
               drain();
            }
         });
      });
   }

   @Override
   public String id() {
      return id;
   }

   @Override
   public ParticipantIdentity identity() {
      return identity;
   }

   @Override
   public ParticipantState state() {
      return state;
   }

   @Override
   public ParticipantSnapshot snapshot() {
      return new ParticipantSnapshot(id, identity, state, lastActiveState, media, reason, errorKind, forced, createdAt);
   }

   @Override
   public Subscription subscribe(Handler<ParticipantEvent> handler) {
      return events.subscribe(handler);
   }

   @Override
   public Future<Ack> send(Command command) {
      if (command.kind() == CommandKind.CLOSE) {
         return close();
      }
      Promise<Ack> promise = Promise.promise();
      context.runOnContext(nil -> {
         if (state.isTerminal() || closePromise != null) {
            promise.fail(new ParticipantClosedException(id, state));
            return;
         }
         try {
            checkLegal(command);
         } catch (SimulatorException e) {
            promise.fail(e);
            return;
         }
         mailbox.add(new Pending(command, promise));
         drain();
      });
      return promise.future();
   }

   @Override
   public Future<Ack> close() {
      Promise<Ack> promise = Promise.promise();
      context.runOnContext(nil -> {
         if (state.isTerminal()) {
            promise.complete(Ack.NO_OP);
            return;
         }
         if (closePromise != null) {
            closePromise.future().onComplete(promise);
            return;
         }
         log.debug("{} ({}) closing in state {}", id, identity.username(), state);
         closePromise = promise;
         Pending pending;
         while ((pending = mailbox.poll()) != null) {
            pending.promise.fail(new ParticipantClosedException(id, state));
         }
         graceTimer = vertx.setTimer(timeouts.closeGrace, t -> forceTermination());
         // releasing the driver aborts a pending life-cycle step; a queued command runs to completion first
         if (!busy || inLifecycle) {
            shutdown();
         }
      });
      return promise.future();
   }

   private void checkLegal(Command command) {
      CommandKind kind = command.kind();
      switch (kind) {
         case JOIN:
            if (state == ParticipantState.SPAWNED) {
               throw new InvalidStateException(kind, state);
            }
            break;
         case SET_NOISE_SUPPRESSION:
         case SET_RESOLUTION:
            if (command.argument() == null) {
               throw new SimulatorException(ErrorKind.VALIDATION, "Command " + kind + " requires an argument");
            }
            try {
               if (kind == CommandKind.SET_NOISE_SUPPRESSION) {
                  NoiseSuppression.fromString(command.argument());
               } else {
                  WebcamResolution.fromString(command.argument());
               }
            } catch (IllegalArgumentException e) {
               throw new SimulatorException(ErrorKind.VALIDATION, e.getMessage(), e);
            }
            // fall through
         default:
            if (state != ParticipantState.JOINED && state != ParticipantState.ACTIVE) {
               throw new InvalidStateException(kind, state);
            }
      }
   }

   private void drain() {
      if (busy || closePromise != null || state.isTerminal()) {
         return;
      }
      Pending next = mailbox.poll();
      if (next == null) {
         return;
      }
      busy = true;
      Future<Ack> result;
      try {
         checkLegal(next.command);
         result = apply(next.command);
      } catch (SimulatorException e) {
         result = Future.failedFuture(e);
      }
      result.onComplete(ack -> {
         busy = false;
         next.promise.handle(ack);
         if (closePromise != null && !state.isTerminal()) {
            shutdown();
         } else {
            drain();
         }
      });
   }

   private Future<Ack> apply(Command command) {
      CommandKind kind = command.kind();
      switch (kind) {
         case JOIN:
            // joining follows authentication automatically
            return Future.succeededFuture(Ack.NO_OP);
         case LEAVE:
            return Futures.withTimeout(vertx, driver.leave(), timeouts.command, "Leave")
                  .compose(nil -> {
                     joinedBackend = false;
                     return driver.release();
                  })
                  .map(nil -> {
                     transition(ParticipantState.CLOSED, "Left the session", null, false);
                     return Ack.APPLIED;
                  })
                  .recover(e -> {
                     fail(e);
                     return Future.failedFuture(e);
                  });
         case TOGGLE_AUDIO:
         case TOGGLE_VIDEO:
         case TOGGLE_SCREENSHARE:
         case TOGGLE_BLUR:
            if (!driver.supports(kind)) {
               return unsupported(command);
            }
            boolean enabled = !media.isEnabled(kind);
            return mediaCommand(command, driver.toggle(kind, enabled), media.with(kind, enabled));
         case SET_NOISE_SUPPRESSION:
            if (!driver.supports(kind)) {
               return unsupported(command);
            }
            NoiseSuppression level = NoiseSuppression.fromString(command.argument());
            return mediaCommand(command, driver.setNoiseSuppression(level), media.withNoiseSuppression(level));
         case SET_RESOLUTION:
            if (!driver.supports(kind)) {
               return unsupported(command);
            }
            WebcamResolution resolution = WebcamResolution.fromString(command.argument());
            return mediaCommand(command, driver.setResolution(resolution), media.withResolution(resolution));
         default:
            return Future.failedFuture(new SimulatorException(ErrorKind.INTERNAL, "Unexpected command " + command));
      }
   }

   private Future<Ack> unsupported(Command command) {
      String message = driver.kind() + " strategy does not support " + command.kind() + ", ignoring";
      log.debug("{} ({}): {}", id, identity.username(), message);
      events.publish(new LogEvent(id, System.currentTimeMillis(), LogEvent.Level.DEBUG, identity.username(), message));
      return Future.succeededFuture(Ack.NO_OP);
   }

   private Future<Ack> mediaCommand(Command command, Future<Void> operation, MediaState target) {
      return Futures.withTimeout(vertx, operation, timeouts.command, command.toString())
            .map(nil -> {
               if (!state.isTerminal()) {
                  media = target;
                  events.publish(new MediaChangedEvent(id, System.currentTimeMillis(), target));
               }
               return Ack.APPLIED;
            })
            .recover(e -> {
               ErrorKind kind = ErrorKind.of(e);
               log.warn("{} ({}): {} failed: {}", id, identity.username(), command, Util.explainCauses(e));
               events.publish(new ErrorEvent(id, System.currentTimeMillis(), kind, command + " failed: " + Util.explainCauses(e)));
               return Future.failedFuture(e);
            });
   }

   private Future<Void> runLifecycle() {
      return authenticate(false)
            .compose(nil -> {
               if (closePromise != null || state.isTerminal()) {
                  return Future.succeededFuture();
               }
               transition(ParticipantState.AUTHENTICATED, null, null, false);
               return join(false).compose(nil2 -> {
                  joinedBackend = true;
                  if (closePromise != null || state.isTerminal()) {
                     return Future.succeededFuture();
                  }
                  transition(ParticipantState.JOINED, null, null, false);
                  return Futures.withTimeout(vertx, driver.startMedia(identity.media()), timeouts.media, "Starting media")
                        .map(started -> {
                           media = started;
                           if (closePromise == null && !state.isTerminal()) {
                              transition(ParticipantState.ACTIVE, null, null, false);
                              events.publish(new MediaChangedEvent(id, System.currentTimeMillis(), started));
                           }
                           return null;
                        });
               });
            });
   }

   private Future<Void> authenticate(boolean retried) {
      return Futures.withTimeout(vertx, credentials.get(identity.username()), timeouts.auth, "Obtaining credential")
            .compose(credential -> Futures.withTimeout(vertx, driver.authenticate(credential), timeouts.auth, "Authentication")
                  .recover(e -> retryRejected(e, retried, () -> authenticate(true))));
   }

   private Future<Void> join(boolean retried) {
      return Futures.withTimeout(vertx, driver.join(), timeouts.join, "Join")
            .recover(e -> retryRejected(e, retried, () -> authenticate(true).compose(nil -> join(true))));
   }

   private Future<Void> retryRejected(Throwable e, boolean retried, Supplier<Future<Void>> retry) {
      if (e instanceof CredentialException && !retried && closePromise == null) {
         log.info("{} ({}): backend rejected the session token, refreshing", id, identity.username());
         credentials.invalidate(identity.username());
         return retry.get();
      }
      return Future.failedFuture(e);
   }

   private void shutdown() {
      if (shuttingDown) {
         return;
      }
      shuttingDown = true;
      busy = true;
      Future<Void> leave = joinedBackend
            ? Futures.withTimeout(vertx, driver.leave(), timeouts.closeGrace, "Leave").recover(e -> {
               log.debug("{} ({}): leave failed during close: {}", id, identity.username(), Util.explainCauses(e));
               return Future.succeededFuture();
            })
            : Future.succeededFuture();
      leave.compose(nil -> driver.release()).onComplete(result -> {
         busy = false;
         if (state.isTerminal()) {
            return;
         }
         vertx.cancelTimer(graceTimer);
         if (result.succeeded()) {
            transition(ParticipantState.CLOSED, "Closed on request", null, false);
         } else {
            driver.forceRelease();
            transition(ParticipantState.CLOSED, "Closed on request, release failed: " + Util.explainCauses(result.cause()), null, false);
         }
         completeClose();
      });
   }

   private void forceTermination() {
      if (state.isTerminal()) {
         return;
      }
      log.warn("{} ({}): close grace period of {} ms expired in state {}, forcing termination",
            id, identity.username(), timeouts.closeGrace, state);
      driver.forceRelease();
      transition(ParticipantState.FAILED, "Close grace period of " + timeouts.closeGrace + " ms expired in state " + state,
            ErrorKind.TIMEOUT, true);
      completeClose();
   }

   private void onDisconnect(Throwable cause) {
      if (state.isTerminal() || closePromise != null) {
         return;
      }
      fail(new SimulatorException(ErrorKind.UNREACHABLE, "Disconnected from the session: " + Util.explainCauses(cause), cause));
   }

   private void fail(Throwable cause) {
      if (state.isTerminal()) {
         return;
      }
      ErrorKind kind = ErrorKind.of(cause);
      String message = describe(state) + ": " + Util.explainCauses(cause);
      if (kind == ErrorKind.INTERNAL) {
         log.error(id + " (" + identity.username() + ") failed", cause);
      } else {
         log.warn("{} ({}) failed: {}", id, identity.username(), message);
      }
      vertx.cancelTimer(graceTimer);
      transition(ParticipantState.FAILED, message, kind, false);
      driver.release().onFailure(e -> driver.forceRelease());
      Pending pending;
      while ((pending = mailbox.poll()) != null) {
         pending.promise.fail(new ParticipantClosedException(id, state));
      }
      completeClose();
   }

   private static String describe(ParticipantState state) {
      switch (state) {
         case SPAWNED:
            return "Never authenticated";
         case AUTHENTICATED:
            return "Authenticated but never joined";
         case JOINED:
            return "Joined but media never started";
         case ACTIVE:
            return "Dropped after joining";
         default:
            return String.valueOf(state);
      }
   }

   private void completeClose() {
      if (closePromise != null) {
         closePromise.tryComplete(Ack.APPLIED);
      }
   }

   private void transition(ParticipantState next, String reason, ErrorKind errorKind, boolean forced) {
      ParticipantState from = state;
      if (!from.canTransitionTo(next)) {
         log.error("{} ({}): ignoring illegal transition {} -> {}", id, identity.username(), from, next);
         return;
      }
      if (!next.isTerminal()) {
         lastActiveState = next;
      }
      this.reason = reason;
      this.errorKind = errorKind;
      this.forced = forced;
      this.state = next;
      log.debug("{} ({}): {} -> {}", id, identity.username(), from, next);
      events.publish(new StateChangedEvent(id, System.currentTimeMillis(), from, next, reason, errorKind, forced));
      if (next == ParticipantState.ACTIVE || next.isTerminal()) {
         LogEvent.Level level = next == ParticipantState.FAILED ? LogEvent.Level.WARN : LogEvent.Level.INFO;
         String text = reason == null ? identity.username() + " is " + next : identity.username() + " is " + next + ": " + reason;
         events.publish(new LogEvent(id, System.currentTimeMillis(), level, identity.username(), text));
      }
   }

   private static class Pending {
      final Command command;
      final Promise<Ack> promise;

      Pending(Command command, Promise<Ack> promise) {
         this.command = command;
         this.promise = promise;
      }
   }
}
