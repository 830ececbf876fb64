package io.roomswarm.clustering;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.roomswarm.api.ErrorKind;
import io.roomswarm.api.ParticipantClosedException;
import io.roomswarm.api.SimulatorException;
import io.roomswarm.api.UnknownParticipantException;
import io.roomswarm.api.config.ParticipantIdentity;
import io.roomswarm.api.session.Ack;
import io.roomswarm.api.session.Command;
import io.roomswarm.api.session.Participant;
import io.roomswarm.api.session.ParticipantState;
import io.roomswarm.api.session.StateChangedEvent;
import io.roomswarm.core.session.ParticipantActor;
import io.roomswarm.core.session.ParticipantFactory;
import io.roomswarm.core.util.CountDown;
import io.roomswarm.internal.Properties;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

/**
 * Participants hosted by this worker. Ids are never reused, not even after a terminated participant
 * has been dropped from the registry.
 */
public class ParticipantRegistry {
   private static final Logger log = LogManager.getLogger(ParticipantRegistry.class);
   private static final AtomicLong ID_COUNTER = new AtomicLong();

   private final Vertx vertx;
   private final ParticipantFactory factory;
   private final long retention;
   private final Map<String, Participant> participants = new ConcurrentHashMap<>();
   // final state of participants dropped after the retention period
   private final Map<String, ParticipantState> retired = new ConcurrentHashMap<>();
   private final Map<String, String> dispatchKeys = new ConcurrentHashMap<>();

   public ParticipantRegistry(Vertx vertx, ParticipantFactory factory, long retention) {
      this.vertx = vertx;
      this.factory = factory;
      this.retention = retention;
   }

   public ParticipantRegistry(Vertx vertx, ParticipantFactory factory) {
      this(vertx, factory, Properties.getLong(Properties.REGISTRY_RETENTION, 60000));
   }

   static String nextId() {
      return "p-" + ID_COUNTER.incrementAndGet();
   }

   public Participant spawn(ParticipantIdentity identity) {
      return create(identity);
   }

   /**
    * Spawns at most one participant per dispatch key: a repeated request, e.g. a retry after a lost response,
    * gets the participant created by the first one.
    *
    * @param dispatchKey caller-chosen key, or {@code null} to always create a new participant
    */
   public Participant spawn(ParticipantIdentity identity, String dispatchKey) {
      if (dispatchKey == null) {
         return create(identity);
      }
      String id = dispatchKeys.computeIfAbsent(dispatchKey, key -> create(identity).id());
      Participant participant = participants.get(id);
      if (participant == null) {
         throw new ParticipantClosedException(id, retired.getOrDefault(id, ParticipantState.CLOSED));
      }
      if (!participant.identity().username().equals(identity.username())) {
         throw new SimulatorException(ErrorKind.VALIDATION, "Dispatch key " + dispatchKey + " already belongs to "
               + participant.identity().username());
      }
      log.debug("Dispatch key {} repeated, returning {}", dispatchKey, id);
      return participant;
   }

   private Participant create(ParticipantIdentity identity) {
      String id = nextId();
      ParticipantActor actor = factory.create(id, identity);
      participants.put(id, actor);
      actor.subscribe(event -> {
         vertx.eventBus().publish(Feeds.PARTICIPANT_EVENTS, event);
         if (event instanceof StateChangedEvent && ((StateChangedEvent) event).to().isTerminal()) {
            scheduleRemoval(id);
         }
      });
      actor.start();
      return actor;
   }

   private void scheduleRemoval(String id) {
      if (retention <= 0) {
         retire(id);
         return;
      }
      vertx.setTimer(retention, timer -> {
         if (retire(id)) {
            log.debug("Dropped terminated participant {}", id);
         }
      });
   }

   private boolean retire(String id) {
      Participant participant = participants.get(id);
      if (participant == null) {
         return false;
      }
      retired.put(id, participant.state());
      participants.remove(id);
      return true;
   }

   /**
    * @throws UnknownParticipantException when there is no such participant (anymore)
    */
   public Participant get(String id) {
      Participant participant = participants.get(id);
      if (participant == null) {
         throw new UnknownParticipantException(id);
      }
      return participant;
   }

   public Collection<Participant> list() {
      return new ArrayList<>(participants.values());
   }

   public Future<Ack> send(String id, Command command) {
      Participant participant = participants.get(id);
      if (participant == null) {
         ParticipantState finalState = retired.get(id);
         return Future.failedFuture(finalState == null ? new UnknownParticipantException(id) : new ParticipantClosedException(id, finalState));
      }
      return participant.send(command);
   }

   /**
    * Closing a participant that has already been dropped is acknowledged as {@link Ack#NO_OP}.
    */
   public Future<Ack> close(String id) {
      Participant participant = participants.get(id);
      if (participant == null) {
         return retired.containsKey(id) ? Future.succeededFuture(Ack.NO_OP) : Future.failedFuture(new UnknownParticipantException(id));
      }
      return participant.close();
   }

   /**
    * Closes every participant, completes when all of them are terminal.
    */
   public Future<Void> closeAll() {
      List<Participant> all = new ArrayList<>(participants.values());
      if (all.isEmpty()) {
         return Future.succeededFuture();
      }
      log.info("Closing {} participant(s)", all.size());
      Promise<Void> promise = Promise.promise();
      CountDown countDown = new CountDown(promise, all.size());
      for (Participant participant : all) {
         participant.close().onComplete(result -> {
            if (result.failed()) {
               log.warn("Closing {} failed: {}", participant.id(), result.cause().getMessage());
            }
            countDown.countDown();
         });
      }
      return promise.future();
   }
}
