package io.roomswarm.clustering.orchestrator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import io.roomswarm.api.ErrorKind;
import io.roomswarm.api.UnknownParticipantException;
import io.roomswarm.api.UnreachableException;
import io.roomswarm.api.config.ParticipantIdentity;
import io.roomswarm.api.config.WorkerRef;
import io.roomswarm.api.session.Ack;
import io.roomswarm.api.session.Command;
import io.roomswarm.api.session.MediaState;
import io.roomswarm.api.session.ParticipantSnapshot;
import io.roomswarm.api.session.ParticipantState;
import io.roomswarm.clustering.client.WorkerClient;
import io.vertx.core.Future;

/**
 * Answers immediately; the state reported for a participant is decided by {@link #states}.
 */
class StubWorkerClient implements WorkerClient {
   private final WorkerRef worker;
   private final Map<String, ParticipantIdentity> participants = new HashMap<>();
   final List<String> spawned = new ArrayList<>();
   final List<String> deleted = new ArrayList<>();
   final List<String> dispatchKeys = new ArrayList<>();
   private final Map<String, String> byDispatchKey = new HashMap<>();
   Function<ParticipantIdentity, ParticipantState> states = identity -> ParticipantState.ACTIVE;
   String failureReason;
   int unreachableSpawns;
   int lostResponses;
   boolean closed;

   StubWorkerClient(WorkerRef worker) {
      this.worker = worker;
   }

   @Override
   public WorkerRef worker() {
      return worker;
   }

   @Override
   public synchronized Future<Void> health() {
      return Future.succeededFuture();
   }

   @Override
   public synchronized Future<String> spawn(ParticipantIdentity identity, String dispatchKey) {
      if (unreachableSpawns > 0) {
         unreachableSpawns--;
         return Future.failedFuture(new UnreachableException("Cannot reach " + worker));
      }
      dispatchKeys.add(dispatchKey);
      String id = dispatchKey == null ? null : byDispatchKey.get(dispatchKey);
      if (id == null) {
         id = "p-" + worker.index + "-" + participants.size();
         participants.put(id, identity);
         spawned.add(identity.username());
         if (dispatchKey != null) {
            byDispatchKey.put(dispatchKey, id);
         }
      }
      if (lostResponses > 0) {
         // created, but the response never makes it back
         lostResponses--;
         return Future.failedFuture(new UnreachableException("Response from " + worker + " timed out"));
      }
      return Future.succeededFuture(id);
   }

   @Override
   public synchronized Future<ParticipantSnapshot> snapshot(String participantId) {
      ParticipantIdentity identity = participants.get(participantId);
      if (identity == null) {
         return Future.failedFuture(new UnknownParticipantException(participantId));
      }
      ParticipantState state = deleted.contains(participantId) ? ParticipantState.CLOSED : states.apply(identity);
      String reason = state == ParticipantState.FAILED ? failureReason : null;
      return Future.succeededFuture(new ParticipantSnapshot(participantId, identity, state, state, MediaState.OFF, reason,
            state == ParticipantState.FAILED ? ErrorKind.CREDENTIAL : null, false, 0));
   }

   @Override
   public Future<Ack> command(String participantId, Command command) {
      return Future.succeededFuture(Ack.APPLIED);
   }

   @Override
   public synchronized Future<Ack> delete(String participantId) {
      if (!participants.containsKey(participantId)) {
         return Future.failedFuture(new UnknownParticipantException(participantId));
      }
      if (deleted.contains(participantId)) {
         return Future.succeededFuture(Ack.NO_OP);
      }
      deleted.add(participantId);
      return Future.succeededFuture(Ack.APPLIED);
   }

   @Override
   public void close() {
      closed = true;
   }
}
