package io.roomswarm.clustering.orchestrator;

import java.io.Serializable;

import io.vertx.core.json.JsonObject;

/**
 * What became of one participant of a batch.
 */
public class ParticipantOutcome implements Serializable {
   private final String username;
   private final String worker;
   private final String participantId;
   private final Outcome outcome;
   private final String reason;
   private final int attempts;

   public ParticipantOutcome(String username, String worker, String participantId, Outcome outcome, String reason, int attempts) {
      this.username = username;
      this.worker = worker;
      this.participantId = participantId;
      this.outcome = outcome;
      this.reason = reason;
      this.attempts = attempts;
   }

   public String username() {
      return username;
   }

   public String worker() {
      return worker;
   }

   /**
    * @return id assigned by the worker, {@code null} when the participant was never dispatched
    */
   public String participantId() {
      return participantId;
   }

   public Outcome outcome() {
      return outcome;
   }

   public String reason() {
      return reason;
   }

   /**
    * Number of dispatch requests sent to the worker.
    */
   public int attempts() {
      return attempts;
   }

   public JsonObject toJson() {
      JsonObject json = new JsonObject()
            .put("username", username)
            .put("worker", worker)
            .put("outcome", outcome.value)
            .put("attempts", attempts);
      if (participantId != null) {
         json.put("participantId", participantId);
      }
      if (reason != null) {
         json.put("reason", reason);
      }
      return json;
   }

   @Override
   public String toString() {
      return username + "@" + worker + ": " + outcome.value + (reason == null ? "" : " (" + reason + ")");
   }

   public enum Outcome {
      JOINED("joined"),
      FAILED("failed"),
      TIMED_OUT("timed-out");

      public final String value;

      Outcome(String value) {
         this.value = value;
      }
   }
}
