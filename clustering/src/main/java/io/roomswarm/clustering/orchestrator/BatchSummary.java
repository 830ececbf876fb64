package io.roomswarm.clustering.orchestrator;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

public class BatchSummary implements Serializable {
   private final String sessionUrl;
   private final long startedAt;
   private final long finishedAt;
   private final boolean cancelled;
   private final List<ParticipantOutcome> outcomes;

   public BatchSummary(String sessionUrl, long startedAt, long finishedAt, boolean cancelled, List<ParticipantOutcome> outcomes) {
      this.sessionUrl = sessionUrl;
      this.startedAt = startedAt;
      this.finishedAt = finishedAt;
      this.cancelled = cancelled;
      this.outcomes = Collections.unmodifiableList(outcomes);
   }

   public String sessionUrl() {
      return sessionUrl;
   }

   public long startedAt() {
      return startedAt;
   }

   public long finishedAt() {
      return finishedAt;
   }

   public boolean cancelled() {
      return cancelled;
   }

   /**
    * One entry per participant, in the order of the batch definition.
    */
   public List<ParticipantOutcome> outcomes() {
      return outcomes;
   }

   public int count(ParticipantOutcome.Outcome outcome) {
      int count = 0;
      for (ParticipantOutcome o : outcomes) {
         if (o.outcome() == outcome) {
            ++count;
         }
      }
      return count;
   }

   public JsonObject toJson() {
      JsonObject counts = new JsonObject();
      for (ParticipantOutcome.Outcome outcome : ParticipantOutcome.Outcome.values()) {
         counts.put(outcome.value, count(outcome));
      }
      JsonArray participants = new JsonArray();
      outcomes.forEach(o -> participants.add(o.toJson()));
      return new JsonObject()
            .put("sessionUrl", sessionUrl)
            .put("startedAt", startedAt)
            .put("finishedAt", finishedAt)
            .put("cancelled", cancelled)
            .put("total", outcomes.size())
            .put("counts", counts)
            .put("participants", participants);
   }

   @Override
   public String toString() {
      return String.format("%d participant(s) in %d ms: %d joined, %d failed, %d timed out%s",
            outcomes.size(), finishedAt - startedAt, count(ParticipantOutcome.Outcome.JOINED),
            count(ParticipantOutcome.Outcome.FAILED), count(ParticipantOutcome.Outcome.TIMED_OUT),
            cancelled ? " (cancelled)" : "");
   }
}
