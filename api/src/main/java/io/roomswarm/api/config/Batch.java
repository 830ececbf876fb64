package io.roomswarm.api.config;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

/**
 * Validated batch definition: which participants join which session, through which workers and when.
 */
public class Batch implements Serializable {
   private final String sessionUrl;
   private final List<WorkerRef> workers;
   private final MediaSettings defaults;
   private final List<ParticipantSpec> participants;
   private final long runMillis;
   private final long timeoutMillis;
   private final int dispatchRetries;
   private final long dispatchBackoffMillis;

   Batch(String sessionUrl, List<WorkerRef> workers, MediaSettings defaults, List<ParticipantSpec> participants,
         long runMillis, long timeoutMillis, int dispatchRetries, long dispatchBackoffMillis) {
      this.sessionUrl = sessionUrl;
      this.workers = Collections.unmodifiableList(workers);
      this.defaults = defaults;
      this.participants = Collections.unmodifiableList(participants);
      this.runMillis = runMillis;
      this.timeoutMillis = timeoutMillis;
      this.dispatchRetries = dispatchRetries;
      this.dispatchBackoffMillis = dispatchBackoffMillis;
   }

   public String sessionUrl() {
      return sessionUrl;
   }

   public List<WorkerRef> workers() {
      return workers;
   }

   public MediaSettings defaults() {
      return defaults;
   }

   public List<ParticipantSpec> participants() {
      return participants;
   }

   /**
    * How long joined participants stay in the session before the batch closes them; 0 keeps them running.
    */
   public long runMillis() {
      return runMillis;
   }

   public long timeoutMillis() {
      return timeoutMillis;
   }

   public int dispatchRetries() {
      return dispatchRetries;
   }

   public long dispatchBackoffMillis() {
      return dispatchBackoffMillis;
   }

   /**
    * Round-robin assignment of participants to workers.
    */
   public WorkerRef workerFor(ParticipantSpec participant) {
      return workers.get(participant.index() % workers.size());
   }
}
