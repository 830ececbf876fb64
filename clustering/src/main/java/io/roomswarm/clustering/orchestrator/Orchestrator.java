package io.roomswarm.clustering.orchestrator;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import io.roomswarm.api.ErrorKind;
import io.roomswarm.api.UnreachableException;
import io.roomswarm.api.config.Batch;
import io.roomswarm.api.config.ParticipantSpec;
import io.roomswarm.api.config.WorkerRef;
import io.roomswarm.api.session.ParticipantSnapshot;
import io.roomswarm.clustering.client.WorkerClient;
import io.roomswarm.clustering.orchestrator.ParticipantOutcome.Outcome;
import io.roomswarm.core.util.CountDown;
import io.roomswarm.core.util.Futures;
import io.roomswarm.impl.Util;
import io.roomswarm.internal.Properties;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;

/**
 * Runs one batch: participants are assigned round-robin to workers, dispatched after their join delay
 * and tracked until they are active, failed or the batch times out. All bookkeeping happens on a single context.
 */
public class Orchestrator {
   private static final Logger log = LogManager.getLogger(Orchestrator.class);
   private static final long MAX_BACKOFF = 30_000;

   private final Vertx vertx;
   private final Batch batch;
   private final List<WorkerClient> clients = new ArrayList<>();
   private final long pollInterval;
   private final String summaryFile;
   // prefix of the dispatch keys, so a retried spawn never creates a second participant
   private final String batchId = UUID.randomUUID().toString();
   private final Promise<BatchSummary> promise = Promise.promise();
   private final List<Tracked> tracked = new ArrayList<>();
   private Context context;
   private long startedAt;
   private long timeoutTimer = -1;
   private boolean finishing;
   private boolean cancelled;

   public Orchestrator(Vertx vertx, Batch batch, Function<WorkerRef, WorkerClient> clientFactory, long pollInterval) {
      this.vertx = vertx;
      this.batch = batch;
      this.pollInterval = pollInterval;
      this.summaryFile = Properties.get(Properties.ORCHESTRATOR_SUMMARY, null);
      for (WorkerRef worker : batch.workers()) {
         clients.add(clientFactory.apply(worker));
      }
   }

   public Orchestrator(Vertx vertx, Batch batch, Function<WorkerRef, WorkerClient> clientFactory) {
      this(vertx, batch, clientFactory, Properties.getLong(Properties.ORCHESTRATOR_POLL, 500));
   }

   public Future<BatchSummary> run() {
      if (context != null) {
         throw new IllegalStateException("Batch is already running");
      }
      context = vertx.getOrCreateContext();
      context.runOnContext(nil -> start());
      return promise.future();
   }

   /**
    * Closes every dispatched participant that is still running and completes the batch.
    */
   public Future<BatchSummary> cancel() {
      if (context == null) {
         throw new IllegalStateException("Batch is not running");
      }
      context.runOnContext(nil -> {
         if (!finishing) {
            log.info("Cancelling batch");
            cancelled = true;
            finish();
         }
      });
      return promise.future();
   }

   private void start() {
      startedAt = System.currentTimeMillis();
      log.info("Starting batch of {} participant(s) on {} worker(s) joining {}",
            batch.participants().size(), batch.workers().size(), batch.sessionUrl());
      timeoutTimer = vertx.setTimer(batch.timeoutMillis(), id -> {
         timeoutTimer = -1;
         if (!finishing) {
            log.warn("Batch timeout of {} ms elapsed", batch.timeoutMillis());
            finish();
         }
      });
      for (ParticipantSpec spec : batch.participants()) {
         Tracked t = new Tracked(spec, batch.workerFor(spec));
         tracked.add(t);
         if (spec.waitToJoinMillis() >= batch.timeoutMillis()) {
            settle(t, Outcome.TIMED_OUT, "Join delay of " + spec.waitToJoinMillis() +
                  " ms is not shorter than the batch timeout of " + batch.timeoutMillis() + " ms");
            continue;
         }
         t.timer = vertx.setTimer(Math.max(1, spec.waitToJoinMillis()), id -> {
            t.timer = -1;
            dispatch(t);
         });
      }
      checkDone();
   }

   private void dispatch(Tracked t) {
      if (finishing || t.outcome != null) {
         return;
      }
      t.attempts++;
      WorkerClient client = clients.get(t.worker.index);
      log.debug("Dispatching {} to {} (attempt {})", t.spec.username(), t.worker, t.attempts);
      client.spawn(t.spec.identity(batch.sessionUrl()), batchId + "/" + t.spec.index()).onComplete(result -> {
         if (result.succeeded()) {
            t.participantId = result.result();
            if (finishing) {
               // created after the batch ended
               release(t);
               return;
            }
            log.info("{} dispatched to {} as {}", t.spec.username(), t.worker, t.participantId);
            poll(t);
         } else if (finishing) {
            log.debug("Dispatch of {} failed after the batch ended: {}", t.spec.username(), result.cause().getMessage());
         } else if (result.cause() instanceof UnreachableException && t.attempts <= batch.dispatchRetries()) {
            long delay = Futures.backoff(batch.dispatchBackoffMillis(), t.attempts - 1, MAX_BACKOFF);
            log.warn("Cannot reach {} for {}, retrying in {} ms ({}/{})", t.worker, t.spec.username(), delay,
                  t.attempts, batch.dispatchRetries());
            t.timer = vertx.setTimer(Math.max(1, delay), id -> {
               t.timer = -1;
               dispatch(t);
            });
         } else {
            settle(t, Outcome.FAILED, "Dispatch to " + t.worker + " failed after " + t.attempts + " attempt(s): "
                  + Util.explainCauses(result.cause()));
         }
      });
   }

   private void poll(Tracked t) {
      t.timer = vertx.setTimer(pollInterval, id -> {
         t.timer = -1;
         if (finishing || t.outcome != null) {
            return;
         }
         clients.get(t.worker.index).snapshot(t.participantId).onComplete(result -> {
            if (finishing || t.outcome != null) {
               return;
            }
            if (result.failed()) {
               if (ErrorKind.of(result.cause()) == ErrorKind.NOT_FOUND) {
                  settle(t, Outcome.FAILED, t.worker + " does not know " + t.participantId + " anymore");
               } else {
                  log.debug("Cannot poll {} on {}: {}", t.participantId, t.worker, result.cause().getMessage());
                  poll(t);
               }
               return;
            }
            ParticipantSnapshot snapshot = result.result();
            switch (snapshot.state()) {
               case ACTIVE:
                  // hold first so the batch does not finish before the hold time elapsed
                  hold(t);
                  settle(t, Outcome.JOINED, null);
                  break;
               case FAILED:
               case CLOSED:
                  t.released = true;
                  settle(t, Outcome.FAILED, snapshot.reason() == null ? "Participant ended in state " + snapshot.state() : snapshot.reason());
                  break;
               default:
                  poll(t);
            }
         });
      });
   }

   private void hold(Tracked t) {
      if (batch.runMillis() <= 0) {
         return;
      }
      t.holding = true;
      t.timer = vertx.setTimer(batch.runMillis(), id -> {
         t.timer = -1;
         log.debug("{} stayed for {} ms, closing it", t.spec.username(), batch.runMillis());
         release(t).onComplete(nil -> {
            t.holding = false;
            checkDone();
         });
      });
   }

   private Future<Void> release(Tracked t) {
      if (t.released || t.participantId == null) {
         return Future.succeededFuture();
      }
      t.released = true;
      return clients.get(t.worker.index).delete(t.participantId)
            .onFailure(e -> log.warn("Closing {} on {} failed: {}", t.participantId, t.worker, e.getMessage()))
            .<Void>mapEmpty()
            .otherwiseEmpty();
   }

   private void settle(Tracked t, Outcome outcome, String reason) {
      t.outcome = outcome;
      t.reason = reason;
      if (outcome == Outcome.JOINED) {
         log.info("{} joined after {} ms", t.spec.username(), System.currentTimeMillis() - startedAt);
      } else {
         log.warn("{} {}: {}", t.spec.username(), outcome.value, reason);
      }
      checkDone();
   }

   private void checkDone() {
      if (finishing) {
         return;
      }
      for (Tracked t : tracked) {
         if (t.outcome == null || t.holding) {
            return;
         }
      }
      finish();
   }

   private void finish() {
      finishing = true;
      if (timeoutTimer >= 0) {
         vertx.cancelTimer(timeoutTimer);
         timeoutTimer = -1;
      }
      List<Tracked> toRelease = new ArrayList<>();
      for (Tracked t : tracked) {
         if (t.timer >= 0) {
            vertx.cancelTimer(t.timer);
            t.timer = -1;
         }
         if (t.outcome == null) {
            t.outcome = cancelled ? Outcome.FAILED : Outcome.TIMED_OUT;
            t.reason = cancelled ? "Batch cancelled" : "Not active within the batch timeout of " + batch.timeoutMillis() + " ms";
         }
         // without a hold time joined participants are left running unless the batch is cancelled
         boolean keepRunning = t.outcome == Outcome.JOINED && batch.runMillis() <= 0 && !cancelled;
         if (t.participantId != null && !t.released && !keepRunning) {
            toRelease.add(t);
         }
      }
      if (toRelease.isEmpty()) {
         complete();
         return;
      }
      log.info("Closing {} participant(s) still running", toRelease.size());
      Promise<Void> released = Promise.promise();
      CountDown countDown = new CountDown(released, toRelease.size());
      for (Tracked t : toRelease) {
         release(t).onComplete(nil -> countDown.countDown());
      }
      released.future().onComplete(nil -> context.runOnContext(v -> complete()));
   }

   private void complete() {
      List<ParticipantOutcome> outcomes = new ArrayList<>();
      for (Tracked t : tracked) {
         outcomes.add(new ParticipantOutcome(t.spec.username(), t.worker.url, t.participantId, t.outcome, t.reason, t.attempts));
      }
      BatchSummary summary = new BatchSummary(batch.sessionUrl(), startedAt, System.currentTimeMillis(), cancelled, outcomes);
      log.info("Batch finished: {}", summary);
      for (ParticipantOutcome outcome : outcomes) {
         log.info("  {}", outcome);
      }
      if (summaryFile == null) {
         promise.complete(summary);
         return;
      }
      vertx.fileSystem().writeFile(summaryFile, Buffer.buffer(summary.toJson().encodePrettily()))
            .onSuccess(nil -> log.info("Summary written to {}", summaryFile))
            .onFailure(e -> log.error(new FormattedMessage("Cannot write summary to {}", summaryFile), e))
            .onComplete(nil -> promise.complete(summary));
   }

   /**
    * Releases the worker connections; participants left running keep running.
    */
   public void close() {
      clients.forEach(WorkerClient::close);
   }

   private static class Tracked {
      final ParticipantSpec spec;
      final WorkerRef worker;
      int attempts;
      long timer = -1;
      String participantId;
      Outcome outcome;
      String reason;
      boolean holding;
      boolean released;

      Tracked(ParticipantSpec spec, WorkerRef worker) {
         this.spec = spec;
         this.worker = worker;
      }
   }
}
