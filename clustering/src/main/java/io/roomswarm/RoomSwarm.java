package io.roomswarm;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Predicate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import io.roomswarm.api.Version;
import io.roomswarm.api.config.Batch;
import io.roomswarm.api.config.BatchValidationException;
import io.roomswarm.clustering.Codecs;
import io.roomswarm.clustering.GatewayVerticle;
import io.roomswarm.clustering.client.RestWorkerClient;
import io.roomswarm.clustering.orchestrator.BatchSummary;
import io.roomswarm.core.parser.BatchParser;
import io.roomswarm.core.parser.ParserException;
import io.roomswarm.impl.Util;
import io.vertx.core.Vertx;

public class RoomSwarm {
   static final Logger log = LogManager.getLogger(RoomSwarm.class);

   static Vertx startVertx() {
      logVersion();
      Thread.setDefaultUncaughtExceptionHandler(RoomSwarm::defaultUncaughtExceptionHandler);
      log.info("Starting Vert.x...");
      Vertx vertx = Vertx.vertx();
      Codecs.register(vertx);
      return vertx;
   }

   /**
    * Parses and validates the batch file; structural errors are reported like any other violation.
    */
   public static Batch loadBatch(Path file) {
      try {
         return BatchParser.instance().parse(file);
      } catch (ParserException e) {
         throw new BatchValidationException(e.getMessage(), e);
      } catch (IOException e) {
         throw new BatchValidationException("Cannot read " + file + ": " + Util.explainCauses(e), e);
      }
   }

   public static class Worker extends RoomSwarm {
      public static void main(String[] args) {
         Vertx vertx = startVertx();
         vertx.deployVerticle(new GatewayVerticle())
               .onSuccess(id -> Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                  log.info("Shutting down worker...");
                  vertx.close().toCompletionStage().toCompletableFuture().join();
               })))
               .onFailure(error -> {
                  log.error("Cannot start the worker", error);
                  vertx.close().onComplete(nil -> System.exit(1));
               });
      }
   }

   public static class Orchestrator extends RoomSwarm {
      public static void main(String[] args) {
         if (args.length != 1) {
            System.err.println("Usage: " + Orchestrator.class.getName() + " <batch.yaml>");
            System.exit(2);
         }
         Batch batch;
         try {
            batch = loadBatch(Paths.get(args[0]));
         } catch (BatchValidationException e) {
            log.error(e.getMessage());
            System.exit(2);
            return;
         }
         Vertx vertx = startVertx();
         io.roomswarm.clustering.orchestrator.Orchestrator orchestrator =
               new io.roomswarm.clustering.orchestrator.Orchestrator(vertx, batch, worker -> new RestWorkerClient(vertx, worker));
         Thread hook = new Thread(() -> {
            log.info("Interrupted, cancelling the batch...");
            orchestrator.cancel().toCompletionStage().toCompletableFuture().join();
         });
         Runtime.getRuntime().addShutdownHook(hook);
         orchestrator.run()
               .eventually(nil -> {
                  orchestrator.close();
                  return vertx.close();
               })
               .onComplete(result -> {
                  removeShutdownHook(Runtime.getRuntime()::removeShutdownHook, hook);
                  System.exit(exitCode(result.succeeded() ? result.result() : null));
               });
      }

      /**
       * @return false when the JVM is already shutting down and the hook is running or has run
       */
      static boolean removeShutdownHook(Predicate<Thread> remover, Thread hook) {
         try {
            return remover.test(hook);
         } catch (IllegalStateException e) {
            log.debug("JVM is shutting down, keeping the shutdown hook", e);
            return false;
         }
      }

      static int exitCode(BatchSummary summary) {
         if (summary == null) {
            return 1;
         }
         return summary.count(io.roomswarm.clustering.orchestrator.ParticipantOutcome.Outcome.JOINED) == summary.outcomes().size() ? 0 : 1;
      }
   }

   private static void defaultUncaughtExceptionHandler(Thread thread, Throwable throwable) {
      log.error(new FormattedMessage("Uncaught exception in thread {}({})", thread.getName(), thread.getId()), throwable);
   }

   private static void logVersion() {
      log.info("Java: {} {} {} {} ({}), CWD {}",
            System.getProperty("java.vm.vendor", "<unknown VM vendor>"),
            System.getProperty("java.vm.name", "<unknown VM name>"),
            System.getProperty("java.version", "<unknown version>"),
            System.getProperty("java.vm.version", "<unknown VM version>"),
            System.getProperty("java.home", "<unknown Java home>"),
            System.getProperty("user.dir", "<unknown current dir>"));
      log.info("RoomSwarm: {} ({})", Version.VERSION, Version.COMMIT_ID);
      System.getProperties().forEach((n, value) -> {
         String name = String.valueOf(n);
         if (name.startsWith("io.roomswarm.")) {
            log.debug("System property {} = {}", name, value);
         }
      });
   }
}
