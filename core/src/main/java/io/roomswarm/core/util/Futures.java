package io.roomswarm.core.util;

import io.roomswarm.api.ParticipantTimeoutException;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

public final class Futures {
   private Futures() {
   }

   /**
    * Fails with {@link ParticipantTimeoutException} unless the future completes within the bound.
    * The underlying operation is not cancelled.
    */
   public static <T> Future<T> withTimeout(Vertx vertx, Future<T> future, long timeoutMillis, String operation) {
      if (future.isComplete()) {
         return future;
      }
      Promise<T> promise = Promise.promise();
      long timerId = vertx.setTimer(timeoutMillis, id -> promise.tryFail(new ParticipantTimeoutException(operation, timeoutMillis)));
      future.onComplete(result -> {
         vertx.cancelTimer(timerId);
         if (result.succeeded()) {
            promise.tryComplete(result.result());
         } else {
            promise.tryFail(result.cause());
         }
      });
      return promise.future();
   }

   /**
    * Exponential backoff: {@code base * 2^attempt}, capped at {@code max}.
    */
   public static long backoff(long base, int attempt, long max) {
      if (attempt >= 30) {
         return max;
      }
      return Math.min(max, base << attempt);
   }
}
