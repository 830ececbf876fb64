package io.roomswarm.core.util;

import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Handler;

/**
 * Completes the handler once every expected result arrived, or with the first failure.
 * Results may arrive from different contexts.
 */
public class CountDown {
   private final Handler<AsyncResult<Void>> handler;
   private int value;

   public CountDown(Handler<AsyncResult<Void>> handler, int initialValue) {
      if (initialValue <= 0) {
         throw new IllegalArgumentException();
      }
      this.handler = handler;
      this.value = initialValue;
   }

   public void countDown() {
      boolean done;
      synchronized (this) {
         if (value <= 0) {
            return;
         }
         done = --value == 0;
         if (done) {
            value = -1;
         }
      }
      if (done) {
         handler.handle(Future.succeededFuture());
      }
   }

   public void fail(Throwable cause) {
      synchronized (this) {
         if (value <= 0) {
            return;
         }
         value = -1;
      }
      handler.handle(Future.failedFuture(cause));
   }

   /**
    * Counts down on success, fails on failure.
    */
   public void handle(AsyncResult<?> result) {
      if (result.succeeded()) {
         countDown();
      } else {
         fail(result.cause());
      }
   }
}
