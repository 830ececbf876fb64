package io.roomswarm.api.driver;

import io.vertx.core.Future;

/**
 * Remote-controlled browser-like process. Only this narrow contract is used, any automation technology can back it.
 */
public interface RenderingSurface {
   Future<Void> navigate(String url);

   /**
    * Completes when an element matching the selector is present, fails with
    * {@link io.roomswarm.api.ParticipantTimeoutException} when none appears in time.
    */
   Future<Void> waitFor(String selector, long timeoutMillis);

   /**
    * @param action {@code click} or {@code type}
    * @param value text typed for {@code type}, ignored otherwise
    */
   Future<Void> invoke(String selector, String action, String value);

   /**
    * @return value of the expression converted to text, {@code null} when it yields nothing
    */
   Future<String> evaluate(String script);

   Future<Void> close();
}
