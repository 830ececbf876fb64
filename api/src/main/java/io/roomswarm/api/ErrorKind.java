package io.roomswarm.api;

/**
 * Classification of failures surfaced to callers of the gateway and in participant events.
 */
public enum ErrorKind {
   /** Login flow failed or the backend kept rejecting the token. */
   CREDENTIAL,
   /** Command is not legal in the current life-cycle stage. */
   INVALID_STATE,
   /** A suspension point exceeded its bound. */
   TIMEOUT,
   /** Worker or backend connection failure. */
   UNREACHABLE,
   /** Malformed or semantically invalid batch definition. */
   VALIDATION,
   INTERNAL,
   /** Participant is already in a terminal state. */
   CLOSED,
   /** Unknown participant id. */
   NOT_FOUND;

   public static ErrorKind of(Throwable t) {
      if (t instanceof SimulatorException) {
         return ((SimulatorException) t).kind();
      }
      return INTERNAL;
   }
}
