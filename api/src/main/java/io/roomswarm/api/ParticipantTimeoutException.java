package io.roomswarm.api;

public class ParticipantTimeoutException extends SimulatorException {
   public ParticipantTimeoutException(String operation, long timeoutMillis) {
      super(ErrorKind.TIMEOUT, operation + " did not complete within " + timeoutMillis + " ms");
   }
}
