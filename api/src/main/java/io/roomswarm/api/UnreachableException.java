package io.roomswarm.api;

public class UnreachableException extends SimulatorException {
   public UnreachableException(String message) {
      super(ErrorKind.UNREACHABLE, message);
   }

   public UnreachableException(String message, Throwable cause) {
      super(ErrorKind.UNREACHABLE, message, cause);
   }
}
