package io.roomswarm.api;

public class SimulatorException extends RuntimeException {
   private final ErrorKind kind;

   public SimulatorException(ErrorKind kind, String message) {
      super(message);
      this.kind = kind;
   }

   public SimulatorException(ErrorKind kind, String message, Throwable cause) {
      super(message, cause);
      this.kind = kind;
   }

   public ErrorKind kind() {
      return kind;
   }
}
