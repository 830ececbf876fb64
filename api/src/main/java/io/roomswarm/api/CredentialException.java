package io.roomswarm.api;

public class CredentialException extends SimulatorException {
   public CredentialException(String message) {
      super(ErrorKind.CREDENTIAL, message);
   }

   public CredentialException(String message, Throwable cause) {
      super(ErrorKind.CREDENTIAL, message, cause);
   }
}
