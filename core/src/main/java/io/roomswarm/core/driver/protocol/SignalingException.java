package io.roomswarm.core.driver.protocol;

import io.roomswarm.api.ErrorKind;
import io.roomswarm.api.SimulatorException;

/**
 * Backend replied to a signaling request with an error frame.
 */
public class SignalingException extends SimulatorException {
   private final String code;

   public SignalingException(String code, String message) {
      super(ErrorKind.INTERNAL, "Signaling error " + code + (message == null ? "" : ": " + message));
      this.code = code;
   }

   public String code() {
      return code;
   }
}
