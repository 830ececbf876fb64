package io.roomswarm.clustering.client;

import io.roomswarm.api.ErrorKind;
import io.roomswarm.api.SimulatorException;

/**
 * Worker replied with a status the client did not expect. The kind is the one reported by the worker, if any.
 */
public class RestClientException extends SimulatorException {
   private final int statusCode;

   public RestClientException(ErrorKind kind, int statusCode, String message) {
      super(kind, message);
      this.statusCode = statusCode;
   }

   public RestClientException(String message, Throwable cause) {
      super(ErrorKind.INTERNAL, message, cause);
      this.statusCode = -1;
   }

   public int statusCode() {
      return statusCode;
   }
}
