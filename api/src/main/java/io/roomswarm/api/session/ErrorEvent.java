package io.roomswarm.api.session;

import io.roomswarm.api.ErrorKind;
import io.vertx.core.json.JsonObject;

/**
 * Non-fatal failure, e.g. a media toggle that was not acknowledged. The participant stays in its state.
 */
public class ErrorEvent extends ParticipantEvent {
   public static final String TYPE = "error";

   private final ErrorKind errorKind;
   private final String message;

   public ErrorEvent(String participantId, long timestamp, ErrorKind errorKind, String message) {
      super(participantId, timestamp);
      this.errorKind = errorKind;
      this.message = message;
   }

   public ErrorKind errorKind() {
      return errorKind;
   }

   public String message() {
      return message;
   }

   @Override
   public String type() {
      return TYPE;
   }

   @Override
   protected void writeJson(JsonObject json) {
      json.put("errorKind", errorKind.name()).put("message", message);
   }

   static ErrorEvent decode(JsonObject json) {
      return new ErrorEvent(json.getString("participantId"), json.getLong("timestamp", 0L),
            ErrorKind.valueOf(json.getString("errorKind", ErrorKind.INTERNAL.name())), json.getString("message"));
   }
}
