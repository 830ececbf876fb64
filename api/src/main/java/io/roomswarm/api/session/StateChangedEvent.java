package io.roomswarm.api.session;

import io.roomswarm.api.ErrorKind;
import io.vertx.core.json.JsonObject;

public class StateChangedEvent extends ParticipantEvent {
   public static final String TYPE = "state-changed";

   private final ParticipantState from;
   private final ParticipantState to;
   private final String reason;
   private final ErrorKind errorKind;
   private final boolean forced;

   public StateChangedEvent(String participantId, long timestamp, ParticipantState from, ParticipantState to,
                            String reason, ErrorKind errorKind, boolean forced) {
      super(participantId, timestamp);
      this.from = from;
      this.to = to;
      this.reason = reason;
      this.errorKind = errorKind;
      this.forced = forced;
   }

   public ParticipantState from() {
      return from;
   }

   public ParticipantState to() {
      return to;
   }

   /**
    * Human-readable reason, set for terminal transitions.
    */
   public String reason() {
      return reason;
   }

   public ErrorKind errorKind() {
      return errorKind;
   }

   /**
    * Participant was torn down after its close grace period expired.
    */
   public boolean forced() {
      return forced;
   }

   @Override
   public String type() {
      return TYPE;
   }

   @Override
   protected void writeJson(JsonObject json) {
      json.put("from", from.name()).put("to", to.name()).put("forced", forced);
      if (reason != null) {
         json.put("reason", reason);
      }
      if (errorKind != null) {
         json.put("errorKind", errorKind.name());
      }
   }

   static StateChangedEvent decode(JsonObject json) {
      String errorKind = json.getString("errorKind");
      return new StateChangedEvent(json.getString("participantId"), json.getLong("timestamp", 0L),
            ParticipantState.valueOf(json.getString("from")), ParticipantState.valueOf(json.getString("to")),
            json.getString("reason"), errorKind == null ? null : ErrorKind.valueOf(errorKind),
            json.getBoolean("forced", false));
   }
}
