package io.roomswarm.api.session;

import java.io.Serializable;

import io.vertx.core.json.JsonObject;

/**
 * Notification emitted by a participant. Events are immutable and safe to hand over between threads.
 */
public abstract class ParticipantEvent implements Serializable {
   private final String participantId;
   private final long timestamp;

   protected ParticipantEvent(String participantId, long timestamp) {
      this.participantId = participantId;
      this.timestamp = timestamp;
   }

   public String participantId() {
      return participantId;
   }

   public long timestamp() {
      return timestamp;
   }

   public abstract String type();

   protected abstract void writeJson(JsonObject json);

   public JsonObject toJson() {
      JsonObject json = new JsonObject()
            .put("type", type())
            .put("participantId", participantId)
            .put("timestamp", timestamp);
      writeJson(json);
      return json;
   }

   public static ParticipantEvent fromJson(JsonObject json) {
      String type = json.getString("type");
      if (type == null) {
         throw new IllegalArgumentException("Event without type: " + json.encode());
      }
      switch (type) {
         case StateChangedEvent.TYPE:
            return StateChangedEvent.decode(json);
         case LogEvent.TYPE:
            return LogEvent.decode(json);
         case ErrorEvent.TYPE:
            return ErrorEvent.decode(json);
         case MediaChangedEvent.TYPE:
            return MediaChangedEvent.decode(json);
         default:
            throw new IllegalArgumentException("Unknown event type: " + type);
      }
   }

   @Override
   public String toString() {
      return toJson().encode();
   }
}
