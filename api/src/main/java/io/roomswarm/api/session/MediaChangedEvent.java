package io.roomswarm.api.session;

import io.vertx.core.json.JsonObject;

public class MediaChangedEvent extends ParticipantEvent {
   public static final String TYPE = "media-changed";

   private final MediaState media;

   public MediaChangedEvent(String participantId, long timestamp, MediaState media) {
      super(participantId, timestamp);
      this.media = media;
   }

   public MediaState media() {
      return media;
   }

   @Override
   public String type() {
      return TYPE;
   }

   @Override
   protected void writeJson(JsonObject json) {
      json.put("media", media.toJson());
   }

   static MediaChangedEvent decode(JsonObject json) {
      return new MediaChangedEvent(json.getString("participantId"), json.getLong("timestamp", 0L),
            MediaState.fromJson(json.getJsonObject("media", new JsonObject())));
   }
}
