package io.roomswarm.api.session;

import io.roomswarm.api.ErrorKind;
import io.roomswarm.api.config.ParticipantIdentity;
import io.vertx.core.json.JsonObject;

/**
 * Point-in-time view of a participant as reported by the gateway.
 */
public class ParticipantSnapshot {
   private final String id;
   private final ParticipantIdentity identity;
   private final ParticipantState state;
   private final ParticipantState lastActiveState;
   private final MediaState media;
   private final String reason;
   private final ErrorKind errorKind;
   private final boolean forced;
   private final long createdAt;

   public ParticipantSnapshot(String id, ParticipantIdentity identity, ParticipantState state, ParticipantState lastActiveState,
                              MediaState media, String reason, ErrorKind errorKind, boolean forced, long createdAt) {
      this.id = id;
      this.identity = identity;
      this.state = state;
      this.lastActiveState = lastActiveState;
      this.media = media;
      this.reason = reason;
      this.errorKind = errorKind;
      this.forced = forced;
      this.createdAt = createdAt;
   }

   public String id() {
      return id;
   }

   public ParticipantIdentity identity() {
      return identity;
   }

   public ParticipantState state() {
      return state;
   }

   /**
    * The last non-terminal state; tells "never authenticated" from "joined then disconnected".
    */
   public ParticipantState lastActiveState() {
      return lastActiveState;
   }

   public MediaState media() {
      return media;
   }

   public String reason() {
      return reason;
   }

   public ErrorKind errorKind() {
      return errorKind;
   }

   public boolean forced() {
      return forced;
   }

   public long createdAt() {
      return createdAt;
   }

   public JsonObject toJson() {
      JsonObject json = new JsonObject()
            .put("id", id)
            .put("identity", identity.toJson())
            .put("state", state.name())
            .put("lastActiveState", lastActiveState.name())
            .put("media", media.toJson())
            .put("forced", forced)
            .put("createdAt", createdAt);
      if (reason != null) {
         json.put("reason", reason);
      }
      if (errorKind != null) {
         json.put("errorKind", errorKind.name());
      }
      return json;
   }

   public static ParticipantSnapshot fromJson(JsonObject json) {
      String errorKind = json.getString("errorKind");
      return new ParticipantSnapshot(json.getString("id"),
            ParticipantIdentity.fromJson(json.getJsonObject("identity")),
            ParticipantState.valueOf(json.getString("state")),
            ParticipantState.valueOf(json.getString("lastActiveState", json.getString("state"))),
            MediaState.fromJson(json.getJsonObject("media", new JsonObject())),
            json.getString("reason"),
            errorKind == null ? null : ErrorKind.valueOf(errorKind),
            json.getBoolean("forced", false),
            json.getLong("createdAt", 0L));
   }
}
