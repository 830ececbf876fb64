package io.roomswarm.api.session;

import io.vertx.core.json.JsonObject;

public class LogEvent extends ParticipantEvent {
   public static final String TYPE = "log";

   public enum Level {
      DEBUG,
      INFO,
      WARN,
      ERROR
   }

   private final Level level;
   private final String username;
   private final String message;

   public LogEvent(String participantId, long timestamp, Level level, String username, String message) {
      super(participantId, timestamp);
      this.level = level;
      this.username = username;
      this.message = message;
   }

   public Level level() {
      return level;
   }

   public String username() {
      return username;
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
      json.put("level", level.name()).put("username", username).put("message", message);
   }

   static LogEvent decode(JsonObject json) {
      return new LogEvent(json.getString("participantId"), json.getLong("timestamp", 0L),
            Level.valueOf(json.getString("level", "INFO")), json.getString("username"), json.getString("message"));
   }
}
