package io.roomswarm.api.config;

import java.io.Serializable;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

import io.vertx.core.json.JsonObject;

/**
 * Who the participant is and where it goes. Fixed for the lifetime of the participant.
 */
public final class ParticipantIdentity implements Serializable {
   private final String username;
   private final String sessionUrl;
   private final MediaSettings media;
   private final StrategyKind strategy;

   public ParticipantIdentity(String username, String sessionUrl, MediaSettings media, StrategyKind strategy) {
      this.username = Objects.requireNonNull(username, "username");
      this.sessionUrl = Objects.requireNonNull(sessionUrl, "sessionUrl");
      this.media = media == null ? MediaSettings.DEFAULT : media;
      this.strategy = strategy == null ? StrategyKind.PROTOCOL : strategy;
   }

   public String username() {
      return username;
   }

   public String sessionUrl() {
      return sessionUrl;
   }

   public MediaSettings media() {
      return media;
   }

   public StrategyKind strategy() {
      return strategy;
   }

   /**
    * Scheme, host and port of the session URL, e.g. {@code https://meet.example.com}.
    */
   public String origin() {
      URI uri = URI.create(sessionUrl);
      StringBuilder sb = new StringBuilder(uri.getScheme()).append("://").append(uri.getHost());
      if (uri.getPort() >= 0) {
         sb.append(':').append(uri.getPort());
      }
      return sb.toString();
   }

   /**
    * Last path segment of the session URL, the space (meeting) name.
    */
   public String space() {
      String path = URI.create(sessionUrl).getPath();
      if (path == null || path.isEmpty()) {
         return "";
      }
      while (path.endsWith("/")) {
         path = path.substring(0, path.length() - 1);
      }
      return path.substring(path.lastIndexOf('/') + 1);
   }

   public JsonObject toJson() {
      return new JsonObject()
            .put("username", username)
            .put("sessionUrl", sessionUrl)
            .put("strategy", strategy.value)
            .put("media", media.toJson());
   }

   /**
    * @throws IllegalArgumentException when required fields are missing or enum values are unknown.
    */
   public static ParticipantIdentity fromJson(JsonObject json) {
      String username = json.getString("username");
      String sessionUrl = json.getString("sessionUrl");
      if (username == null || username.isBlank()) {
         throw new IllegalArgumentException("Missing 'username'");
      }
      if (sessionUrl == null || sessionUrl.isBlank()) {
         throw new IllegalArgumentException("Missing 'sessionUrl'");
      }
      try {
         URI uri = new URI(sessionUrl);
         if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalArgumentException("Session URL must be absolute: " + sessionUrl);
         }
      } catch (URISyntaxException e) {
         throw new IllegalArgumentException("Invalid session URL: " + sessionUrl, e);
      }
      String strategy = json.getString("strategy");
      return new ParticipantIdentity(username, sessionUrl, MediaSettings.fromJson(json.getJsonObject("media")),
            strategy == null ? null : StrategyKind.fromString(strategy));
   }

   @Override
   public String toString() {
      return username + "@" + sessionUrl + " (" + strategy + ")";
   }
}
