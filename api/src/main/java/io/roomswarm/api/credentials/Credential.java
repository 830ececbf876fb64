package io.roomswarm.api.credentials;

import java.io.Serializable;

import io.vertx.core.json.JsonObject;

/**
 * Opaque session token of one user together with its validity hints.
 */
public final class Credential implements Serializable {
   private final String username;
   private final String token;
   private final long expiresAt;
   private final boolean valid;

   public Credential(String username, String token, long expiresAt, boolean valid) {
      this.username = username;
      this.token = token;
      this.expiresAt = expiresAt;
      this.valid = valid;
   }

   public String username() {
      return username;
   }

   public String token() {
      return token;
   }

   /**
    * Epoch millis after which the backend no longer accepts the token.
    */
   public long expiresAt() {
      return expiresAt;
   }

   public boolean valid() {
      return valid;
   }

   public boolean isUsable(long now) {
      return valid && token != null && !token.isEmpty() && now < expiresAt;
   }

   public Credential invalidated() {
      return new Credential(username, token, expiresAt, false);
   }

   public JsonObject toJson() {
      return new JsonObject()
            .put("username", username)
            .put("token", token)
            .put("expiresAt", expiresAt)
            .put("valid", valid);
   }

   /**
    * @throws IllegalArgumentException when mandatory fields are missing.
    */
   public static Credential fromJson(JsonObject json) {
      String username = json.getString("username");
      String token = json.getString("token");
      Long expiresAt = json.getLong("expiresAt");
      if (username == null || token == null || expiresAt == null) {
         throw new IllegalArgumentException("Incomplete credential record");
      }
      return new Credential(username, token, expiresAt, json.getBoolean("valid", true));
   }

   @Override
   public String toString() {
      // never log the token itself
      return "Credential{username=" + username + ", expiresAt=" + expiresAt + ", valid=" + valid + "}";
   }
}
