package io.roomswarm.core.credentials;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import io.roomswarm.api.credentials.Credential;
import io.roomswarm.internal.Properties;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

/**
 * Durable credential records, one JSON file per user. All methods block; call them from a worker thread.
 */
public class CredentialPersistence {
   private static final Logger log = LogManager.getLogger(CredentialPersistence.class);

   private final Path dir;

   public CredentialPersistence(Path dir) {
      this.dir = dir;
   }

   public static CredentialPersistence fromProperties() {
      String dir = Properties.get(Properties.CREDENTIALS_DIR, null);
      if (dir == null) {
         return new CredentialPersistence(Paths.get(System.getProperty("user.home"), ".roomswarm", "credentials"));
      }
      return new CredentialPersistence(Paths.get(dir));
   }

   public Path dir() {
      return dir;
   }

   Path file(String username) {
      return dir.resolve(URLEncoder.encode(username, StandardCharsets.UTF_8) + ".json");
   }

   /**
    * @return stored record or {@code null} when there is none or it cannot be read.
    */
   public Credential load(String username) {
      Path file = file(username);
      if (!Files.exists(file)) {
         return null;
      }
      try {
         Credential credential = Credential.fromJson(new JsonObject(Files.readString(file, StandardCharsets.UTF_8)));
         if (!username.equals(credential.username())) {
            log.warn("Credential file {} belongs to {}, ignoring it.", file, credential.username());
            return null;
         }
         return credential;
      } catch (IOException | DecodeException | IllegalArgumentException | ClassCastException e) {
         log.warn(new FormattedMessage("Ignoring unreadable credential record {}", file), e);
         return null;
      }
   }

   /**
    * Replaces the record atomically: readers see either the old or the new content.
    */
   public void store(Credential credential) throws IOException {
      Files.createDirectories(dir);
      Path target = file(credential.username());
      Path tmp = Files.createTempFile(dir, ".credential-", ".tmp");
      try {
         Files.writeString(tmp, credential.toJson().encodePrettily(), StandardCharsets.UTF_8);
         try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
         } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported in {}, falling back to plain replace", dir);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
         }
      } finally {
         Files.deleteIfExists(tmp);
      }
   }

   public void invalidate(String username) throws IOException {
      Credential credential = load(username);
      if (credential != null && credential.valid()) {
         store(credential.invalidated());
      }
   }
}
