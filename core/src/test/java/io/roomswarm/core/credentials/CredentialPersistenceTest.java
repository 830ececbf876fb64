package io.roomswarm.core.credentials;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.roomswarm.api.credentials.Credential;

public class CredentialPersistenceTest {
   @TempDir
   Path dir;

   @Test
   public void testStoreAndLoad() throws Exception {
      CredentialPersistence persistence = new CredentialPersistence(dir.resolve("nested"));
      persistence.store(new Credential("alice smith", "abc", 1234, true));
      Credential loaded = persistence.load("alice smith");
      assertEquals("abc", loaded.token());
      assertEquals(1234, loaded.expiresAt());
      assertTrue(loaded.valid());
      assertNull(persistence.load("bob"));
      // no temporary files left behind
      try (var files = Files.list(dir.resolve("nested"))) {
         assertEquals(1, files.count());
      }
   }

   @Test
   public void testCorruptRecordIsIgnored() throws Exception {
      CredentialPersistence persistence = new CredentialPersistence(dir);
      Files.writeString(persistence.file("alice"), "{ \"username\": \"alice\", \"tok", StandardCharsets.UTF_8);
      assertNull(persistence.load("alice"));
      Files.writeString(persistence.file("alice"), "{ \"username\": \"alice\" }", StandardCharsets.UTF_8);
      assertNull(persistence.load("alice"));
   }

   @Test
   public void testRecordOfAnotherUserIsIgnored() throws Exception {
      CredentialPersistence persistence = new CredentialPersistence(dir);
      persistence.store(new Credential("bob", "abc", 1234, true));
      Files.move(persistence.file("bob"), persistence.file("alice"));
      assertNull(persistence.load("alice"));
   }

   @Test
   public void testInvalidate() throws Exception {
      CredentialPersistence persistence = new CredentialPersistence(dir);
      persistence.invalidate("nobody");
      assertNull(persistence.load("nobody"));

      persistence.store(new Credential("alice", "abc", Long.MAX_VALUE, true));
      persistence.invalidate("alice");
      Credential loaded = persistence.load("alice");
      assertFalse(loaded.valid());
      assertFalse(loaded.isUsable(System.currentTimeMillis()));
      assertEquals("abc", loaded.token());
   }
}
