package io.roomswarm.api.credentials;

import io.vertx.core.Future;

public interface CredentialStore {
   /**
    * Returns a usable credential, logging in when none is cached or the cached one was invalidated.
    * Fails with {@link io.roomswarm.api.CredentialException} when the login flow keeps failing.
    */
   Future<Credential> get(String username);

   /**
    * Next {@link #get(String)} for this user performs a fresh login.
    */
   void invalidate(String username);
}
