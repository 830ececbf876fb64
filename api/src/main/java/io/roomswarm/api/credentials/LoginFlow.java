package io.roomswarm.api.credentials;

import io.vertx.core.Future;

public interface LoginFlow {
   Future<Credential> login(String username);

   /**
    * Checks a persisted credential with the backend before it is reused.
    */
   default Future<Boolean> validate(Credential credential) {
      return Future.succeededFuture(true);
   }
}
