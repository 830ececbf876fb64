package io.roomswarm.core.credentials;

import java.io.IOException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import io.roomswarm.api.CredentialException;
import io.roomswarm.api.credentials.Credential;
import io.roomswarm.api.credentials.CredentialStore;
import io.roomswarm.api.credentials.LoginFlow;
import io.roomswarm.impl.Util;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

/**
 * Shared credential cache. Concurrent requests for the same user are folded into a single login;
 * requests for different users never wait for each other.
 */
public class SessionCredentialStore implements CredentialStore {
   private static final Logger log = LogManager.getLogger(SessionCredentialStore.class);

   private final Vertx vertx;
   private final LoginFlow loginFlow;
   private final CredentialPersistence persistence;
   private final ConcurrentMap<String, Credential> cache = new ConcurrentHashMap<>();
   private final ConcurrentMap<String, Future<Credential>> inFlight = new ConcurrentHashMap<>();

   /**
    * @param persistence durable store, {@code null} keeps credentials in memory only
    */
   public SessionCredentialStore(Vertx vertx, LoginFlow loginFlow, CredentialPersistence persistence) {
      this.vertx = vertx;
      this.loginFlow = loginFlow;
      this.persistence = persistence;
   }

   @Override
   public Future<Credential> get(String username) {
      Credential cached = cache.get(username);
      if (cached != null && cached.isUsable(System.currentTimeMillis())) {
         return Future.succeededFuture(cached);
      }
      Promise<Credential> promise = Promise.promise();
      Future<Credential> existing = inFlight.putIfAbsent(username, promise.future());
      if (existing != null) {
         log.trace("Joining in-flight credential refresh for {}", username);
         return existing;
      }
      resolve(username).onComplete(result -> {
         // the cache is updated before the in-flight entry disappears so that late callers find the result
         inFlight.remove(username, promise.future());
         promise.handle(result);
      });
      return promise.future();
   }

   @Override
   public void invalidate(String username) {
      log.debug("Invalidating credential of {}", username);
      cache.compute(username, (u, c) -> c == null ? new Credential(u, null, 0, false) : c.invalidated());
      if (persistence != null) {
         vertx.<Void>executeBlocking(promise -> {
            try {
               persistence.invalidate(username);
               promise.complete();
            } catch (IOException e) {
               promise.fail(e);
            }
         }, false).onFailure(e -> log.warn(new FormattedMessage("Cannot invalidate persisted credential of {}", username), e));
      }
   }

   private Future<Credential> resolve(String username) {
      Credential cached = cache.get(username);
      if (cached != null && cached.isUsable(System.currentTimeMillis())) {
         return Future.succeededFuture(cached);
      }
      if (cached == null && persistence != null) {
         return loadPersisted(username).compose(persisted -> persisted != null ? Future.succeededFuture(persisted) : login(username));
      }
      return login(username);
   }

   private Future<Credential> loadPersisted(String username) {
      return vertx.<Credential>executeBlocking(promise -> promise.complete(persistence.load(username)), false)
            .compose(persisted -> {
               if (persisted == null || !persisted.isUsable(System.currentTimeMillis())) {
                  return Future.succeededFuture(null);
               }
               return loginFlow.validate(persisted).map(valid -> {
                  if (valid) {
                     log.debug("Reusing persisted credential of {}", username);
                     cache.put(username, persisted);
                     return persisted;
                  }
                  log.debug("Persisted credential of {} was rejected", username);
                  return null;
               }).otherwise(e -> {
                  log.warn("Cannot validate persisted credential of {}: {}", username, Util.explainCauses(e));
                  return null;
               });
            });
   }

   private Future<Credential> login(String username) {
      log.debug("Logging in {}", username);
      return loginFlow.login(username)
            .recover(e -> {
               log.warn("Login of {} failed, retrying: {}", username, Util.explainCauses(e));
               return loginFlow.login(username);
            })
            .recover(e -> Future.failedFuture(new CredentialException("Login of " + username + " failed: " + Util.explainCauses(e), e)))
            .compose(this::persist)
            .onSuccess(credential -> cache.put(username, credential));
   }

   private Future<Credential> persist(Credential credential) {
      if (persistence == null) {
         return Future.succeededFuture(credential);
      }
      return vertx.<Credential>executeBlocking(promise -> {
         try {
            persistence.store(credential);
         } catch (IOException e) {
            // the credential is still usable in memory
            log.warn(new FormattedMessage("Cannot persist credential of {} in {}", credential.username(), persistence.dir()), e);
         }
         promise.complete(credential);
      }, false);
   }
}
