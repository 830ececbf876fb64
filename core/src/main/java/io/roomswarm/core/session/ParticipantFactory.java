package io.roomswarm.core.session;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.roomswarm.api.config.ParticipantIdentity;
import io.roomswarm.api.credentials.CredentialStore;
import io.roomswarm.api.driver.ParticipantDriver;
import io.roomswarm.core.credentials.CredentialPersistence;
import io.roomswarm.core.credentials.GuestLoginFlow;
import io.roomswarm.core.credentials.SessionCredentialStore;
import io.roomswarm.core.driver.DefaultDriverFactory;
import io.roomswarm.core.driver.DriverFactory;
import io.vertx.core.Vertx;
import io.vertx.ext.web.client.WebClient;

/**
 * Creates and starts participants. Participants joining the same backend share one credential store.
 */
public class ParticipantFactory {
   private static final Logger log = LogManager.getLogger(ParticipantFactory.class);

   private final Vertx vertx;
   private final DriverFactory drivers;
   private final Function<String, CredentialStore> storeFactory;
   private final ParticipantTimeouts timeouts;
   private final Map<String, CredentialStore> stores = new ConcurrentHashMap<>();

   public ParticipantFactory(Vertx vertx, DriverFactory drivers, Function<String, CredentialStore> storeFactory, ParticipantTimeouts timeouts) {
      this.vertx = vertx;
      this.drivers = drivers;
      this.storeFactory = storeFactory;
      this.timeouts = timeouts;
   }

   /**
    * Guest logins persisted under the configured credentials directory, one subdirectory per backend.
    */
   public static ParticipantFactory create(Vertx vertx) {
      WebClient client = WebClient.create(vertx);
      CredentialPersistence root = CredentialPersistence.fromProperties();
      Function<String, CredentialStore> stores = origin -> new SessionCredentialStore(vertx, new GuestLoginFlow(client, origin),
            new CredentialPersistence(root.dir().resolve(URLEncoder.encode(origin, StandardCharsets.UTF_8))));
      return new ParticipantFactory(vertx, new DefaultDriverFactory(vertx), stores, ParticipantTimeouts.fromProperties());
   }

   public CredentialStore credentials(String origin) {
      return stores.computeIfAbsent(origin, o -> {
         log.debug("Creating credential store for {}", o);
         return storeFactory.apply(o);
      });
   }

   /**
    * The participant is not started; subscribe first, then call {@link ParticipantActor#start()}.
    */
   public ParticipantActor create(String id, ParticipantIdentity identity) {
      ParticipantDriver driver = drivers.create(id, identity);
      ParticipantActor actor = new ParticipantActor(id, identity, vertx, vertx.getOrCreateContext(), driver,
            credentials(identity.origin()), timeouts);
      log.info("Created {} ({}) for {} using {} strategy", id, identity.username(), identity.sessionUrl(), driver.kind());
      return actor;
   }
}
