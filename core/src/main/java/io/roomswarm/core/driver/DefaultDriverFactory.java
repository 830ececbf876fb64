package io.roomswarm.core.driver;

import java.util.Iterator;
import java.util.ServiceLoader;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.roomswarm.api.ErrorKind;
import io.roomswarm.api.SimulatorException;
import io.roomswarm.api.config.ParticipantIdentity;
import io.roomswarm.api.driver.ParticipantDriver;
import io.roomswarm.api.driver.RenderingSurfaceFactory;
import io.roomswarm.core.driver.protocol.ProtocolDriver;
import io.roomswarm.core.driver.surface.SurfaceDriver;
import io.roomswarm.core.driver.surface.UiSelectors;
import io.roomswarm.internal.Properties;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;

/**
 * Picks the driver by the participant's strategy. Surfaces come from the {@link RenderingSurfaceFactory}
 * registered through {@link ServiceLoader}, unless one is passed explicitly.
 */
public class DefaultDriverFactory implements DriverFactory {
   private static final Logger log = LogManager.getLogger(DefaultDriverFactory.class);

   private final Vertx vertx;
   private final HttpClient signalingClient;
   private final RenderingSurfaceFactory surfaceFactory;
   private final String signalingPath;
   private final long requestTimeout;
   private final long waitTimeout;
   private final int waitRetries;
   private final UiSelectors selectors;

   public DefaultDriverFactory(Vertx vertx, RenderingSurfaceFactory surfaceFactory, long requestTimeout) {
      this.vertx = vertx;
      this.signalingClient = vertx.createHttpClient(new HttpClientOptions().setConnectTimeout((int) Math.min(requestTimeout, Integer.MAX_VALUE)));
      this.surfaceFactory = surfaceFactory;
      this.signalingPath = Properties.get(Properties.SIGNALING_PATH, ProtocolDriver.DEFAULT_SIGNALING_PATH);
      this.requestTimeout = requestTimeout;
      this.waitRetries = Properties.getInt(Properties.SURFACE_WAIT_RETRIES, 3);
      // bound of each single wait, a failed wait is retried
      this.waitTimeout = Properties.getLong(Properties.SURFACE_WAIT_TIMEOUT, 30000);
      this.selectors = UiSelectors.forName(Properties.get(Properties.SURFACE_UI, "classic"));
   }

   public DefaultDriverFactory(Vertx vertx) {
      this(vertx, loadSurfaceFactory(), Properties.getLong(Properties.TIMEOUT_COMMAND, 30000));
   }

   public static RenderingSurfaceFactory loadSurfaceFactory() {
      Iterator<RenderingSurfaceFactory> it = ServiceLoader.load(RenderingSurfaceFactory.class).iterator();
      if (!it.hasNext()) {
         log.info("No rendering surface implementation found, only the protocol strategy is available.");
         return null;
      }
      RenderingSurfaceFactory factory = it.next();
      log.info("Using rendering surface implementation '{}'", factory.name());
      return factory;
   }

   long waitTimeout() {
      return waitTimeout;
   }

   int waitRetries() {
      return waitRetries;
   }

   @Override
   public ParticipantDriver create(String participantId, ParticipantIdentity identity) {
      switch (identity.strategy()) {
         case PROTOCOL:
            return new ProtocolDriver(vertx, signalingClient, identity, signalingPath, requestTimeout);
         case SURFACE:
            if (surfaceFactory == null) {
               throw new SimulatorException(ErrorKind.INTERNAL, "No rendering surface implementation is available for " + identity.username());
            }
            return new SurfaceDriver(vertx, surfaceFactory, identity, selectors, waitTimeout, waitRetries);
         default:
            throw new SimulatorException(ErrorKind.INTERNAL, "Unknown strategy " + identity.strategy());
      }
   }
}
