package io.roomswarm.clustering;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.roomswarm.core.session.ParticipantFactory;
import io.roomswarm.internal.Properties;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;

/**
 * Worker process: hosts participants and exposes them through {@link GatewayServer}.
 */
public class GatewayVerticle extends AbstractVerticle {
   private static final Logger log = LogManager.getLogger(GatewayVerticle.class);

   private final ParticipantFactory factory;
   private ParticipantRegistry registry;
   private GatewayServer server;

   public GatewayVerticle() {
      this(null);
   }

   /**
    * @param factory participant factory, or {@code null} to create the default one on start
    */
   public GatewayVerticle(ParticipantFactory factory) {
      this.factory = factory;
   }

   @Override
   public void start(Promise<Void> startPromise) {
      vertx.exceptionHandler(throwable -> log.error("Uncaught error: ", throwable));
      registry = new ParticipantRegistry(vertx, factory == null ? ParticipantFactory.create(vertx) : factory);
      server = new GatewayServer(vertx, registry);
      String host = Properties.get(Properties.GATEWAY_HOST, config().getString(Properties.GATEWAY_HOST, "0.0.0.0"));
      int port = Properties.getInt(Properties.GATEWAY_PORT, config().getInteger(Properties.GATEWAY_PORT, 8080));
      server.listen(host, port).<Void>mapEmpty().onComplete(startPromise);
   }

   @Override
   public void stop(Promise<Void> stopPromise) {
      registry.closeAll()
            .eventually(nil -> server.close())
            .onComplete(stopPromise);
   }

   public int actualPort() {
      return server == null ? -1 : server.actualPort();
   }

   public ParticipantRegistry registry() {
      return registry;
   }
}
