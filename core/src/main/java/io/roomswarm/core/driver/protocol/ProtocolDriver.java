package io.roomswarm.core.driver.protocol;

import java.net.URI;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.roomswarm.api.ErrorKind;
import io.roomswarm.api.SimulatorException;
import io.roomswarm.api.UnreachableException;
import io.roomswarm.api.config.MediaSettings;
import io.roomswarm.api.config.NoiseSuppression;
import io.roomswarm.api.config.ParticipantIdentity;
import io.roomswarm.api.config.StrategyKind;
import io.roomswarm.api.config.WebcamResolution;
import io.roomswarm.api.credentials.Credential;
import io.roomswarm.api.driver.ParticipantDriver;
import io.roomswarm.api.session.CommandKind;
import io.roomswarm.api.session.MediaState;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.WebSocketConnectOptions;
import io.vertx.core.json.JsonObject;

/**
 * Joins the session over the signaling WebSocket without any rendering. UI-only features
 * (blur, noise suppression) are not available.
 */
public class ProtocolDriver implements ParticipantDriver {
   private static final Logger log = LogManager.getLogger(ProtocolDriver.class);
   public static final String DEFAULT_SIGNALING_PATH = "/api/v1/signaling";

   private final Vertx vertx;
   private final HttpClient client;
   private final ParticipantIdentity identity;
   private final String signalingPath;
   private final long requestTimeout;
   private SignalingConnection connection;
   private Handler<Throwable> disconnectHandler = cause -> {};

   public ProtocolDriver(Vertx vertx, HttpClient client, ParticipantIdentity identity, String signalingPath, long requestTimeout) {
      this.vertx = vertx;
      this.client = client;
      this.identity = identity;
      this.signalingPath = signalingPath;
      this.requestTimeout = requestTimeout;
   }

   @Override
   public StrategyKind kind() {
      return StrategyKind.PROTOCOL;
   }

   @Override
   public boolean supports(CommandKind command) {
      return command != CommandKind.TOGGLE_BLUR && command != CommandKind.SET_NOISE_SUPPRESSION;
   }

   WebSocketConnectOptions connectOptions() {
      URI uri = URI.create(identity.sessionUrl());
      boolean ssl = "https".equalsIgnoreCase(uri.getScheme()) || "wss".equalsIgnoreCase(uri.getScheme());
      int port = uri.getPort() >= 0 ? uri.getPort() : (ssl ? 443 : 80);
      return new WebSocketConnectOptions()
            .setHost(uri.getHost())
            .setPort(port)
            .setSsl(ssl)
            .setURI(signalingPath);
   }

   @Override
   public Future<Void> authenticate(Credential credential) {
      Future<Void> previous = connection == null ? Future.succeededFuture() : connection.close();
      connection = null;
      return previous.recover(e -> Future.succeededFuture())
            .compose(nil -> SignalingConnection.connect(vertx, client, connectOptions(), identity.username(), requestTimeout))
            .compose(conn -> {
               connection = conn;
               conn.pushHandler(this::handlePush);
               conn.closeHandler(cause -> disconnectHandler.handle(cause));
               return conn.request("hello", new JsonObject()
                     .put("token", credential.token())
                     .put("username", identity.username())
                     .put("transport", identity.media().transport().value), "welcome");
            })
            .onSuccess(welcome -> log.debug("{}: signaling session {} established", identity.username(), welcome.getString("session")))
            .mapEmpty();
   }

   @Override
   public Future<Void> join() {
      return connection().compose(conn -> conn.request("join", new JsonObject()
            .put("space", identity.space())
            .put("name", identity.username()), "joined"))
            .mapEmpty();
   }

   @Override
   public Future<MediaState> startMedia(MediaSettings settings) {
      return connection().compose(conn -> conn.request("media", new JsonObject()
            .put("audio", settings.audioEnabled())
            .put("video", settings.videoEnabled())
            .put("screenshare", settings.screenshareEnabled())
            .put("resolution", settings.resolution().value)
            .put("fakeMedia", settings.fakeMedia().toString()), "media-ack"))
            .map(ack -> new MediaState(
                  ack.getBoolean("audio", settings.audioEnabled()),
                  ack.getBoolean("video", settings.videoEnabled()),
                  ack.getBoolean("screenshare", settings.screenshareEnabled()),
                  false, NoiseSuppression.NONE, settings.resolution()));
   }

   @Override
   public Future<Void> toggle(CommandKind toggle, boolean enabled) {
      String kind;
      switch (toggle) {
         case TOGGLE_AUDIO:
            kind = "audio";
            break;
         case TOGGLE_VIDEO:
            kind = "video";
            break;
         case TOGGLE_SCREENSHARE:
            kind = "screenshare";
            break;
         default:
            return Future.failedFuture(new SimulatorException(ErrorKind.INTERNAL, "Protocol strategy cannot " + toggle));
      }
      return connection().compose(conn -> conn.request("toggle", new JsonObject()
            .put("kind", kind).put("enabled", enabled), "media-ack"))
            .mapEmpty();
   }

   @Override
   public Future<Void> setNoiseSuppression(NoiseSuppression level) {
      return Future.failedFuture(new SimulatorException(ErrorKind.INTERNAL, "Protocol strategy has no noise suppression"));
   }

   @Override
   public Future<Void> setResolution(WebcamResolution resolution) {
      return connection().compose(conn -> conn.request("media", new JsonObject()
            .put("resolution", resolution.value), "media-ack"))
            .mapEmpty();
   }

   @Override
   public Future<Void> leave() {
      return connection().compose(conn -> conn.request("leave", new JsonObject(), "left")).mapEmpty();
   }

   @Override
   public Future<Void> release() {
      SignalingConnection conn = connection;
      if (conn == null) {
         return Future.succeededFuture();
      }
      return conn.close();
   }

   @Override
   public void forceRelease() {
      SignalingConnection conn = connection;
      if (conn != null) {
         conn.close().onFailure(e -> log.debug("{}: closing signaling connection failed: {}", identity.username(), e.getMessage()));
      }
   }

   @Override
   public void disconnectHandler(Handler<Throwable> handler) {
      this.disconnectHandler = handler;
   }

   private Future<SignalingConnection> connection() {
      SignalingConnection conn = connection;
      if (conn == null || conn.isClosed()) {
         return Future.failedFuture(new UnreachableException("Signaling connection of " + identity.username() + " is not open"));
      }
      return Future.succeededFuture(conn);
   }

   private void handlePush(JsonObject frame) {
      String type = frame.getString(SignalingConnection.TYPE);
      if ("kick".equals(type)) {
         String reason = frame.getString("reason", "no reason given");
         log.info("{} was removed from the session: {}", identity.username(), reason);
         SignalingConnection conn = connection;
         if (conn != null) {
            conn.close().onFailure(e -> log.debug("{}: closing after kick failed: {}", identity.username(), e.getMessage()));
         }
         disconnectHandler.handle(new UnreachableException("Removed from the session: " + reason));
      } else {
         log.trace("{}: ignoring push {}", identity.username(), type);
      }
   }
}
