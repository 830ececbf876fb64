package io.roomswarm.clustering;

import java.util.Comparator;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import io.roomswarm.api.ErrorKind;
import io.roomswarm.api.Version;
import io.roomswarm.api.config.ParticipantIdentity;
import io.roomswarm.api.session.Ack;
import io.roomswarm.api.session.Command;
import io.roomswarm.api.session.CommandKind;
import io.roomswarm.api.session.Participant;
import io.roomswarm.api.session.ParticipantEvent;
import io.roomswarm.api.session.ParticipantSnapshot;
import io.roomswarm.clustering.client.WorkerClient;
import io.roomswarm.impl.Util;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.http.ServerWebSocket;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;

/**
 * REST and WebSocket surface of a worker. Every handler replies asynchronously; no handler waits for a participant.
 */
class GatewayServer {
   private static final Logger log = LogManager.getLogger(GatewayServer.class);

   private static final String MIME_TYPE_JSON = "application/json";
   private static final String MIME_TYPE_TEXT_PLAIN = "text/plain";
   static final String EVENTS_PATH = "/events";

   private final Vertx vertx;
   private final ParticipantRegistry registry;
   private final Router router;
   private HttpServer httpServer;

   GatewayServer(Vertx vertx, ParticipantRegistry registry) {
      this.vertx = vertx;
      this.registry = registry;
      this.router = Router.router(vertx);
      router.route().handler(BodyHandler.create());
      router.get("/").handler(this::index);
      router.get("/healthz").handler(ctx -> ctx.response().putHeader(HttpHeaders.CONTENT_TYPE, MIME_TYPE_TEXT_PLAIN).end("ok"));
      router.post("/participant").handler(this::spawn);
      router.get("/participant").handler(this::list);
      router.get("/participant/:id").handler(this::snapshot);
      router.post("/participant/:id/command/:kind").handler(this::command);
      router.delete("/participant/:id").handler(this::close);
   }

   Future<HttpServer> listen(String host, int port) {
      return vertx.createHttpServer(new HttpServerOptions())
            .requestHandler(router)
            .webSocketHandler(this::events)
            .listen(port, host)
            .onSuccess(server -> {
               httpServer = server;
               log.info("RoomSwarm worker {} listening on {}:{}", Version.VERSION, host, server.actualPort());
            });
   }

   int actualPort() {
      return httpServer == null ? -1 : httpServer.actualPort();
   }

   Future<Void> close() {
      HttpServer server = httpServer;
      httpServer = null;
      return server == null ? Future.succeededFuture() : server.close();
   }

   private void index(RoutingContext ctx) {
      JsonArray routes = new JsonArray(router.getRoutes().stream()
            .filter(route -> route.getPath() != null)
            .map(route -> (route.methods() == null ? "*" : route.methods().stream().map(Object::toString).sorted().collect(Collectors.joining(","))) + " " + route.getPath())
            .sorted(Comparator.naturalOrder())
            .distinct()
            .collect(Collectors.toList()));
      routes.add("WS " + EVENTS_PATH);
      respondWithJson(ctx, HttpResponseStatus.OK, new JsonObject()
            .put("version", Version.VERSION)
            .put("routes", routes));
   }

   private void spawn(RoutingContext ctx) {
      ParticipantIdentity identity;
      String dispatchKey;
      try {
         JsonObject body = ctx.body().asJsonObject();
         if (body == null) {
            respondWithError(ctx, HttpResponseStatus.BAD_REQUEST, ErrorKind.VALIDATION, "Missing participant definition.");
            return;
         }
         identity = ParticipantIdentity.fromJson(body);
         dispatchKey = body.getString(WorkerClient.DISPATCH_KEY);
      } catch (DecodeException | IllegalArgumentException | ClassCastException e) {
         respondWithError(ctx, HttpResponseStatus.BAD_REQUEST, ErrorKind.VALIDATION, "Invalid participant definition: " + Util.explainCauses(e));
         return;
      }
      Participant participant;
      try {
         participant = registry.spawn(identity, dispatchKey);
      } catch (RuntimeException e) {
         log.error(new FormattedMessage("Cannot create participant {}", identity.username()), e);
         respondWithFailure(ctx, e);
         return;
      }
      ctx.response().putHeader(HttpHeaders.LOCATION, "/participant/" + participant.id());
      respondWithJson(ctx, HttpResponseStatus.CREATED, new JsonObject().put("id", participant.id()));
   }

   private void list(RoutingContext ctx) {
      JsonArray array = new JsonArray();
      registry.list().stream()
            .map(Participant::snapshot)
            .sorted(Comparator.comparingLong(ParticipantSnapshot::createdAt))
            .forEach(snapshot -> array.add(snapshot.toJson()));
      ctx.response().putHeader(HttpHeaders.CONTENT_TYPE, MIME_TYPE_JSON).end(array.encodePrettily());
   }

   private void snapshot(RoutingContext ctx) {
      try {
         respondWithJson(ctx, HttpResponseStatus.OK, registry.get(ctx.pathParam("id")).snapshot().toJson());
      } catch (RuntimeException e) {
         respondWithFailure(ctx, e);
      }
   }

   private void command(RoutingContext ctx) {
      CommandKind kind;
      String argument = null;
      try {
         kind = CommandKind.fromString(ctx.pathParam("kind"));
         if (ctx.body().length() > 0) {
            JsonObject body = ctx.body().asJsonObject();
            argument = body == null ? null : body.getString("argument");
         }
      } catch (DecodeException | IllegalArgumentException | ClassCastException e) {
         respondWithError(ctx, HttpResponseStatus.BAD_REQUEST, ErrorKind.VALIDATION, Util.explainCauses(e));
         return;
      }
      replyWithAck(ctx, registry.send(ctx.pathParam("id"), new Command(kind, argument)));
   }

   private void close(RoutingContext ctx) {
      replyWithAck(ctx, registry.close(ctx.pathParam("id")));
   }

   private void replyWithAck(RoutingContext ctx, Future<Ack> future) {
      future.onComplete(result -> {
         if (result.succeeded()) {
            respondWithJson(ctx, HttpResponseStatus.OK, new JsonObject().put("ack", result.result().name()));
         } else {
            respondWithFailure(ctx, result.cause());
         }
      });
   }

   private void events(ServerWebSocket ws) {
      if (!EVENTS_PATH.equals(ws.path())) {
         ws.reject(HttpResponseStatus.NOT_FOUND.code());
         return;
      }
      String participantId = participantFilter(ws.query());
      MessageConsumer<ParticipantEvent> consumer = vertx.eventBus().consumer(Feeds.PARTICIPANT_EVENTS, message -> {
         ParticipantEvent event = message.body();
         if ((participantId == null || participantId.equals(event.participantId())) && !ws.isClosed()) {
            ws.writeTextMessage(event.toJson().encode());
         }
      });
      log.debug("Event stream opened from {} (participant filter: {})", ws.remoteAddress(), participantId);
      ws.closeHandler(nil -> consumer.unregister());
      ws.exceptionHandler(t -> log.debug("Event stream to {} failed: {}", ws.remoteAddress(), t.getMessage()));
   }

   static String participantFilter(String query) {
      if (query == null) {
         return null;
      }
      for (String param : query.split("&")) {
         int eq = param.indexOf('=');
         if (eq > 0 && "participant".equals(param.substring(0, eq))) {
            String value = param.substring(eq + 1);
            return value.isEmpty() ? null : value;
         }
      }
      return null;
   }

   private void respondWithFailure(RoutingContext ctx, Throwable cause) {
      ErrorKind kind = ErrorKind.of(cause);
      HttpResponseStatus status;
      switch (kind) {
         case NOT_FOUND:
            status = HttpResponseStatus.NOT_FOUND;
            break;
         case VALIDATION:
            status = HttpResponseStatus.BAD_REQUEST;
            break;
         case INVALID_STATE:
         case CLOSED:
            status = HttpResponseStatus.CONFLICT;
            break;
         case TIMEOUT:
            status = HttpResponseStatus.GATEWAY_TIMEOUT;
            break;
         case UNREACHABLE:
         case CREDENTIAL:
            status = HttpResponseStatus.BAD_GATEWAY;
            break;
         default:
            status = HttpResponseStatus.INTERNAL_SERVER_ERROR;
            log.error(new FormattedMessage("Request {} {} failed", ctx.request().method(), ctx.request().path()), cause);
      }
      respondWithError(ctx, status, kind, Util.explainCauses(cause));
   }

   private void respondWithError(RoutingContext ctx, HttpResponseStatus status, ErrorKind kind, String message) {
      respondWithJson(ctx, status, new JsonObject().put("error", message).put("kind", kind.name()));
   }

   private void respondWithJson(RoutingContext ctx, HttpResponseStatus status, JsonObject entity) {
      ctx.response()
            .setStatusCode(status.code())
            .putHeader(HttpHeaders.CONTENT_TYPE, MIME_TYPE_JSON)
            .end(entity.encodePrettily());
   }
}
