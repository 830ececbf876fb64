package io.roomswarm.core.driver.protocol;

import java.util.HashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.roomswarm.api.CredentialException;
import io.roomswarm.api.ParticipantTimeoutException;
import io.roomswarm.api.UnreachableException;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketConnectOptions;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

/**
 * JSON request/reply over a WebSocket. Each request carries a {@code seq} number echoed by the reply;
 * frames without a known {@code seq} are pushes from the backend. Handlers run on the context that connected.
 */
class SignalingConnection {
   private static final Logger log = LogManager.getLogger(SignalingConnection.class);
   private static final boolean trace = log.isTraceEnabled();

   static final String TYPE = "type";
   static final String SEQ = "seq";
   static final String ERROR = "error";
   static final String UNAUTHORIZED = "unauthorized";

   private final Vertx vertx;
   private final WebSocket webSocket;
   private final String owner;
   private final long requestTimeout;
   private final Map<Long, PendingRequest> pending = new HashMap<>();
   private long nextSeq = 1;
   private boolean closedLocally;
   private boolean closed;
   private Handler<JsonObject> pushHandler = frame -> {};
   private Handler<Throwable> closeHandler = cause -> {};

   private SignalingConnection(Vertx vertx, WebSocket webSocket, String owner, long requestTimeout) {
      this.vertx = vertx;
      this.webSocket = webSocket;
      this.owner = owner;
      this.requestTimeout = requestTimeout;
      webSocket.textMessageHandler(this::handleFrame);
      webSocket.exceptionHandler(e -> log.debug("{}: signaling connection error: {}", owner, e.getMessage()));
      webSocket.closeHandler(nil -> handleClose());
   }

   static Future<SignalingConnection> connect(Vertx vertx, HttpClient client, WebSocketConnectOptions options,
                                             String owner, long requestTimeout) {
      return client.webSocket(options)
            .recover(e -> Future.failedFuture(new UnreachableException(
                  "Cannot open signaling connection to " + options.getHost() + ":" + options.getPort() + options.getURI(), e)))
            .map(ws -> new SignalingConnection(vertx, ws, owner, requestTimeout));
   }

   void pushHandler(Handler<JsonObject> handler) {
      this.pushHandler = handler;
   }

   void closeHandler(Handler<Throwable> handler) {
      this.closeHandler = handler;
   }

   boolean isClosed() {
      return closed;
   }

   /**
    * Sends a frame and waits for the reply of the expected type. Error replies fail the future,
    * {@code unauthorized} ones with {@link CredentialException}.
    */
   Future<JsonObject> request(String type, JsonObject body, String expectedReply) {
      if (closed) {
         return Future.failedFuture(new UnreachableException("Signaling connection of " + owner + " is closed"));
      }
      long seq = nextSeq++;
      JsonObject frame = body.copy().put(TYPE, type).put(SEQ, seq);
      PendingRequest request = new PendingRequest(type, expectedReply);
      request.timerId = vertx.setTimer(requestTimeout, id -> {
         if (pending.remove(seq) != null) {
            request.promise.tryFail(new ParticipantTimeoutException("Signaling request '" + type + "'", requestTimeout));
         }
      });
      pending.put(seq, request);
      if (trace) {
         log.trace("{} >> {}", owner, frame.encode());
      }
      webSocket.writeTextMessage(frame.encode()).onFailure(e -> {
         if (pending.remove(seq) != null) {
            vertx.cancelTimer(request.timerId);
            request.promise.tryFail(new UnreachableException("Cannot send '" + type + "' for " + owner, e));
         }
      });
      return request.promise.future();
   }

   Future<Void> close() {
      closedLocally = true;
      if (closed) {
         return Future.succeededFuture();
      }
      return webSocket.close();
   }

   private void handleFrame(String text) {
      if (trace) {
         log.trace("{} << {}", owner, text);
      }
      JsonObject frame;
      try {
         frame = new JsonObject(text);
      } catch (DecodeException e) {
         log.warn("{}: ignoring malformed signaling frame: {}", owner, text);
         return;
      }
      Long seq = frame.getLong(SEQ);
      PendingRequest request = seq == null ? null : pending.remove(seq);
      if (request == null) {
         pushHandler.handle(frame);
         return;
      }
      vertx.cancelTimer(request.timerId);
      String type = frame.getString(TYPE);
      if (ERROR.equals(type)) {
         String code = frame.getString("code", "unknown");
         String message = frame.getString("message");
         if (UNAUTHORIZED.equals(code)) {
            request.promise.tryFail(new CredentialException("Backend rejected the session token of " + owner +
                  (message == null ? "" : ": " + message)));
         } else {
            request.promise.tryFail(new SignalingException(code, message));
         }
      } else if (request.expectedReply.equals(type)) {
         request.promise.tryComplete(frame);
      } else {
         request.promise.tryFail(new SignalingException("unexpected-reply",
               "expected '" + request.expectedReply + "' to '" + request.type + "', got '" + type + "'"));
      }
   }

   private void handleClose() {
      closed = true;
      UnreachableException cause = new UnreachableException("Signaling connection of " + owner + " closed" +
            (webSocket.closeReason() == null ? "" : ": " + webSocket.closeReason()));
      for (PendingRequest request : pending.values()) {
         vertx.cancelTimer(request.timerId);
         request.promise.tryFail(cause);
      }
      pending.clear();
      if (!closedLocally) {
         closeHandler.handle(cause);
      }
   }

   private static class PendingRequest {
      final String type;
      final String expectedReply;
      final Promise<JsonObject> promise = Promise.promise();
      long timerId;

      PendingRequest(String type, String expectedReply) {
         this.type = type;
         this.expectedReply = expectedReply;
      }
   }
}
