package io.roomswarm.clustering.client;

import java.util.function.Function;

import io.roomswarm.api.ErrorKind;
import io.roomswarm.api.UnreachableException;
import io.roomswarm.api.config.ParticipantIdentity;
import io.roomswarm.api.config.WorkerRef;
import io.roomswarm.api.session.Ack;
import io.roomswarm.api.session.Command;
import io.roomswarm.api.session.ParticipantSnapshot;
import io.roomswarm.internal.Properties;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;

public class RestWorkerClient implements WorkerClient {
   private static final long REQUEST_TIMEOUT = Properties.getLong(Properties.REQUEST_TIMEOUT, 30000);

   private final WorkerRef worker;
   private final WebClient client;

   public RestWorkerClient(Vertx vertx, WorkerRef worker) {
      this.worker = worker;
      WebClientOptions options = new WebClientOptions()
            .setDefaultHost(worker.host())
            .setDefaultPort(worker.port())
            .setFollowRedirects(false);
      if (worker.ssl()) {
         options.setSsl(true).setUseAlpn(true);
      }
      client = WebClient.create(vertx, options);
   }

   static RestClientException unexpected(HttpResponse<Buffer> response) {
      ErrorKind kind = ErrorKind.INTERNAL;
      String message = null;
      String body = response.bodyAsString();
      if (body != null && !body.isEmpty()) {
         try {
            JsonObject json = new JsonObject(body);
            kind = ErrorKind.valueOf(json.getString("kind", ErrorKind.INTERNAL.name()));
            message = json.getString("error");
         } catch (DecodeException | IllegalArgumentException | ClassCastException e) {
            message = body;
         }
      }
      StringBuilder sb = new StringBuilder("Worker responded with unexpected code: ");
      sb.append(response.statusCode()).append(", ").append(response.statusMessage());
      if (message != null) {
         sb.append(": ").append(message);
      }
      return new RestClientException(kind, response.statusCode(), sb.toString());
   }

   HttpRequest<Buffer> request(HttpMethod method, String path) {
      return client.request(method, path).timeout(REQUEST_TIMEOUT);
   }

   private <T> Future<T> handle(Future<HttpResponse<Buffer>> request, int expectedStatus, Function<HttpResponse<Buffer>, T> f) {
      return request
            .recover(t -> Future.failedFuture(new UnreachableException("Cannot reach " + worker, t)))
            .compose(response -> {
               if (response.statusCode() != expectedStatus) {
                  return Future.failedFuture(unexpected(response));
               }
               try {
                  return Future.succeededFuture(f.apply(response));
               } catch (DecodeException | IllegalArgumentException | ClassCastException | NullPointerException e) {
                  return Future.failedFuture(new RestClientException("Cannot decode response from " + worker, e));
               }
            });
   }

   @Override
   public WorkerRef worker() {
      return worker;
   }

   @Override
   public Future<Void> health() {
      return handle(request(HttpMethod.GET, "/healthz").send(), 200, response -> null);
   }

   @Override
   public Future<String> spawn(ParticipantIdentity identity, String dispatchKey) {
      JsonObject body = identity.toJson();
      if (dispatchKey != null) {
         body.put(DISPATCH_KEY, dispatchKey);
      }
      return handle(request(HttpMethod.POST, "/participant").sendJsonObject(body), 201,
            response -> response.bodyAsJsonObject().getString("id"));
   }

   @Override
   public Future<ParticipantSnapshot> snapshot(String participantId) {
      return handle(request(HttpMethod.GET, "/participant/" + participantId).send(), 200,
            response -> ParticipantSnapshot.fromJson(response.bodyAsJsonObject()));
   }

   @Override
   public Future<Ack> command(String participantId, Command command) {
      HttpRequest<Buffer> request = request(HttpMethod.POST, "/participant/" + participantId + "/command/" + command.kind().value);
      Future<HttpResponse<Buffer>> sent = command.argument() == null ? request.send()
            : request.sendJsonObject(new JsonObject().put("argument", command.argument()));
      return handle(sent, 200, RestWorkerClient::ack);
   }

   @Override
   public Future<Ack> delete(String participantId) {
      return handle(request(HttpMethod.DELETE, "/participant/" + participantId).send(), 200, RestWorkerClient::ack);
   }

   private static Ack ack(HttpResponse<Buffer> response) {
      return Ack.valueOf(response.bodyAsJsonObject().getString("ack"));
   }

   @Override
   public void close() {
      client.close();
   }

   @Override
   public String toString() {
      return "RestWorkerClient{" + worker + "}";
   }
}
