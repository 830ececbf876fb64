package io.roomswarm.core.credentials;

import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.roomswarm.api.CredentialException;
import io.roomswarm.api.UnreachableException;
import io.roomswarm.api.credentials.Credential;
import io.roomswarm.api.credentials.LoginFlow;
import io.roomswarm.internal.Properties;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;

/**
 * Obtains a guest session from the backend and renames the guest to the participant's username.
 */
public class GuestLoginFlow implements LoginFlow {
   private static final Logger log = LogManager.getLogger(GuestLoginFlow.class);
   public static final String SESSION_COOKIE = "hyper_session";
   static final long TOKEN_VALIDITY = TimeUnit.DAYS.toMillis(365);
   private static final long REQUEST_TIMEOUT = Properties.getLong(Properties.REQUEST_TIMEOUT, 30000);

   private final WebClient client;
   private final String baseUrl;

   /**
    * @param baseUrl origin of the backend, e.g. {@code https://meet.example.com}
    */
   public GuestLoginFlow(WebClient client, String baseUrl) {
      this.client = client;
      this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
   }

   @Override
   public Future<Credential> login(String username) {
      return client.postAbs(baseUrl + "/api/v1/auth/guest")
            .addQueryParam("username", "guest")
            .timeout(REQUEST_TIMEOUT)
            .send()
            .recover(this::unreachable)
            .compose(response -> {
               if (response.statusCode() / 100 != 2) {
                  return Future.failedFuture(unexpected("Guest login", response));
               }
               String token = sessionCookie(response);
               if (token == null) {
                  return Future.failedFuture(new CredentialException("Guest login did not set " + SESSION_COOKIE + " cookie"));
               }
               return Future.succeededFuture(token);
            })
            .compose(token -> client.putAbs(baseUrl + "/api/v1/auth/me/name")
                  .putHeader(HttpHeaders.COOKIE.toString(), SESSION_COOKIE + "=" + token)
                  .timeout(REQUEST_TIMEOUT)
                  .sendJsonObject(new JsonObject().put("name", username))
                  .recover(this::unreachable)
                  .compose(response -> {
                     if (response.statusCode() / 100 != 2) {
                        return Future.failedFuture(unexpected("Setting display name", response));
                     }
                     log.debug("Logged in {} as guest", username);
                     return Future.succeededFuture(new Credential(username, token, System.currentTimeMillis() + TOKEN_VALIDITY, true));
                  }));
   }

   @Override
   public Future<Boolean> validate(Credential credential) {
      return client.getAbs(baseUrl + "/api/v1/auth/me")
            .putHeader(HttpHeaders.COOKIE.toString(), SESSION_COOKIE + "=" + credential.token())
            .timeout(REQUEST_TIMEOUT)
            .send()
            .recover(this::unreachable)
            .compose(response -> {
               if (response.statusCode() == 200) {
                  return Future.succeededFuture(true);
               } else if (response.statusCode() == 401 || response.statusCode() == 403) {
                  return Future.succeededFuture(false);
               }
               return Future.failedFuture(unexpected("Token validation", response));
            });
   }

   static String sessionCookie(HttpResponse<Buffer> response) {
      for (String cookie : response.cookies()) {
         int eq = cookie.indexOf('=');
         if (eq > 0 && cookie.substring(0, eq).trim().equals(SESSION_COOKIE)) {
            int end = cookie.indexOf(';', eq);
            String value = end < 0 ? cookie.substring(eq + 1) : cookie.substring(eq + 1, end);
            return value.isEmpty() ? null : value;
         }
      }
      return null;
   }

   private <T> Future<T> unreachable(Throwable t) {
      return Future.failedFuture(new UnreachableException("Cannot reach " + baseUrl, t));
   }

   private static CredentialException unexpected(String operation, HttpResponse<Buffer> response) {
      StringBuilder sb = new StringBuilder(operation).append(" responded with unexpected code: ")
            .append(response.statusCode()).append(", ").append(response.statusMessage());
      String body = response.bodyAsString();
      if (body != null && !body.isEmpty()) {
         sb.append(": ").append(body);
      }
      return new CredentialException(sb.toString());
   }
}
