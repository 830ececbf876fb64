package io.roomswarm.core.driver.surface;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.roomswarm.api.CredentialException;
import io.roomswarm.api.ErrorKind;
import io.roomswarm.api.ParticipantTimeoutException;
import io.roomswarm.api.SimulatorException;
import io.roomswarm.api.UnreachableException;
import io.roomswarm.api.config.FakeMedia;
import io.roomswarm.api.config.MediaSettings;
import io.roomswarm.api.config.NoiseSuppression;
import io.roomswarm.api.config.ParticipantIdentity;
import io.roomswarm.api.config.StrategyKind;
import io.roomswarm.api.config.TransportMode;
import io.roomswarm.api.config.WebcamResolution;
import io.roomswarm.api.credentials.Credential;
import io.roomswarm.api.driver.ParticipantDriver;
import io.roomswarm.api.driver.RenderingSurface;
import io.roomswarm.api.driver.RenderingSurfaceFactory;
import io.roomswarm.api.driver.SurfaceOptions;
import io.roomswarm.api.session.CommandKind;
import io.roomswarm.api.session.MediaState;
import io.roomswarm.core.util.Futures;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

/**
 * Drives the real web client in a {@link RenderingSurface}: the participant clicks through the page
 * like a human would.
 */
public class SurfaceDriver implements ParticipantDriver {
   private static final Logger log = LogManager.getLogger(SurfaceDriver.class);
   static final int CREATE_ATTEMPTS = 5;
   static final long CREATE_BACKOFF = 500;
   static final String LOGIN_PATH = "/login";
   static final String ON = "on";

   private final Vertx vertx;
   private final RenderingSurfaceFactory factory;
   private final ParticipantIdentity identity;
   private final UiSelectors selectors;
   private final long waitTimeout;
   private final int waitRetries;
   private RenderingSurface surface;
   private boolean released;
   private Handler<Throwable> disconnectHandler = cause -> {};

   public SurfaceDriver(Vertx vertx, RenderingSurfaceFactory factory, ParticipantIdentity identity,
                        UiSelectors selectors, long waitTimeout, int waitRetries) {
      this.vertx = vertx;
      this.factory = factory;
      this.identity = identity;
      this.selectors = selectors;
      this.waitTimeout = waitTimeout;
      this.waitRetries = Math.max(1, waitRetries);
   }

   @Override
   public StrategyKind kind() {
      return StrategyKind.SURFACE;
   }

   @Override
   public boolean supports(CommandKind command) {
      switch (command) {
         case TOGGLE_BLUR:
         case SET_NOISE_SUPPRESSION:
         case SET_RESOLUTION:
            return selectors.advancedSettings;
         default:
            return true;
      }
   }

   static List<String> surfaceArguments(MediaSettings settings) {
      List<String> args = new ArrayList<>();
      args.add("--use-fake-ui-for-media-stream");
      FakeMedia fakeMedia = settings.fakeMedia();
      if (fakeMedia.enabled()) {
         args.add("--use-fake-device-for-media-stream");
         if (fakeMedia.mode() == FakeMedia.Mode.URL) {
            args.add("--use-file-for-fake-video-capture=" + fakeMedia.url());
         }
      }
      return args;
   }

   @Override
   public Future<Void> authenticate(Credential credential) {
      long maxAge = Math.max(0, (credential.expiresAt() - System.currentTimeMillis()) / 1000);
      return surface()
            .compose(s -> s.navigate(identity.origin())
                  .compose(nil -> s.evaluate(SurfaceScripts.setSessionCookie(credential.token(), maxAge)))
                  .compose(nil -> s.navigate(identity.sessionUrl()))
                  .compose(nil -> s.evaluate(SurfaceScripts.currentPath())))
            .compose(path -> {
               if (path != null && path.startsWith(LOGIN_PATH)) {
                  return Future.failedFuture(new CredentialException("Session redirected " + identity.username() + " to the login page"));
               }
               return Future.succeededFuture();
            });
   }

   @Override
   public Future<Void> join() {
      RenderingSurface s = surface;
      if (s == null) {
         return notOpen();
      }
      Future<Void> prepared = Future.succeededFuture();
      if (selectors.advancedSettings && identity.media().transport() == TransportMode.WEBRTC) {
         prepared = s.evaluate(SurfaceScripts.forceWebrtc(true)).mapEmpty();
      }
      return prepared
            .compose(nil -> waitFor(s, selectors.nameInput))
            .compose(nil -> s.invoke(selectors.nameInput, "type", identity.username()))
            .compose(nil -> waitFor(s, selectors.join))
            .compose(nil -> s.invoke(selectors.join, "click", null))
            .compose(nil -> waitFor(s, selectors.leave))
            .onSuccess(nil -> log.debug("{} joined through the {} client", identity.username(), selectors));
   }

   @Override
   public Future<MediaState> startMedia(MediaSettings settings) {
      RenderingSurface s = surface;
      if (s == null) {
         return notOpen();
      }
      Future<Void> applied = ensureState(s, selectors.audio, settings.audioEnabled())
            .compose(nil -> ensureState(s, selectors.video, settings.videoEnabled()))
            .compose(nil -> ensureState(s, selectors.screenshare, settings.screenshareEnabled()));
      boolean blur = false;
      NoiseSuppression noiseSuppression = NoiseSuppression.NONE;
      WebcamResolution resolution = WebcamResolution.AUTO;
      if (selectors.advancedSettings) {
         blur = settings.blur();
         noiseSuppression = settings.noiseSuppression();
         resolution = settings.resolution();
         if (settings.blur()) {
            applied = applied.compose(nil -> s.evaluate(SurfaceScripts.setBackgroundBlur(true))).mapEmpty();
         }
         if (settings.noiseSuppression() != NoiseSuppression.NONE) {
            applied = applied.compose(nil -> s.evaluate(SurfaceScripts.setNoiseSuppression(settings.noiseSuppression().value))).mapEmpty();
         }
         if (settings.resolution() != WebcamResolution.AUTO) {
            applied = applied.compose(nil -> s.evaluate(SurfaceScripts.setResolution(settings.resolution().value))).mapEmpty();
         }
      } else if (settings.blur() || settings.noiseSuppression() != NoiseSuppression.NONE || settings.resolution() != WebcamResolution.AUTO) {
         log.info("{}: the {} client ignores blur, noise suppression and resolution", identity.username(), selectors);
      }
      MediaState state = new MediaState(settings.audioEnabled(), settings.videoEnabled(), settings.screenshareEnabled(),
            blur, noiseSuppression, resolution);
      return applied.map(state);
   }

   @Override
   public Future<Void> toggle(CommandKind toggle, boolean enabled) {
      RenderingSurface s = surface;
      if (s == null) {
         return notOpen();
      }
      Future<Void> result;
      switch (toggle) {
         case TOGGLE_AUDIO:
            result = ensureState(s, selectors.audio, enabled);
            break;
         case TOGGLE_VIDEO:
            result = ensureState(s, selectors.video, enabled);
            break;
         case TOGGLE_SCREENSHARE:
            result = ensureState(s, selectors.screenshare, enabled);
            break;
         case TOGGLE_BLUR:
            result = advanced(s, SurfaceScripts.setBackgroundBlur(enabled));
            break;
         default:
            return Future.failedFuture(new SimulatorException(ErrorKind.INTERNAL, toggle + " is not a toggle"));
      }
      return result.recover(e -> checkPresence(s, e));
   }

   @Override
   public Future<Void> setNoiseSuppression(NoiseSuppression level) {
      RenderingSurface s = surface;
      if (s == null) {
         return notOpen();
      }
      return advanced(s, SurfaceScripts.setNoiseSuppression(level.value)).recover(e -> checkPresence(s, e));
   }

   @Override
   public Future<Void> setResolution(WebcamResolution resolution) {
      RenderingSurface s = surface;
      if (s == null) {
         return notOpen();
      }
      return advanced(s, SurfaceScripts.setResolution(resolution.value)).recover(e -> checkPresence(s, e));
   }

   @Override
   public Future<Void> leave() {
      RenderingSurface s = surface;
      if (s == null) {
         return notOpen();
      }
      return waitFor(s, selectors.leave).compose(nil -> s.invoke(selectors.leave, "click", null));
   }

   @Override
   public Future<Void> release() {
      RenderingSurface s = surface;
      surface = null;
      released = true;
      if (s == null) {
         return Future.succeededFuture();
      }
      return s.close();
   }

   @Override
   public void forceRelease() {
      RenderingSurface s = surface;
      surface = null;
      released = true;
      if (s != null) {
         try {
            s.close().onFailure(e -> log.debug("{}: closing the surface failed: {}", identity.username(), e.getMessage()));
         } catch (RuntimeException e) {
            log.warn("{}: closing the surface threw {}", identity.username(), e.toString());
         }
      }
   }

   @Override
   public void disconnectHandler(Handler<Throwable> handler) {
      this.disconnectHandler = handler;
   }

   private Future<RenderingSurface> surface() {
      if (released) {
         return notOpen();
      }
      if (surface != null) {
         return Future.succeededFuture(surface);
      }
      SurfaceOptions options = new SurfaceOptions(identity.username(), identity.media().headless(), surfaceArguments(identity.media()));
      Promise<RenderingSurface> promise = Promise.promise();
      createSurface(options, 0, promise);
      return promise.future().onSuccess(s -> {
         if (released) {
            // released while the surface was starting
            s.close().onFailure(e -> log.debug("{}: closing the surface failed: {}", identity.username(), e.getMessage()));
         } else {
            surface = s;
         }
      }).compose(s -> released ? notOpen() : Future.succeededFuture(s));
   }

   private void createSurface(SurfaceOptions options, int attempt, Promise<RenderingSurface> promise) {
      factory.create(vertx, options).onComplete(result -> {
         if (result.succeeded()) {
            promise.complete(result.result());
         } else if (attempt + 1 >= CREATE_ATTEMPTS || released) {
            promise.fail(new UnreachableException("Cannot start a rendering surface for " + identity.username(), result.cause()));
         } else {
            long delay = Futures.backoff(CREATE_BACKOFF, attempt, 10000);
            log.warn("{}: starting a rendering surface failed ({}), retrying in {} ms", identity.username(), result.cause().getMessage(), delay);
            vertx.setTimer(delay, id -> createSurface(options, attempt + 1, promise));
         }
      });
   }

   private Future<Void> waitFor(RenderingSurface s, String selector) {
      Promise<Void> promise = Promise.promise();
      waitFor(s, selector, 0, promise);
      return promise.future();
   }

   private void waitFor(RenderingSurface s, String selector, int attempt, Promise<Void> promise) {
      s.waitFor(selector, waitTimeout).onComplete(result -> {
         if (result.succeeded()) {
            promise.complete();
         } else if (result.cause() instanceof ParticipantTimeoutException && attempt + 1 < waitRetries && !released) {
            log.debug("{}: {} not present yet, attempt {}/{}", identity.username(), selector, attempt + 1, waitRetries);
            waitFor(s, selector, attempt + 1, promise);
         } else if (result.cause() instanceof ParticipantTimeoutException) {
            promise.fail(new ParticipantTimeoutException("waiting for " + selector, waitTimeout * waitRetries));
         } else {
            promise.fail(result.cause());
         }
      });
   }

   private Future<Void> ensureState(RenderingSurface s, String selector, boolean enabled) {
      return waitFor(s, selector)
            .compose(nil -> s.evaluate(SurfaceScripts.readState(selector)))
            .compose(current -> {
               if (ON.equals(current) == enabled) {
                  return Future.succeededFuture();
               }
               return s.invoke(selector, "click", null);
            });
   }

   private Future<Void> advanced(RenderingSurface s, String script) {
      if (!selectors.advancedSettings) {
         return Future.failedFuture(new SimulatorException(ErrorKind.INTERNAL, "The " + selectors + " client has no such setting"));
      }
      return s.evaluate(script).mapEmpty();
   }

   /**
    * A failed command may mean the page dropped out of the session; without the leave button the participant is gone.
    */
   private Future<Void> checkPresence(RenderingSurface s, Throwable cause) {
      return s.evaluate(SurfaceScripts.isPresent(selectors.leave))
            .otherwise(e -> "false")
            .compose(present -> {
               if ("true".equals(present)) {
                  return Future.failedFuture(cause);
               }
               UnreachableException disconnected = new UnreachableException("No longer in the session: " + cause.getMessage(), cause);
               disconnectHandler.handle(disconnected);
               return Future.failedFuture(disconnected);
            });
   }

   private <T> Future<T> notOpen() {
      return Future.failedFuture(new UnreachableException("Rendering surface of " + identity.username() + " is not open"));
   }
}
