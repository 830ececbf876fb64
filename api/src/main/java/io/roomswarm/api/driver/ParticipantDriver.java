package io.roomswarm.api.driver;

import io.roomswarm.api.config.MediaSettings;
import io.roomswarm.api.config.NoiseSuppression;
import io.roomswarm.api.config.StrategyKind;
import io.roomswarm.api.config.WebcamResolution;
import io.roomswarm.api.credentials.Credential;
import io.roomswarm.api.session.CommandKind;
import io.roomswarm.api.session.MediaState;
import io.vertx.core.Future;
import io.vertx.core.Handler;

/**
 * Capability set a participant strategy has to provide. Calls are never issued concurrently on one driver;
 * the owning participant waits for each returned future before it issues the next call.
 */
public interface ParticipantDriver {
   StrategyKind kind();

   /**
    * Commands the driver cannot perform are acknowledged without effect.
    */
   boolean supports(CommandKind command);

   /**
    * Fails with {@link io.roomswarm.api.CredentialException} when the backend rejects the token.
    */
   Future<Void> authenticate(Credential credential);

   Future<Void> join();

   Future<MediaState> startMedia(MediaSettings settings);

   Future<Void> toggle(CommandKind toggle, boolean enabled);

   Future<Void> setNoiseSuppression(NoiseSuppression level);

   Future<Void> setResolution(WebcamResolution resolution);

   Future<Void> leave();

   /**
    * Orderly release of connections and processes.
    */
   Future<Void> release();

   /**
    * Unconditional teardown; must not block and must not fail.
    */
   void forceRelease();

   /**
    * Invoked when the backend drops the participant outside of {@link #leave()}.
    */
   void disconnectHandler(Handler<Throwable> handler);
}
