package io.roomswarm.clustering.client;

import java.io.Closeable;

import io.roomswarm.api.config.ParticipantIdentity;
import io.roomswarm.api.config.WorkerRef;
import io.roomswarm.api.session.Ack;
import io.roomswarm.api.session.Command;
import io.roomswarm.api.session.ParticipantSnapshot;
import io.vertx.core.Future;

/**
 * Remote control of one worker. Connection failures are reported as {@link io.roomswarm.api.UnreachableException},
 * rejected requests as {@link RestClientException}.
 */
public interface WorkerClient extends Closeable {
   /** Field of the spawn request body that makes repeated spawns idempotent. */
   String DISPATCH_KEY = "dispatchKey";

   WorkerRef worker();

   Future<Void> health();

   /**
    * @param dispatchKey repeating a spawn with the same key returns the participant created by the first one;
    *                    {@code null} always creates a new participant
    * @return id of the participant
    */
   Future<String> spawn(ParticipantIdentity identity, String dispatchKey);

   default Future<String> spawn(ParticipantIdentity identity) {
      return spawn(identity, null);
   }

   Future<ParticipantSnapshot> snapshot(String participantId);

   Future<Ack> command(String participantId, Command command);

   Future<Ack> delete(String participantId);

   @Override
   void close();
}
