package io.roomswarm.api.session;

import io.roomswarm.api.config.ParticipantIdentity;
import io.vertx.core.Future;
import io.vertx.core.Handler;

/**
 * Control contract of one simulated participant, independent of the strategy that backs it.
 */
public interface Participant {
   String id();

   ParticipantIdentity identity();

   ParticipantState state();

   ParticipantSnapshot snapshot();

   /**
    * Queues the command. Commands are applied one at a time in the order they were sent.
    * The future fails with {@link io.roomswarm.api.InvalidStateException} when the command is not legal
    * in the state the participant is in once the command is applied, and with
    * {@link io.roomswarm.api.ParticipantClosedException} when the participant has terminated.
    */
   Future<Ack> send(Command command);

   /**
    * Receive events emitted from now on, in order, on the participant's context.
    */
   Subscription subscribe(Handler<ParticipantEvent> handler);

   /**
    * Leave gracefully; the participant is torn down forcibly when the grace period expires.
    * Closing a terminated participant completes with {@link Ack#NO_OP}.
    */
   Future<Ack> close();
}
