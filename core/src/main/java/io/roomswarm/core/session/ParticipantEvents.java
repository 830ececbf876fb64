package io.roomswarm.core.session;

import java.util.concurrent.CopyOnWriteArrayList;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import io.roomswarm.api.session.ParticipantEvent;
import io.roomswarm.api.session.Subscription;
import io.vertx.core.Handler;

/**
 * Subscriber list of one participant. Publishing happens on the participant's context only,
 * so every subscriber sees the same order.
 */
class ParticipantEvents {
   private static final Logger log = LogManager.getLogger(ParticipantEvents.class);

   private final CopyOnWriteArrayList<Handler<ParticipantEvent>> subscribers = new CopyOnWriteArrayList<>();

   Subscription subscribe(Handler<ParticipantEvent> handler) {
      subscribers.add(handler);
      return () -> subscribers.remove(handler);
   }

   void publish(ParticipantEvent event) {
      for (Handler<ParticipantEvent> subscriber : subscribers) {
         try {
            subscriber.handle(event);
         } catch (RuntimeException e) {
            log.error(new FormattedMessage("Subscriber of {} failed to handle {}", event.participantId(), event.type()), e);
         }
      }
   }
}
