package io.roomswarm.clustering;

import io.roomswarm.api.session.ErrorEvent;
import io.roomswarm.api.session.LogEvent;
import io.roomswarm.api.session.MediaChangedEvent;
import io.roomswarm.api.session.StateChangedEvent;
import io.roomswarm.clustering.messages.ObjectCodec;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.EventBus;

public final class Codecs {
   private Codecs() {}

   public static void register(Vertx vertx) {
      EventBus eb = vertx.eventBus();

      eb.registerDefaultCodec(ErrorEvent.class, new ObjectCodec<>(ErrorEvent.class));
      eb.registerDefaultCodec(LogEvent.class, new ObjectCodec<>(LogEvent.class));
      eb.registerDefaultCodec(MediaChangedEvent.class, new ObjectCodec<>(MediaChangedEvent.class));
      eb.registerDefaultCodec(StateChangedEvent.class, new ObjectCodec<>(StateChangedEvent.class));
   }
}
