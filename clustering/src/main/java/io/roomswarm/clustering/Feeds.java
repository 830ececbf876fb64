package io.roomswarm.clustering;

public final class Feeds {
   public static final String PARTICIPANT_EVENTS = "participant-events-feed";

   private Feeds() {
   }
}
