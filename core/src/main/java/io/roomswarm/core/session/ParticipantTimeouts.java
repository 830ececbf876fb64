package io.roomswarm.core.session;

import io.roomswarm.internal.Properties;

/**
 * Bounds of every suspension point of a participant.
 */
public class ParticipantTimeouts {
   public final long auth;
   public final long join;
   public final long media;
   public final long command;
   public final long closeGrace;

   public ParticipantTimeouts(long auth, long join, long media, long command, long closeGrace) {
      this.auth = auth;
      this.join = join;
      this.media = media;
      this.command = command;
      this.closeGrace = closeGrace;
   }

   public static ParticipantTimeouts fromProperties() {
      return new ParticipantTimeouts(
            Properties.getLong(Properties.TIMEOUT_AUTH, 30000),
            Properties.getLong(Properties.TIMEOUT_JOIN, 30000),
            Properties.getLong(Properties.TIMEOUT_MEDIA, 30000),
            Properties.getLong(Properties.TIMEOUT_COMMAND, 30000),
            Properties.getLong(Properties.CLOSE_GRACE, 5000));
   }

   public static ParticipantTimeouts uniform(long timeout, long closeGrace) {
      return new ParticipantTimeouts(timeout, timeout, timeout, timeout, closeGrace);
   }
}
