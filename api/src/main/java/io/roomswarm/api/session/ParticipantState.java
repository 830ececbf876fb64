package io.roomswarm.api.session;

/**
 * Life-cycle stage of a participant. Progress is monotonic, {@link #CLOSED} and {@link #FAILED} are terminal.
 */
public enum ParticipantState {
   SPAWNED,
   AUTHENTICATED,
   JOINED,
   ACTIVE,
   CLOSED,
   FAILED;

   public boolean isTerminal() {
      return this == CLOSED || this == FAILED;
   }

   public boolean canTransitionTo(ParticipantState next) {
      switch (this) {
         case SPAWNED:
            return next == AUTHENTICATED || next == FAILED || next == CLOSED;
         case AUTHENTICATED:
            return next == JOINED || next == FAILED || next == CLOSED;
         case JOINED:
            return next == ACTIVE || next == FAILED || next == CLOSED;
         case ACTIVE:
            return next == CLOSED || next == FAILED;
         default:
            return false;
      }
   }
}
