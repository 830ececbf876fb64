package io.roomswarm.api;

import io.roomswarm.api.session.ParticipantState;

public class ParticipantClosedException extends SimulatorException {
   public ParticipantClosedException(String participantId, ParticipantState state) {
      super(ErrorKind.CLOSED, "Participant " + participantId + " is " + state);
   }
}
