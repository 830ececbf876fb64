package io.roomswarm.api;

import io.roomswarm.api.session.CommandKind;
import io.roomswarm.api.session.ParticipantState;

public class InvalidStateException extends SimulatorException {
   public InvalidStateException(CommandKind command, ParticipantState state) {
      super(ErrorKind.INVALID_STATE, "Command " + command + " is not allowed in state " + state);
   }

   public InvalidStateException(String message) {
      super(ErrorKind.INVALID_STATE, message);
   }
}
