package io.roomswarm.api;

public class UnknownParticipantException extends SimulatorException {
   public UnknownParticipantException(String participantId) {
      super(ErrorKind.NOT_FOUND, "Unknown participant " + participantId);
   }
}
