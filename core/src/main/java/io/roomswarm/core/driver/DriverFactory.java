package io.roomswarm.core.driver;

import io.roomswarm.api.config.ParticipantIdentity;
import io.roomswarm.api.driver.ParticipantDriver;

@FunctionalInterface
public interface DriverFactory {
   /**
    * @throws io.roomswarm.api.SimulatorException when the requested strategy is not available
    */
   ParticipantDriver create(String participantId, ParticipantIdentity identity);
}
