package io.roomswarm.api.session;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum CommandKind {
   JOIN("join"),
   LEAVE("leave"),
   TOGGLE_AUDIO("toggle-audio"),
   TOGGLE_VIDEO("toggle-video"),
   TOGGLE_SCREENSHARE("toggle-screenshare"),
   TOGGLE_BLUR("toggle-blur"),
   /** Argument is the noise suppression level. */
   SET_NOISE_SUPPRESSION("set-noise-suppression"),
   /** Argument is the webcam resolution. */
   SET_RESOLUTION("set-resolution"),
   CLOSE("close");

   public final String value;

   CommandKind(String value) {
      this.value = value;
   }

   public boolean isMedia() {
      return this != JOIN && this != LEAVE && this != CLOSE;
   }

   public static CommandKind fromString(String value) {
      for (CommandKind kind : values()) {
         if (kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
            return kind;
         }
      }
      throw new IllegalArgumentException("Unknown command '" + value + "', expected one of " +
            Arrays.stream(values()).map(k -> k.value).collect(Collectors.joining(", ")));
   }

   @Override
   public String toString() {
      return value;
   }
}
