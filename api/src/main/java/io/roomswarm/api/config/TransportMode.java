package io.roomswarm.api.config;

public enum TransportMode {
   /** Datagram-first transport. */
   WEBTRANSPORT("webtransport"),
   /** Stream fallback transport. */
   WEBRTC("webrtc");

   public final String value;

   TransportMode(String value) {
      this.value = value;
   }

   public static TransportMode fromString(String value) {
      for (TransportMode mode : values()) {
         if (mode.value.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
            return mode;
         }
      }
      throw new IllegalArgumentException("Unknown transport '" + value + "', expected one of webtransport, webrtc");
   }

   @Override
   public String toString() {
      return value;
   }
}
