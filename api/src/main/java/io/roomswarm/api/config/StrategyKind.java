package io.roomswarm.api.config;

/**
 * Backing implementation of a participant. Both kinds honour the same command contract.
 */
public enum StrategyKind {
   /** Drives a remote-controlled rendering surface through the web UI. */
   SURFACE("surface"),
   /** Talks to the signaling endpoint directly, no rendering. */
   PROTOCOL("protocol");

   public final String value;

   StrategyKind(String value) {
      this.value = value;
   }

   public static StrategyKind fromString(String value) {
      for (StrategyKind kind : values()) {
         if (kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
            return kind;
         }
      }
      throw new IllegalArgumentException("Unknown strategy '" + value + "', expected one of surface, protocol");
   }

   @Override
   public String toString() {
      return value;
   }
}
