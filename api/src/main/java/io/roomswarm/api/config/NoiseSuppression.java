package io.roomswarm.api.config;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum NoiseSuppression {
   NONE("none"),
   DEEP_FILTER_NET("deepfilternet"),
   RNNOISE("rnnoise"),
   IRIS_SHEPHERD("iris-shepherd"),
   KRISP_HIGH("krisp-high"),
   KRISP_MEDIUM("krisp-medium"),
   KRISP_LOW("krisp-low"),
   KRISP_HIGH_WITH_BVC("krisp-high-with-bvc"),
   KRISP_MEDIUM_WITH_BVC("krisp-medium-with-bvc");

   public final String value;

   NoiseSuppression(String value) {
      this.value = value;
   }

   public static NoiseSuppression fromString(String value) {
      for (NoiseSuppression level : values()) {
         if (level.value.equalsIgnoreCase(value) || level.name().equalsIgnoreCase(value)) {
            return level;
         }
      }
      throw new IllegalArgumentException("Unknown noise suppression '" + value + "', expected one of " +
            Arrays.stream(values()).map(l -> l.value).collect(Collectors.joining(", ")));
   }

   @Override
   public String toString() {
      return value;
   }
}
