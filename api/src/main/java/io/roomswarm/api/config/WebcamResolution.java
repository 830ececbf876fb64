package io.roomswarm.api.config;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum WebcamResolution {
   AUTO("auto", 0),
   P144("144p", 144),
   P240("240p", 240),
   P360("360p", 360),
   P480("480p", 480),
   P720("720p", 720),
   P1080("1080p", 1080),
   P1440("1440p", 1440),
   P2160("2160p", 2160),
   P4320("4320p", 4320);

   public final String value;
   /** Frame height in pixels, 0 when the backend picks. */
   public final int height;

   WebcamResolution(String value, int height) {
      this.value = value;
      this.height = height;
   }

   public static WebcamResolution fromString(String value) {
      for (WebcamResolution resolution : values()) {
         if (resolution.value.equalsIgnoreCase(value) || resolution.name().equalsIgnoreCase(value)) {
            return resolution;
         }
      }
      throw new IllegalArgumentException("Unknown resolution '" + value + "', expected one of " +
            Arrays.stream(values()).map(r -> r.value).collect(Collectors.joining(", ")));
   }

   @Override
   public String toString() {
      return value;
   }
}
