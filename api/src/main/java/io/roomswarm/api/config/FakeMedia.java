package io.roomswarm.api.config;

import java.io.Serializable;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

/**
 * Source of the media a participant publishes: nothing, the built-in test pattern, or a media file.
 */
public final class FakeMedia implements Serializable {
   public static final FakeMedia NONE = new FakeMedia(Mode.NONE, null);
   public static final FakeMedia BUILTIN = new FakeMedia(Mode.BUILTIN, null);

   public enum Mode {
      NONE,
      BUILTIN,
      URL
   }

   private final Mode mode;
   private final String url;

   private FakeMedia(Mode mode, String url) {
      this.mode = mode;
      this.url = url;
   }

   public static FakeMedia url(String url) {
      return new FakeMedia(Mode.URL, Objects.requireNonNull(url));
   }

   /**
    * Accepts {@code none}, {@code builtin} or an absolute URL; anything else falls back to {@link #BUILTIN}.
    */
   public static FakeMedia parse(String value) {
      if (value == null) {
         return BUILTIN;
      }
      String trimmed = value.trim();
      if (trimmed.equalsIgnoreCase("none")) {
         return NONE;
      } else if (trimmed.equalsIgnoreCase("builtin")) {
         return BUILTIN;
      }
      try {
         URI uri = new URI(trimmed);
         if (uri.isAbsolute() && uri.getScheme() != null) {
            return url(trimmed);
         }
      } catch (URISyntaxException e) {
         return BUILTIN;
      }
      return BUILTIN;
   }

   public Mode mode() {
      return mode;
   }

   public String url() {
      return url;
   }

   public boolean enabled() {
      return mode != Mode.NONE;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof FakeMedia)) {
         return false;
      }
      FakeMedia that = (FakeMedia) o;
      return mode == that.mode && Objects.equals(url, that.url);
   }

   @Override
   public int hashCode() {
      return Objects.hash(mode, url);
   }

   @Override
   public String toString() {
      return mode == Mode.URL ? url : mode.name().toLowerCase();
   }
}
