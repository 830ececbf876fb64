package io.roomswarm.api.config;

import java.io.Serializable;

import io.vertx.core.json.JsonObject;

/**
 * Media preferences of one participant. Immutable, use {@link Builder} to derive variants.
 */
public final class MediaSettings implements Serializable {
   public static final MediaSettings DEFAULT = new Builder().build();

   private final boolean audioEnabled;
   private final boolean videoEnabled;
   private final boolean screenshareEnabled;
   private final FakeMedia fakeMedia;
   private final WebcamResolution resolution;
   private final NoiseSuppression noiseSuppression;
   private final TransportMode transport;
   private final boolean blur;
   private final boolean headless;

   private MediaSettings(Builder builder) {
      this.audioEnabled = builder.audioEnabled;
      this.videoEnabled = builder.videoEnabled;
      this.screenshareEnabled = builder.screenshareEnabled;
      this.fakeMedia = builder.fakeMedia;
      this.resolution = builder.resolution;
      this.noiseSuppression = builder.noiseSuppression;
      this.transport = builder.transport;
      this.blur = builder.blur;
      this.headless = builder.headless;
   }

   public static Builder builder() {
      return new Builder();
   }

   public Builder toBuilder() {
      return new Builder()
            .audio(audioEnabled)
            .video(videoEnabled)
            .screenshare(screenshareEnabled)
            .fakeMedia(fakeMedia)
            .resolution(resolution)
            .noiseSuppression(noiseSuppression)
            .transport(transport)
            .blur(blur)
            .headless(headless);
   }

   public boolean audioEnabled() {
      return audioEnabled;
   }

   public boolean videoEnabled() {
      return videoEnabled;
   }

   public boolean screenshareEnabled() {
      return screenshareEnabled;
   }

   public FakeMedia fakeMedia() {
      return fakeMedia;
   }

   public WebcamResolution resolution() {
      return resolution;
   }

   public NoiseSuppression noiseSuppression() {
      return noiseSuppression;
   }

   public TransportMode transport() {
      return transport;
   }

   public boolean blur() {
      return blur;
   }

   public boolean headless() {
      return headless;
   }

   public JsonObject toJson() {
      return new JsonObject()
            .put("audio", audioEnabled)
            .put("video", videoEnabled)
            .put("screenshare", screenshareEnabled)
            .put("fakeMedia", fakeMedia.toString())
            .put("resolution", resolution.value)
            .put("noiseSuppression", noiseSuppression.value)
            .put("transport", transport.value)
            .put("blur", blur)
            .put("headless", headless);
   }

   public static MediaSettings fromJson(JsonObject json) {
      return json == null ? DEFAULT : new Builder().apply(json).build();
   }

   @Override
   public String toString() {
      return toJson().encode();
   }

   public static class Builder {
      private boolean audioEnabled = true;
      private boolean videoEnabled = true;
      private boolean screenshareEnabled;
      private FakeMedia fakeMedia = FakeMedia.BUILTIN;
      private WebcamResolution resolution = WebcamResolution.AUTO;
      private NoiseSuppression noiseSuppression = NoiseSuppression.NONE;
      private TransportMode transport = TransportMode.WEBTRANSPORT;
      private boolean blur;
      private boolean headless = true;

      public Builder audio(boolean enabled) {
         this.audioEnabled = enabled;
         return this;
      }

      public Builder video(boolean enabled) {
         this.videoEnabled = enabled;
         return this;
      }

      public Builder screenshare(boolean enabled) {
         this.screenshareEnabled = enabled;
         return this;
      }

      public Builder fakeMedia(FakeMedia fakeMedia) {
         this.fakeMedia = fakeMedia == null ? FakeMedia.BUILTIN : fakeMedia;
         return this;
      }

      public Builder resolution(WebcamResolution resolution) {
         this.resolution = resolution;
         return this;
      }

      public Builder noiseSuppression(NoiseSuppression noiseSuppression) {
         this.noiseSuppression = noiseSuppression;
         return this;
      }

      public Builder transport(TransportMode transport) {
         this.transport = transport;
         return this;
      }

      public Builder blur(boolean blur) {
         this.blur = blur;
         return this;
      }

      public Builder headless(boolean headless) {
         this.headless = headless;
         return this;
      }

      /**
       * Overrides only the properties present in the JSON object.
       *
       * @throws IllegalArgumentException on unknown enum values.
       */
      public Builder apply(JsonObject json) {
         if (json.containsKey("audio")) {
            audio(json.getBoolean("audio"));
         }
         if (json.containsKey("video")) {
            video(json.getBoolean("video"));
         }
         if (json.containsKey("screenshare")) {
            screenshare(json.getBoolean("screenshare"));
         }
         if (json.containsKey("fakeMedia")) {
            fakeMedia(FakeMedia.parse(json.getString("fakeMedia")));
         }
         if (json.containsKey("resolution")) {
            resolution(WebcamResolution.fromString(json.getString("resolution")));
         }
         if (json.containsKey("noiseSuppression")) {
            noiseSuppression(NoiseSuppression.fromString(json.getString("noiseSuppression")));
         }
         if (json.containsKey("transport")) {
            transport(TransportMode.fromString(json.getString("transport")));
         }
         if (json.containsKey("blur")) {
            blur(json.getBoolean("blur"));
         }
         if (json.containsKey("headless")) {
            headless(json.getBoolean("headless"));
         }
         return this;
      }

      public MediaSettings build() {
         return new MediaSettings(this);
      }
   }
}
