package io.roomswarm.api.session;

import java.io.Serializable;

import io.roomswarm.api.config.MediaSettings;
import io.roomswarm.api.config.NoiseSuppression;
import io.roomswarm.api.config.WebcamResolution;
import io.vertx.core.json.JsonObject;

/**
 * Current media of a joined participant. Instances are immutable, updates produce a copy.
 */
public final class MediaState implements Serializable {
   public static final MediaState OFF = new MediaState(false, false, false, false, NoiseSuppression.NONE, WebcamResolution.AUTO);

   private final boolean audio;
   private final boolean video;
   private final boolean screenshare;
   private final boolean blur;
   private final NoiseSuppression noiseSuppression;
   private final WebcamResolution resolution;

   public MediaState(boolean audio, boolean video, boolean screenshare, boolean blur,
                     NoiseSuppression noiseSuppression, WebcamResolution resolution) {
      this.audio = audio;
      this.video = video;
      this.screenshare = screenshare;
      this.blur = blur;
      this.noiseSuppression = noiseSuppression;
      this.resolution = resolution;
   }

   public static MediaState of(MediaSettings settings) {
      return new MediaState(settings.audioEnabled(), settings.videoEnabled(), settings.screenshareEnabled(),
            settings.blur(), settings.noiseSuppression(), settings.resolution());
   }

   public boolean audio() {
      return audio;
   }

   public boolean video() {
      return video;
   }

   public boolean screenshare() {
      return screenshare;
   }

   public boolean blur() {
      return blur;
   }

   public NoiseSuppression noiseSuppression() {
      return noiseSuppression;
   }

   public WebcamResolution resolution() {
      return resolution;
   }

   public boolean isEnabled(CommandKind toggle) {
      switch (toggle) {
         case TOGGLE_AUDIO:
            return audio;
         case TOGGLE_VIDEO:
            return video;
         case TOGGLE_SCREENSHARE:
            return screenshare;
         case TOGGLE_BLUR:
            return blur;
         default:
            throw new IllegalArgumentException(toggle + " is not a toggle");
      }
   }

   public MediaState with(CommandKind toggle, boolean enabled) {
      switch (toggle) {
         case TOGGLE_AUDIO:
            return new MediaState(enabled, video, screenshare, blur, noiseSuppression, resolution);
         case TOGGLE_VIDEO:
            return new MediaState(audio, enabled, screenshare, blur, noiseSuppression, resolution);
         case TOGGLE_SCREENSHARE:
            return new MediaState(audio, video, enabled, blur, noiseSuppression, resolution);
         case TOGGLE_BLUR:
            return new MediaState(audio, video, screenshare, enabled, noiseSuppression, resolution);
         default:
            throw new IllegalArgumentException(toggle + " is not a toggle");
      }
   }

   public MediaState withNoiseSuppression(NoiseSuppression level) {
      return new MediaState(audio, video, screenshare, blur, level, resolution);
   }

   public MediaState withResolution(WebcamResolution resolution) {
      return new MediaState(audio, video, screenshare, blur, noiseSuppression, resolution);
   }

   public JsonObject toJson() {
      return new JsonObject()
            .put("audio", audio)
            .put("video", video)
            .put("screenshare", screenshare)
            .put("blur", blur)
            .put("noiseSuppression", noiseSuppression.value)
            .put("resolution", resolution.value);
   }

   public static MediaState fromJson(JsonObject json) {
      return new MediaState(json.getBoolean("audio", false), json.getBoolean("video", false),
            json.getBoolean("screenshare", false), json.getBoolean("blur", false),
            NoiseSuppression.fromString(json.getString("noiseSuppression", "none")),
            WebcamResolution.fromString(json.getString("resolution", "auto")));
   }

   @Override
   public String toString() {
      return toJson().encode();
   }
}
