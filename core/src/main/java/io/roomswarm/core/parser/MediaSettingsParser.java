package io.roomswarm.core.parser;

import java.util.function.Consumer;

import io.roomswarm.api.config.FakeMedia;
import io.roomswarm.api.config.MediaSettings;
import io.roomswarm.api.config.NoiseSuppression;
import io.roomswarm.api.config.TransportMode;
import io.roomswarm.api.config.WebcamResolution;

/**
 * Parses media settings into overrides applied on top of the defaults.
 */
class MediaSettingsParser extends AbstractMappingParser<MediaSettingsParser.Overrides> {
   static final MediaSettingsParser INSTANCE = new MediaSettingsParser();

   private MediaSettingsParser() {
      register("audio", new PropertyParser.Boolean<>((o, v) -> o.add(b -> b.audio(v))));
      register("video", new PropertyParser.Boolean<>((o, v) -> o.add(b -> b.video(v))));
      register("screenshare", new PropertyParser.Boolean<>((o, v) -> o.add(b -> b.screenshare(v))));
      register("fakeMedia", new PropertyParser.Value<>(FakeMedia::parse, (o, v) -> o.add(b -> b.fakeMedia(v))));
      register("resolution", new PropertyParser.Value<>(WebcamResolution::fromString, (o, v) -> o.add(b -> b.resolution(v))));
      register("noiseSuppression", new PropertyParser.Value<>(NoiseSuppression::fromString, (o, v) -> o.add(b -> b.noiseSuppression(v))));
      register("transport", new PropertyParser.Value<>(TransportMode::fromString, (o, v) -> o.add(b -> b.transport(v))));
      register("blur", new PropertyParser.Boolean<>((o, v) -> o.add(b -> b.blur(v))));
      register("headless", new PropertyParser.Boolean<>((o, v) -> o.add(b -> b.headless(v))));
   }

   @FunctionalInterface
   interface Overrides {
      void add(Consumer<MediaSettings.Builder> override);
   }
}
