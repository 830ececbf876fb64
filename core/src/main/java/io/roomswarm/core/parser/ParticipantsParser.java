package io.roomswarm.core.parser;

import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.events.ScalarEvent;

import io.roomswarm.api.config.BatchBuilder;
import io.roomswarm.api.config.ParticipantSpec;
import io.roomswarm.api.config.StrategyKind;

/**
 * A participant is either a bare username or a mapping.
 */
class ParticipantsParser implements Parser<BatchBuilder> {
   private final ParticipantParser participantParser = new ParticipantParser();

   @Override
   public void parse(Context ctx, BatchBuilder builder) throws ParserException {
      ctx.parseList(builder, this::parseParticipant);
   }

   private void parseParticipant(Context ctx, BatchBuilder builder) throws ParserException {
      Event event = ctx.peek();
      if (event instanceof ScalarEvent) {
         ctx.consumePeeked(event);
         builder.addParticipant(((ScalarEvent) event).getValue());
      } else {
         participantParser.parse(ctx, builder.addParticipant());
      }
   }

   private static class ParticipantParser extends AbstractMappingParser<ParticipantSpec.Builder> {
      ParticipantParser() {
         register("username", new PropertyParser.String<>(ParticipantSpec.Builder::username));
         register("waitToJoinSeconds", new PropertyParser.Seconds<>(ParticipantSpec.Builder::waitToJoinMillis));
         register("strategy", new PropertyParser.Value<>(StrategyKind::fromString, ParticipantSpec.Builder::strategy));
         register("media", (ctx, participant) -> MediaSettingsParser.INSTANCE.parse(ctx, participant::media));
      }
   }
}
