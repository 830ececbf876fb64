package io.roomswarm.core.parser;

import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.events.MappingEndEvent;
import org.yaml.snakeyaml.events.MappingStartEvent;
import org.yaml.snakeyaml.events.ScalarEvent;

import io.roomswarm.api.config.BatchBuilder;

/**
 * Workers are listed either as plain URLs or as mappings with the {@code url} key.
 */
class WorkersParser implements Parser<BatchBuilder> {

   @Override
   public void parse(Context ctx, BatchBuilder builder) throws ParserException {
      ctx.parseList(builder, this::parseWorker);
   }

   private void parseWorker(Context ctx, BatchBuilder builder) throws ParserException {
      Event event = ctx.next();
      if (event instanceof ScalarEvent) {
         builder.addWorker(((ScalarEvent) event).getValue());
      } else if (event instanceof MappingStartEvent) {
         String url = null;
         while (ctx.hasNext()) {
            Event next = ctx.next();
            if (next instanceof MappingEndEvent) {
               break;
            } else if (next instanceof ScalarEvent) {
               String key = ((ScalarEvent) next).getValue();
               if (!"url".equals(key)) {
                  throw new ParserException(next, "Invalid configuration label: '" + key + "', expected one of [url]");
               }
               url = ctx.expectEvent(ScalarEvent.class).getValue();
            } else {
               throw ctx.unexpectedEvent(next);
            }
         }
         if (url == null) {
            throw new ParserException(event, "Worker must define 'url'");
         }
         builder.addWorker(url);
      } else {
         throw ctx.unexpectedEvent(event);
      }
   }
}
