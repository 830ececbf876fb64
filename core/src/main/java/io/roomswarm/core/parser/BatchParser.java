package io.roomswarm.core.parser;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.events.DocumentEndEvent;
import org.yaml.snakeyaml.events.DocumentStartEvent;
import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.events.StreamEndEvent;
import org.yaml.snakeyaml.events.StreamStartEvent;

import io.roomswarm.api.config.Batch;
import io.roomswarm.api.config.BatchBuilder;
import io.roomswarm.api.config.StrategyKind;

/**
 * Reads the declarative batch file. Structural problems are reported as {@link ParserException} with
 * the location; semantic validation happens in {@link BatchBuilder#build()}.
 */
public class BatchParser extends AbstractMappingParser<BatchBuilder> {
   private static final Logger log = LogManager.getLogger(BatchParser.class);
   private static final BatchParser INSTANCE = new BatchParser();

   public static BatchParser instance() {
      return INSTANCE;
   }

   private BatchParser() {
      register("sessionUrl", new PropertyParser.String<>(BatchBuilder::sessionUrl));
      register("runSeconds", new PropertyParser.Seconds<>(BatchBuilder::runMillis));
      register("batchTimeoutSeconds", new PropertyParser.Seconds<>(BatchBuilder::timeoutMillis));
      register("strategy", new PropertyParser.Value<>(StrategyKind::fromString, BatchBuilder::strategy));
      register("dispatch", new DispatchParser());
      register("workers", new WorkersParser());
      register("defaults", (ctx, builder) -> MediaSettingsParser.INSTANCE.parse(ctx, builder::defaults));
      register("participants", new ParticipantsParser());
   }

   public Batch parse(Path file) throws ParserException, IOException {
      log.debug("Loading batch from {}", file);
      return builder(Files.readString(file, StandardCharsets.UTF_8)).build();
   }

   public Batch parse(String yaml) throws ParserException {
      return builder(yaml).build();
   }

   public BatchBuilder builder(String source) throws ParserException {
      Yaml yaml = new Yaml();
      Iterator<Event> events = yaml.parse(new StringReader(source)).iterator();
      Context ctx = new Context(events);

      ctx.expectEvent(StreamStartEvent.class);
      if (ctx.peek() instanceof StreamEndEvent) {
         throw new ParserException("Batch file is empty");
      }
      ctx.expectEvent(DocumentStartEvent.class);

      BatchBuilder builder = BatchBuilder.builder();
      parse(ctx, builder);

      ctx.expectEvent(DocumentEndEvent.class);
      ctx.expectEvent(StreamEndEvent.class);
      return builder;
   }
}
