package io.roomswarm.core.parser;

import io.roomswarm.api.config.BatchBuilder;

class DispatchParser extends AbstractMappingParser<BatchBuilder> {
   DispatchParser() {
      register("retries", new PropertyParser.Int<>(BatchBuilder::dispatchRetries));
      register("backoffMillis", new PropertyParser.Long<>(BatchBuilder::dispatchBackoffMillis));
   }
}
