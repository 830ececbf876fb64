package io.roomswarm.core.parser;

import java.util.function.BiConsumer;
import java.util.function.Function;

import org.yaml.snakeyaml.events.ScalarEvent;

public class PropertyParser {
   private PropertyParser() {}

   public static class String<T> implements Parser<T> {
      private final BiConsumer<T, java.lang.String> consumer;

      public String(BiConsumer<T, java.lang.String> consumer) {
         this.consumer = consumer;
      }

      @Override
      public void parse(Context ctx, T target) throws ParserException {
         ScalarEvent event = ctx.expectEvent(ScalarEvent.class);
         consumer.accept(target, event.getValue());
      }
   }

   public static class Int<T> implements Parser<T> {
      private final BiConsumer<T, Integer> consumer;

      public Int(BiConsumer<T, Integer> consumer) {
         this.consumer = consumer;
      }

      @Override
      public void parse(Context ctx, T target) throws ParserException {
         ScalarEvent event = ctx.expectEvent(ScalarEvent.class);
         try {
            consumer.accept(target, Integer.parseInt(event.getValue().trim()));
         } catch (NumberFormatException e) {
            throw new ParserException(event, "Failed to parse as integer: " + event.getValue());
         }
      }
   }

   public static class Long<T> implements Parser<T> {
      private final BiConsumer<T, java.lang.Long> consumer;

      public Long(BiConsumer<T, java.lang.Long> consumer) {
         this.consumer = consumer;
      }

      @Override
      public void parse(Context ctx, T target) throws ParserException {
         ScalarEvent event = ctx.expectEvent(ScalarEvent.class);
         try {
            consumer.accept(target, java.lang.Long.parseLong(event.getValue().trim()));
         } catch (NumberFormatException e) {
            throw new ParserException(event, "Failed to parse as long: " + event.getValue());
         }
      }
   }

   /**
    * Seconds, possibly fractional, converted to milliseconds.
    */
   public static class Seconds<T> implements Parser<T> {
      private final BiConsumer<T, java.lang.Long> consumer;

      public Seconds(BiConsumer<T, java.lang.Long> consumer) {
         this.consumer = consumer;
      }

      @Override
      public void parse(Context ctx, T target) throws ParserException {
         ScalarEvent event = ctx.expectEvent(ScalarEvent.class);
         try {
            consumer.accept(target, Math.round(java.lang.Double.parseDouble(event.getValue().trim()) * 1000));
         } catch (NumberFormatException e) {
            throw new ParserException(event, "Failed to parse as number of seconds: " + event.getValue());
         }
      }
   }

   public static class Boolean<T> implements Parser<T> {
      private final BiConsumer<T, java.lang.Boolean> consumer;

      public Boolean(BiConsumer<T, java.lang.Boolean> consumer) {
         this.consumer = consumer;
      }

      @Override
      public void parse(Context ctx, T target) throws ParserException {
         ScalarEvent event = ctx.expectEvent(ScalarEvent.class);
         boolean value;
         if (event.getValue().equalsIgnoreCase("true")) {
            value = true;
         } else if (event.getValue().equalsIgnoreCase("false")) {
            value = false;
         } else {
            throw new ParserException(event, "Failed to parse as boolean: " + event.getValue());
         }
         consumer.accept(target, value);
      }
   }

   /**
    * Value converted by a factory method such as {@code fromString}; an {@link IllegalArgumentException}
    * from the factory is reported with the location.
    */
   public static class Value<V, T> implements Parser<T> {
      private final Function<java.lang.String, V> factory;
      private final BiConsumer<T, V> consumer;

      public Value(Function<java.lang.String, V> factory, BiConsumer<T, V> consumer) {
         this.factory = factory;
         this.consumer = consumer;
      }

      @Override
      public void parse(Context ctx, T target) throws ParserException {
         ScalarEvent event = ctx.expectEvent(ScalarEvent.class);
         V value;
         try {
            value = factory.apply(event.getValue().trim());
         } catch (IllegalArgumentException e) {
            throw new ParserException(event, e.getMessage());
         }
         consumer.accept(target, value);
      }
   }
}
