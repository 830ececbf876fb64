package io.roomswarm.api.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * One participant of a batch, with settings already merged over the batch defaults.
 */
public class ParticipantSpec implements Serializable {
   private final int index;
   private final String username;
   private final long waitToJoinMillis;
   private final MediaSettings media;
   private final StrategyKind strategy;

   public ParticipantSpec(int index, String username, long waitToJoinMillis, MediaSettings media, StrategyKind strategy) {
      this.index = index;
      this.username = username;
      this.waitToJoinMillis = waitToJoinMillis;
      this.media = media;
      this.strategy = strategy;
   }

   public int index() {
      return index;
   }

   public String username() {
      return username;
   }

   public long waitToJoinMillis() {
      return waitToJoinMillis;
   }

   public MediaSettings media() {
      return media;
   }

   public StrategyKind strategy() {
      return strategy;
   }

   public ParticipantIdentity identity(String sessionUrl) {
      return new ParticipantIdentity(username, sessionUrl, media, strategy);
   }

   @Override
   public String toString() {
      return "#" + index + " " + username;
   }

   public static class Builder {
      private final int index;
      private String username;
      private long waitToJoinMillis;
      private StrategyKind strategy;
      private final List<Consumer<MediaSettings.Builder>> mediaOverrides = new ArrayList<>();

      Builder(int index) {
         this.index = index;
      }

      public int index() {
         return index;
      }

      public Builder username(String username) {
         this.username = username;
         return this;
      }

      public Builder waitToJoinMillis(long millis) {
         this.waitToJoinMillis = millis;
         return this;
      }

      public Builder waitToJoinSeconds(double seconds) {
         return waitToJoinMillis(Math.round(seconds * 1000));
      }

      public Builder strategy(StrategyKind strategy) {
         this.strategy = strategy;
         return this;
      }

      public Builder media(Consumer<MediaSettings.Builder> override) {
         mediaOverrides.add(override);
         return this;
      }

      String effectiveUsername() {
         return username == null || username.isBlank() ? "orch-" + index : username;
      }

      long waitToJoinMillis() {
         return waitToJoinMillis;
      }

      ParticipantSpec build(MediaSettings defaults, StrategyKind defaultStrategy) {
         MediaSettings.Builder media = defaults.toBuilder();
         mediaOverrides.forEach(o -> o.accept(media));
         return new ParticipantSpec(index, effectiveUsername(), waitToJoinMillis, media.build(),
               strategy == null ? defaultStrategy : strategy);
      }
   }
}
