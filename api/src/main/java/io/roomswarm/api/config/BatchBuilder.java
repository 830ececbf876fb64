package io.roomswarm.api.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;

public class BatchBuilder {
   private String sessionUrl;
   private final List<String> workerUrls = new ArrayList<>();
   private final List<Consumer<MediaSettings.Builder>> defaults = new ArrayList<>();
   private StrategyKind strategy = StrategyKind.PROTOCOL;
   private final List<ParticipantSpec.Builder> participants = new ArrayList<>();
   private long runMillis = 60_000;
   private long timeoutMillis = 300_000;
   private int dispatchRetries = 3;
   private long dispatchBackoffMillis = 500;

   public static BatchBuilder builder() {
      return new BatchBuilder();
   }

   public BatchBuilder sessionUrl(String sessionUrl) {
      this.sessionUrl = sessionUrl;
      return this;
   }

   public BatchBuilder addWorker(String url) {
      workerUrls.add(url);
      return this;
   }

   public BatchBuilder defaults(Consumer<MediaSettings.Builder> override) {
      defaults.add(override);
      return this;
   }

   public BatchBuilder strategy(StrategyKind strategy) {
      this.strategy = strategy;
      return this;
   }

   public BatchBuilder runMillis(long runMillis) {
      this.runMillis = runMillis;
      return this;
   }

   public BatchBuilder timeoutMillis(long timeoutMillis) {
      this.timeoutMillis = timeoutMillis;
      return this;
   }

   public BatchBuilder dispatchRetries(int retries) {
      this.dispatchRetries = retries;
      return this;
   }

   public BatchBuilder dispatchBackoffMillis(long millis) {
      this.dispatchBackoffMillis = millis;
      return this;
   }

   public ParticipantSpec.Builder addParticipant() {
      ParticipantSpec.Builder builder = new ParticipantSpec.Builder(participants.size());
      participants.add(builder);
      return builder;
   }

   public BatchBuilder addParticipant(String username) {
      addParticipant().username(username);
      return this;
   }

   /**
    * @throws BatchValidationException listing every violation when the definition is not valid.
    */
   public Batch build() {
      List<String> violations = new ArrayList<>();
      if (sessionUrl == null || sessionUrl.isBlank()) {
         violations.add("Missing session URL");
      } else if (!isHttpUrl(sessionUrl)) {
         violations.add("Session URL is not an absolute http(s) URL: '" + sessionUrl + "'");
      }
      if (workerUrls.isEmpty()) {
         violations.add("No workers defined");
      }
      List<WorkerRef> workers = new ArrayList<>();
      for (int i = 0; i < workerUrls.size(); ++i) {
         String url = workerUrls.get(i);
         if (url == null || !isHttpUrl(url)) {
            violations.add("Worker #" + i + " URL is not an absolute http(s) URL: '" + url + "'");
         }
         workers.add(new WorkerRef(i, url));
      }
      if (participants.isEmpty()) {
         violations.add("No participants defined");
      }
      Map<String, List<Integer>> byUsername = new LinkedHashMap<>();
      for (ParticipantSpec.Builder participant : participants) {
         byUsername.computeIfAbsent(participant.effectiveUsername(), u -> new ArrayList<>()).add(participant.index());
         if (participant.waitToJoinMillis() < 0) {
            violations.add("Participant '" + participant.effectiveUsername() + "' has negative join delay: " +
                  participant.waitToJoinMillis() + " ms");
         }
      }
      byUsername.forEach((username, indices) -> {
         if (indices.size() > 1) {
            violations.add("Duplicate username '" + username + "' (participants " +
                  indices.stream().map(i -> "#" + i).collect(Collectors.joining(", ")) + ")");
         }
      });
      if (runMillis < 0) {
         violations.add("Run time must not be negative: " + runMillis + " ms");
      }
      if (timeoutMillis <= 0) {
         violations.add("Batch timeout must be positive: " + timeoutMillis + " ms");
      }
      if (dispatchRetries < 0) {
         violations.add("Dispatch retries must not be negative: " + dispatchRetries);
      }
      if (dispatchBackoffMillis < 0) {
         violations.add("Dispatch backoff must not be negative: " + dispatchBackoffMillis + " ms");
      }
      if (!violations.isEmpty()) {
         throw new BatchValidationException(violations);
      }
      MediaSettings.Builder defaultsBuilder = MediaSettings.builder();
      defaults.forEach(d -> d.accept(defaultsBuilder));
      MediaSettings defaultMedia = defaultsBuilder.build();
      List<ParticipantSpec> specs = participants.stream()
            .map(p -> p.build(defaultMedia, strategy)).collect(Collectors.toList());
      return new Batch(sessionUrl, workers, defaultMedia, specs, runMillis, timeoutMillis, dispatchRetries, dispatchBackoffMillis);
   }

   private static boolean isHttpUrl(String url) {
      try {
         URI uri = new URI(url);
         return uri.getHost() != null && ("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()));
      } catch (URISyntaxException e) {
         return false;
      }
   }
}
