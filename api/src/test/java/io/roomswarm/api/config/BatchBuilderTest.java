package io.roomswarm.api.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import io.roomswarm.api.ErrorKind;

public class BatchBuilderTest {
   private static BatchBuilder valid() {
      return BatchBuilder.builder()
            .sessionUrl("https://meet.example.com/standup")
            .addWorker("http://worker-1:8080")
            .addWorker("http://worker-2:8080");
   }

   @Test
   public void testRoundRobinAssignment() {
      BatchBuilder builder = valid();
      for (int i = 0; i < 5; ++i) {
         builder.addParticipant("user-" + i);
      }
      Batch batch = builder.build();
      assertThat(batch.participants()).hasSize(5);
      assertThat(batch.participants().stream().map(p -> batch.workerFor(p).index))
            .containsExactly(0, 1, 0, 1, 0);
   }

   @Test
   public void testMissingUsernameIsGenerated() {
      BatchBuilder builder = valid();
      builder.addParticipant("alice");
      builder.addParticipant();
      Batch batch = builder.build();
      assertThat(batch.participants().get(1).username()).isEqualTo("orch-1");
   }

   @Test
   public void testMediaOverridesApplyOnTopOfDefaults() {
      BatchBuilder builder = valid()
            .defaults(m -> m.video(false).resolution(WebcamResolution.P720))
            .strategy(StrategyKind.SURFACE);
      builder.addParticipant().username("alice").media(m -> m.audio(false));
      builder.addParticipant().username("bob").strategy(StrategyKind.PROTOCOL).media(m -> m.video(true));
      Batch batch = builder.build();

      ParticipantSpec alice = batch.participants().get(0);
      assertThat(alice.media().audioEnabled()).isFalse();
      assertThat(alice.media().videoEnabled()).isFalse();
      assertThat(alice.media().resolution()).isEqualTo(WebcamResolution.P720);
      assertThat(alice.strategy()).isEqualTo(StrategyKind.SURFACE);

      ParticipantSpec bob = batch.participants().get(1);
      assertThat(bob.media().audioEnabled()).isTrue();
      assertThat(bob.media().videoEnabled()).isTrue();
      assertThat(bob.strategy()).isEqualTo(StrategyKind.PROTOCOL);
   }

   @Test
   public void testAllViolationsReported() {
      BatchBuilder builder = BatchBuilder.builder()
            .sessionUrl("meet.example.com/standup")
            .timeoutMillis(0)
            .dispatchRetries(-1);
      builder.addParticipant("alice");
      builder.addParticipant("alice");
      builder.addParticipant().username("bob").waitToJoinMillis(-5);

      assertThatThrownBy(builder::build)
            .isInstanceOfSatisfying(BatchValidationException.class, e -> {
               assertThat(e.kind()).isEqualTo(ErrorKind.VALIDATION);
               assertThat(e.violations()).hasSize(6);
               assertThat(e.violations()).anyMatch(v -> v.contains("Duplicate username 'alice'"));
               assertThat(e.violations()).anyMatch(v -> v.contains("negative join delay"));
               assertThat(e.violations()).anyMatch(v -> v.startsWith("Session URL"));
               assertThat(e.violations()).contains("No workers defined");
            });
   }

   @Test
   public void testNoParticipants() {
      assertThatThrownBy(() -> valid().build())
            .isInstanceOf(BatchValidationException.class)
            .hasMessageContaining("No participants defined");
   }

   @Test
   public void testInvalidWorkerUrl() {
      BatchBuilder builder = valid().addWorker("worker-3");
      builder.addParticipant("alice");
      assertThatThrownBy(builder::build)
            .isInstanceOfSatisfying(BatchValidationException.class,
                  e -> assertThat(e.violations()).containsExactly("Worker #2 URL is not an absolute http(s) URL: 'worker-3'"));
   }
}
