package io.roomswarm.api.config;

import java.util.Collections;
import java.util.List;

import io.roomswarm.api.ErrorKind;
import io.roomswarm.api.SimulatorException;

/**
 * Batch definition was rejected; {@link #violations()} lists every problem found, not just the first one.
 */
public class BatchValidationException extends SimulatorException {
   private final List<String> violations;

   public BatchValidationException(List<String> violations) {
      super(ErrorKind.VALIDATION, format(violations));
      this.violations = Collections.unmodifiableList(violations);
   }

   public BatchValidationException(String violation, Throwable cause) {
      super(ErrorKind.VALIDATION, format(List.of(violation)), cause);
      this.violations = List.of(violation);
   }

   public List<String> violations() {
      return violations;
   }

   private static String format(List<String> violations) {
      StringBuilder sb = new StringBuilder("Invalid batch definition (").append(violations.size())
            .append(violations.size() == 1 ? " violation)" : " violations)");
      for (String violation : violations) {
         sb.append("\n  - ").append(violation);
      }
      return sb.toString();
   }
}
