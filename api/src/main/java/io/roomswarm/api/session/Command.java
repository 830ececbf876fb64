package io.roomswarm.api.session;

import java.io.Serializable;
import java.util.Objects;

public class Command implements Serializable {
   private final CommandKind kind;
   private final String argument;

   public Command(CommandKind kind, String argument) {
      this.kind = Objects.requireNonNull(kind);
      this.argument = argument;
   }

   public static Command of(CommandKind kind) {
      return new Command(kind, null);
   }

   public CommandKind kind() {
      return kind;
   }

   public String argument() {
      return argument;
   }

   @Override
   public String toString() {
      return argument == null ? kind.value : kind.value + "(" + argument + ")";
   }
}
