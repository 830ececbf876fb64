package io.roomswarm.api.driver;

import java.util.Collections;
import java.util.List;

public class SurfaceOptions {
   public final String owner;
   public final boolean headless;
   public final List<String> arguments;

   public SurfaceOptions(String owner, boolean headless, List<String> arguments) {
      this.owner = owner;
      this.headless = headless;
      this.arguments = Collections.unmodifiableList(arguments);
   }

   @Override
   public String toString() {
      return "SurfaceOptions{owner=" + owner + ", headless=" + headless + ", arguments=" + arguments + "}";
   }
}
