package io.roomswarm.core.driver.surface;

/**
 * Element selectors of one flavour of the web client.
 */
public final class UiSelectors {
   public static final UiSelectors CLASSIC = new UiSelectors("classic", "data-testid",
         "button[type=\"submit\"]:not([disabled])", true);
   public static final UiSelectors LITE = new UiSelectors("lite", "data-test-id",
         "button[data-test-id=\"join-button\"]:not([disabled])", false);

   public static final String STATE_ATTRIBUTE = "data-test-state";

   public final String name;
   public final String leave;
   public final String audio;
   public final String video;
   public final String screenshare;
   public final String nameInput;
   public final String join;
   /** Blur, noise suppression and resolution can be changed. */
   public final boolean advancedSettings;

   private UiSelectors(String name, String attribute, String join, boolean advancedSettings) {
      this.name = name;
      this.leave = testId(attribute, "trigger-leave-call");
      this.audio = testId(attribute, "toggle-audio");
      this.video = testId(attribute, "toggle-video");
      this.screenshare = testId(attribute, "toggle-screen-share");
      this.nameInput = testId(attribute, "trigger-join-name");
      this.join = join;
      this.advancedSettings = advancedSettings;
   }

   private static String testId(String attribute, String value) {
      return "[" + attribute + "=\"" + value + "\"]";
   }

   public static UiSelectors forName(String name) {
      if (LITE.name.equalsIgnoreCase(name)) {
         return LITE;
      } else if (CLASSIC.name.equalsIgnoreCase(name)) {
         return CLASSIC;
      }
      throw new IllegalArgumentException("Unknown UI flavour '" + name + "', expected classic or lite");
   }

   @Override
   public String toString() {
      return name;
   }
}
