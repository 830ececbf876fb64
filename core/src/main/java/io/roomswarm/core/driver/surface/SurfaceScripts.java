package io.roomswarm.core.driver.surface;

import io.roomswarm.core.credentials.GuestLoginFlow;
import io.vertx.core.json.Json;

/**
 * Scripts evaluated in the page. Values are embedded as JSON literals.
 */
final class SurfaceScripts {
   private SurfaceScripts() {
   }

   static String setSessionCookie(String token, long maxAgeSeconds) {
      return "document.cookie = " + Json.encode(GuestLoginFlow.SESSION_COOKIE + "=" + token + "; path=/; max-age=" + maxAgeSeconds) + ";";
   }

   static String currentPath() {
      return "window.location.pathname";
   }

   static String readState(String selector) {
      return "(function() { var e = document.querySelector(" + Json.encode(selector) + "); " +
            "return e == null ? null : e.getAttribute(" + Json.encode(UiSelectors.STATE_ATTRIBUTE) + "); })()";
   }

   static String isPresent(String selector) {
      return "document.querySelector(" + Json.encode(selector) + ") != null";
   }

   static String setBackgroundBlur(boolean enabled) {
      return "hyper.settings.media.actions.setBackgroundBlur(" + enabled + ")";
   }

   static String setNoiseSuppression(String level) {
      return "hyper.settings.media.actions.setNoiseSuppression(" + Json.encode(level) + ")";
   }

   static String setResolution(String resolution) {
      return "hyper.settings.videoCodec.actions.setVideoResolutionForWebcamEncoder(" + Json.encode(resolution) + ")";
   }

   static String forceWebrtc(boolean force) {
      return "hyper.settings.sessionDebug.actions.setForceWebrtc(" + force + ")";
   }
}
