package io.roomswarm.internal;

import java.util.function.Function;

public interface Properties {
   String STACKTRACE = "io.roomswarm.stacktrace";
   String GATEWAY_HOST = "io.roomswarm.gateway.host";
   String GATEWAY_PORT = "io.roomswarm.gateway.port";
   String CREDENTIALS_DIR = "io.roomswarm.credentials.dir";
   String CLOSE_GRACE = "io.roomswarm.close.grace";
   String TIMEOUT_AUTH = "io.roomswarm.timeout.auth";
   String TIMEOUT_JOIN = "io.roomswarm.timeout.join";
   String TIMEOUT_MEDIA = "io.roomswarm.timeout.media";
   String TIMEOUT_COMMAND = "io.roomswarm.timeout.command";
   String SURFACE_UI = "io.roomswarm.surface.ui";
   String SURFACE_WAIT_RETRIES = "io.roomswarm.surface.wait.retries";
   String SURFACE_WAIT_TIMEOUT = "io.roomswarm.surface.wait.timeout";
   String SIGNALING_PATH = "io.roomswarm.signaling.path";
   String REGISTRY_RETENTION = "io.roomswarm.registry.retention";
   String ORCHESTRATOR_POLL = "io.roomswarm.orchestrator.poll";
   String ORCHESTRATOR_SUMMARY = "io.roomswarm.orchestrator.summary";
   String REQUEST_TIMEOUT = "io.roomswarm.request.timeout";
   String LOG4J2_CONFIGURATION_FILE = "log4j.configurationFile";

   static String get(String property, String def) {
      return get(property, Function.identity(), def);
   }

   static long getLong(String property, long def) {
      return get(property, Long::valueOf, def);
   }

   static int getInt(String property, int def) {
      return get(property, Integer::valueOf, def);
   }

   static boolean getBoolean(String property) {
      return get(property, Boolean::valueOf, false);
   }

   static <T> T get(String property, Function<String, T> f, T def) {
      String value = System.getProperty(property);
      if (value != null) {
         return f.apply(value);
      }
      value = System.getenv(property.replaceAll("[^a-zA-Z0-9]", "_").toUpperCase());
      if (value != null) {
         return f.apply(value);
      }
      return def;
   }
}
