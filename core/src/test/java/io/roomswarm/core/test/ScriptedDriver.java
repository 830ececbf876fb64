package io.roomswarm.core.test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

import io.roomswarm.api.config.MediaSettings;
import io.roomswarm.api.config.NoiseSuppression;
import io.roomswarm.api.config.StrategyKind;
import io.roomswarm.api.config.WebcamResolution;
import io.roomswarm.api.credentials.Credential;
import io.roomswarm.api.driver.ParticipantDriver;
import io.roomswarm.api.session.CommandKind;
import io.roomswarm.api.session.MediaState;
import io.vertx.core.Future;
import io.vertx.core.Handler;

/**
 * Driver that records every call and succeeds immediately unless a behavior is scripted for the operation.
 */
public class ScriptedDriver implements ParticipantDriver {
   private final List<String> calls = new CopyOnWriteArrayList<>();
   private final Map<String, Supplier<Future<Void>>> behaviors = new ConcurrentHashMap<>();
   private final Set<CommandKind> unsupported = EnumSet.noneOf(CommandKind.class);
   private volatile Handler<Throwable> disconnectHandler;

   /**
    * Operations are named after the driver methods: {@code authenticate}, {@code join}, {@code startMedia},
    * {@code toggle}, {@code setNoiseSuppression}, {@code setResolution}, {@code leave} and {@code release}.
    */
   public ScriptedDriver on(String operation, Supplier<Future<Void>> behavior) {
      behaviors.put(operation, behavior);
      return this;
   }

   public ScriptedDriver unsupported(CommandKind kind) {
      unsupported.add(kind);
      return this;
   }

   public List<String> calls() {
      return calls;
   }

   public void disconnect(Throwable cause) {
      disconnectHandler.handle(cause);
   }

   private Future<Void> call(String operation) {
      calls.add(operation);
      Supplier<Future<Void>> behavior = behaviors.get(operation);
      return behavior == null ? Future.succeededFuture() : behavior.get();
   }

   @Override
   public StrategyKind kind() {
      return StrategyKind.PROTOCOL;
   }

   @Override
   public boolean supports(CommandKind command) {
      return !unsupported.contains(command);
   }

   @Override
   public Future<Void> authenticate(Credential credential) {
      return call("authenticate");
   }

   @Override
   public Future<Void> join() {
      return call("join");
   }

   @Override
   public Future<MediaState> startMedia(MediaSettings settings) {
      return call("startMedia").map(nil -> MediaState.of(settings));
   }

   @Override
   public Future<Void> toggle(CommandKind toggle, boolean enabled) {
      calls.add(toggle + "=" + enabled);
      return call("toggle");
   }

   @Override
   public Future<Void> setNoiseSuppression(NoiseSuppression level) {
      return call("setNoiseSuppression");
   }

   @Override
   public Future<Void> setResolution(WebcamResolution resolution) {
      calls.add("resolution=" + resolution);
      return call("setResolution");
   }

   @Override
   public Future<Void> leave() {
      return call("leave");
   }

   @Override
   public Future<Void> release() {
      return call("release");
   }

   @Override
   public void forceRelease() {
      calls.add("forceRelease");
   }

   @Override
   public void disconnectHandler(Handler<Throwable> handler) {
      this.disconnectHandler = handler;
   }
}
