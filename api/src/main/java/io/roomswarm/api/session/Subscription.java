package io.roomswarm.api.session;

@FunctionalInterface
public interface Subscription {
   void cancel();
}
