package io.roomswarm.api.driver;

import io.vertx.core.Future;
import io.vertx.core.Vertx;

/**
 * Creates a dedicated surface per participant. Implementations are looked up through {@link java.util.ServiceLoader}.
 */
public interface RenderingSurfaceFactory {
   String name();

   Future<RenderingSurface> create(Vertx vertx, SurfaceOptions options);
}
