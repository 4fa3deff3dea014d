package io.github.themoah.vigil.config;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x options for the Vigil process.
 * The event loop pool size can be pinned via VERTX_EVENT_LOOP_POOL_SIZE.
 */
public final class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);
  private static final String ENV_EVENT_LOOP_POOL_SIZE = "VERTX_EVENT_LOOP_POOL_SIZE";

  private VertxConfig() {}

  public static VertxOptions createVertxOptions() {
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(true);

    int eventLoops = Env.system().getInt(ENV_EVENT_LOOP_POOL_SIZE, 0);
    if (eventLoops > 0) {
      log.info("Using {} event loop threads", eventLoops);
      options.setEventLoopPoolSize(eventLoops);
    }
    return options;
  }

  /**
   * A single instance of the main verticle: scoring runs inline on its event loop.
   */
  public static DeploymentOptions createDeploymentOptions() {
    return new DeploymentOptions().setInstances(1);
  }
}
