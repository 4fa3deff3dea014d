package io.github.themoah.vigil;

import io.github.themoah.vigil.config.VertxConfig;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: creates the Vert.x instance and deploys {@link MainVerticle}.
 */
public class VigilLauncher {

  private static final Logger log = LoggerFactory.getLogger(VigilLauncher.class);

  public static void main(String[] args) {
    Vertx vertx = Vertx.vertx(VertxConfig.createVertxOptions());
    DeploymentOptions deployment = VertxConfig.createDeploymentOptions();

    vertx.deployVerticle(new MainVerticle(), deployment)
      .onSuccess(id -> {
        log.info("Vigil started, deployment {}", id);
        // Undeploys MainVerticle so its stop sequence runs on SIGTERM
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
          log.info("Shutting down Vigil");
          vertx.close().toCompletionStage().toCompletableFuture().join();
        }, "vigil-shutdown"));
      })
      .onFailure(err -> {
        log.error("Vigil failed to start", err);
        vertx.close().onComplete(ar -> System.exit(1));
      });
  }
}
