package io.github.kgov.console;

import io.github.kgov.console.cli.KgovCli;
import io.github.kgov.console.config.VertxConfig;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point. {@code serve} (or no arguments) deploys the console service,
 * anything else is handed to the command line.
 */
public class ConsoleLauncher {

  private static final Logger log = LoggerFactory.getLogger(ConsoleLauncher.class);

  public static void main(String[] args) {
    if (args.length > 0 && !"serve".equals(args[0])) {
      System.exit(KgovCli.run(args));
      return;
    }

    Vertx vertx = Vertx.vertx(VertxConfig.createVertxOptions());
    vertx.deployVerticle(new MainVerticle())
      .onSuccess(id -> log.info("MainVerticle deployed with ID: {}", id))
      .onFailure(err -> {
        log.error("Failed to deploy MainVerticle", err);
        vertx.close();
        System.exit(1);
      });
  }
}
