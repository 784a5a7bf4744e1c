package org.metricwatch.anomaly.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class AnomalyEngineLauncher {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnomalyEngineLauncher.class);

  public static void main(String[] args) throws InterruptedException {
    Config appConfig = ConfigFactory.load();
    AnomalyEngine engine = new AnomalyEngine(appConfig);
    engine.init();

    CountDownLatch stopped = new CountDownLatch(1);
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  LOGGER.info("Shutdown requested, stopping the anomaly engine");
                  engine.stop();
                  stopped.countDown();
                },
                "anomaly-engine-shutdown"));

    engine.start();
    LOGGER.info("Anomaly engine running");
    stopped.await();
  }
}
