package io.sqsoffline.spring.boot;

import io.sqsoffline.SqsOffline;
import io.sqsoffline.provision.ProvisioningReport;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Starts {@link SqsOffline} once the context is refreshed, after every {@link SqsHandler}
 * bean has been registered, and stops polling on context shutdown.
 */
public class SqsOfflineLifecycle implements SmartLifecycle {

  private final SqsOffline sqsOffline;
  private volatile boolean running;
  private volatile ProvisioningReport lastReport = ProvisioningReport.empty();

  public SqsOfflineLifecycle(SqsOffline sqsOffline) {
    this.sqsOffline = Objects.requireNonNull(sqsOffline, "sqsOffline");
  }

  @Override
  public void start() {
    lastReport = sqsOffline.start();
    running = true;
  }

  @Override
  public void stop() {
    sqsOffline.stop();
    running = false;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  /**
   * @return the provisioning report of the last start
   */
  public ProvisioningReport lastReport() {
    return lastReport;
  }
}
