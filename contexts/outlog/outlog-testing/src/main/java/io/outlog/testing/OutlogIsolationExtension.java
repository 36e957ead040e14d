package io.outlog.testing;

import io.outlog.domain.config.OutlogConfigurationHolder;
import io.outlog.domain.context.OutboundLogContext;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

/**
 * Resets outbound logging state around every test: the calling thread's context and configuration
 * override, and the global configuration.
 *
 * <pre>{@code
 * @ExtendWith(OutlogIsolationExtension.class)
 * class PaymentClientTest { ... }
 * }</pre>
 */
public class OutlogIsolationExtension implements BeforeEachCallback, AfterEachCallback {

  @Override
  public void beforeEach(ExtensionContext context) {
    reset();
  }

  @Override
  public void afterEach(ExtensionContext context) {
    reset();
  }

  private static void reset() {
    OutboundLogContext.clearAll();
    OutlogConfigurationHolder.reset();
  }
}
