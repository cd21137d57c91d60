package qseries.testing;

import qseries.core.TelescopingOptions;

/**
 * Test configuration knobs. The certificate verification window can be widened from the JVM
 * runner with the system property {@code qseries.verifyWindow} or the environment variable {@code
 * QSERIES_VERIFY_WINDOW}.
 */
public final class TestDefaults {
  private static final String VERIFY_WINDOW_PROPERTY = "qseries.verifyWindow";
  private static final String VERIFY_WINDOW_ENV = "QSERIES_VERIFY_WINDOW";
  private static final int DEFAULT_VERIFY_WINDOW = 10;

  private TestDefaults() {}

  /** Engine defaults with the verification window taken from {@link #verifyWindow()}. */
  public static TelescopingOptions options() {
    return TelescopingOptions.defaults().withVerifyWindow(verifyWindow());
  }

  public static int verifyWindow() {
    String propertyValue = System.getProperty(VERIFY_WINDOW_PROPERTY);
    if (propertyValue != null) {
      try {
        return Integer.parseInt(propertyValue);
      } catch (NumberFormatException ignored) {
        // fall back to env/default
      }
    }
    String envValue = System.getenv(VERIFY_WINDOW_ENV);
    if (envValue != null) {
      try {
        return Integer.parseInt(envValue);
      } catch (NumberFormatException ignored) {
        // fall through
      }
    }
    return DEFAULT_VERIFY_WINDOW;
  }
}
