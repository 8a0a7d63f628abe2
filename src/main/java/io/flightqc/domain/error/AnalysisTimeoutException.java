package io.flightqc.domain.error;

import java.time.Duration;

/**
 * Raised when a whole site analysis exceeds its outer time budget. Callers surface it as a
 * gateway-timeout style failure.
 *
 * @since 0.1.0
 */
public class AnalysisTimeoutException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Duration budget;

  public AnalysisTimeoutException(String siteRoot, Duration budget) {
    super("Site analysis of " + siteRoot + " timed out after " + budget.toMillis() + " ms");
    this.budget = budget;
  }

  public Duration budget() {
    return budget;
  }
}
