package io.flightqc.application.pipeline;

import io.flightqc.domain.remote.SessionCredentials;
import io.flightqc.validation.Paths;
import java.time.Duration;
import java.util.Objects;

/**
 * Input of one site analysis.
 *
 * @param credentials endpoint and login of the primary session
 * @param siteRoot absolute remote path of the site
 * @param timeout outer deadline for the whole analysis
 * @since 0.1.0
 */
public record SiteAnalysisRequest(SessionCredentials credentials, String siteRoot, Duration timeout) {

  public SiteAnalysisRequest {
    Objects.requireNonNull(credentials, "credentials");
    siteRoot = Paths.requireRemoteAbsolute("siteRoot", siteRoot);
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
  }
}
