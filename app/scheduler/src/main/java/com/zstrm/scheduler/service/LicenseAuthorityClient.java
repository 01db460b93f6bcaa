/*
 * Where: scheduler service layer
 * What: client for the remote licensing authority renewal endpoint
 * Why: the lease is only extended when the authority confirms the install
 */
package com.zstrm.scheduler.service;

import com.zstrm.scheduler.config.LicensingProperties;
import com.zstrm.scheduler.model.LicenseTier;
import com.zstrm.scheduler.service.dto.LicenseRenewRequest;
import com.zstrm.scheduler.service.dto.LicenseRenewResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class LicenseAuthorityClient {

  private static final Logger logger = LoggerFactory.getLogger(LicenseAuthorityClient.class);

  private final RestClient licensingRestClient;
  private final LicensingProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  public LicenseAuthorityClient(RestClient licensingRestClient, LicensingProperties properties) {
    this.licensingRestClient = licensingRestClient;
    this.properties = properties;
  }

  /**
   * Renews the lease for an install.
   *
   * @return the confirmed tier, or null when the authority did not report one
   * @throws LicenseAuthorityException on timeout, connection failure, non-2xx or malformed body
   */
  public LicenseTier renew(String installId, String installSecret) {
    final LicenseRenewResponse response;
    try {
      response =
          licensingRestClient
              .post()
              .uri(properties.renewPath())
              .contentType(MediaType.APPLICATION_JSON)
              .body(new LicenseRenewRequest(installId, installSecret))
              .retrieve()
              .body(LicenseRenewResponse.class);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    } catch (RuntimeException ex) {
      logger.warn("license renew response parse failed", ex);
      throw new LicenseAuthorityException(
          LicenseAuthorityException.Reason.INVALID_RESPONSE, "license renew response parse failed", ex);
    }
    return parseTier(response);
  }

  private LicenseTier parseTier(LicenseRenewResponse response) {
    if (response == null) {
      throw new LicenseAuthorityException(
          LicenseAuthorityException.Reason.INVALID_RESPONSE, "license renew response is empty");
    }
    if (response.tier() == null || response.tier().isBlank()) {
      return null;
    }
    try {
      return LicenseTier.fromValue(response.tier());
    } catch (IllegalArgumentException ex) {
      throw new LicenseAuthorityException(
          LicenseAuthorityException.Reason.INVALID_RESPONSE,
          "unknown license tier " + response.tier(),
          ex);
    }
  }

  private LicenseAuthorityException mapResponseException(RestClientResponseException ex) {
    logger.warn(
        "license renew failed with http status={} statusText={}",
        ex.getStatusCode().value(),
        ex.getStatusText());
    if (ex.getStatusCode().is5xxServerError()) {
      return new LicenseAuthorityException(
          LicenseAuthorityException.Reason.BAD_GATEWAY, "licensing server error", ex);
    }
    return new LicenseAuthorityException(
        LicenseAuthorityException.Reason.BAD_GATEWAY,
        "license renew rejected status=" + ex.getStatusCode().value(),
        ex);
  }

  private LicenseAuthorityException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("license renew timed out");
      return new LicenseAuthorityException(
          LicenseAuthorityException.Reason.TIMEOUT, "license renew timeout", ex);
    }
    logger.warn("license renew connection failed", ex);
    return new LicenseAuthorityException(
        LicenseAuthorityException.Reason.BAD_GATEWAY, "licensing connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
