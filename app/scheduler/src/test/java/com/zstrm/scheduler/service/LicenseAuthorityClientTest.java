package com.zstrm.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.zstrm.scheduler.model.LicenseTier;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class LicenseAuthorityClientTest {

  private static final String RENEW_URL = "http://licensing.test/v1/licenses/renew";

  @Test
  void renewPostsInstallIdentityAndParsesTier() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(RENEW_URL))
        .andExpect(method(POST))
        .andExpect(content().json("{\"install_id\":\"install-1\",\"secret\":\"secret-1\"}"))
        .andRespond(withSuccess("{\"tier\":\"ultimate\"}", MediaType.APPLICATION_JSON));

    assertThat(fixture.client.renew("install-1", "secret-1")).isEqualTo(LicenseTier.ULTIMATE);
    fixture.server.verify();
  }

  @Test
  void renewWithoutTierReturnsNull() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(RENEW_URL))
        .andRespond(withSuccess("{\"status\":\"ok\"}", MediaType.APPLICATION_JSON));

    assertThat(fixture.client.renew("install-1", "secret-1")).isNull();
  }

  @Test
  void renewMapsUnknownTierToInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(RENEW_URL))
        .andRespond(withSuccess("{\"tier\":\"gold\"}", MediaType.APPLICATION_JSON));

    assertReason(fixture, LicenseAuthorityException.Reason.INVALID_RESPONSE);
  }

  @Test
  void renewMapsMalformedBodyToInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(RENEW_URL))
        .andRespond(withSuccess("not-json", MediaType.APPLICATION_JSON));

    assertReason(fixture, LicenseAuthorityException.Reason.INVALID_RESPONSE);
  }

  @Test
  void renewMaps5xxToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo(RENEW_URL)).andRespond(withServerError());

    assertReason(fixture, LicenseAuthorityException.Reason.BAD_GATEWAY);
  }

  @Test
  void renewMapsRejectionToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo(RENEW_URL)).andRespond(withStatus(HttpStatus.FORBIDDEN));

    assertReason(fixture, LicenseAuthorityException.Reason.BAD_GATEWAY);
  }

  @Test
  void renewMapsTimeoutToTimeout() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(RENEW_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertReason(fixture, LicenseAuthorityException.Reason.TIMEOUT);
  }

  @Test
  void renewMapsConnectionFailureToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(RENEW_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });

    assertReason(fixture, LicenseAuthorityException.Reason.BAD_GATEWAY);
  }

  private static void assertReason(ClientFixture fixture, LicenseAuthorityException.Reason reason) {
    assertThatThrownBy(() -> fixture.client.renew("install-1", "secret-1"))
        .isInstanceOf(LicenseAuthorityException.class)
        .extracting(ex -> ((LicenseAuthorityException) ex).reason())
        .isEqualTo(reason);
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://licensing.test").build();
    return new ClientFixture(
        new LicenseAuthorityClient(restClient, LicenseStateMachineTest.PROPERTIES), server);
  }

  private record ClientFixture(LicenseAuthorityClient client, MockRestServiceServer server) {}
}
