package com.codeheadsystems.pairing.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.pairing.server.notify.EventType;
import com.codeheadsystems.pairing.server.notify.NotificationRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * End-to-end tests of the pairing flow over HTTP.
 * Covers: admin login → create session → device verifies PIN → admin approves → client calls
 * a protected route → admin revokes → client is rejected.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class PairingFlowIntegrationTest {

  static final DropwizardAppExtension<PairingConfiguration> APP =
      new DropwizardAppExtension<>(
          PairingApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private HttpClient httpClient;

  @BeforeEach
  void setUp() {
    httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
  }

  private String baseUrl() {
    return "http://localhost:" + APP.getLocalPort();
  }

  private HttpResponse<String> send(String method, String path, String bearer, Object body) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + path))
        .timeout(Duration.ofSeconds(10))
        .header("Content-Type", "application/json")
        .header("Accept", "application/json");
    if (bearer != null) {
      builder.header("Authorization", "Bearer " + bearer);
    }
    HttpRequest.BodyPublisher publisher = body == null
        ? HttpRequest.BodyPublishers.noBody()
        : HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body));
    return httpClient.send(builder.method(method, publisher).build(), HttpResponse.BodyHandlers.ofString());
  }

  private JsonNode json(HttpResponse<String> response) throws Exception {
    return MAPPER.readTree(response.body());
  }

  private String adminToken() throws Exception {
    HttpResponse<String> response = send("POST", "/api/auth/login", null,
        Map.of("username", "admin", "password", "test-password"));
    assertThat(response.statusCode()).isEqualTo(200);
    return json(response).get("token").asText();
  }

  private JsonNode pairDevice(String admin, List<String> areas) throws Exception {
    JsonNode created = json(send("POST", "/api/pairing/create", admin, Map.of()));
    String sessionId = created.get("id").asText();
    HttpResponse<String> verified = send("POST", "/api/pairing/" + sessionId + "/verify", null,
        Map.of("pin", created.get("pin").asText(), "deviceName", "Kitchen Tablet", "deviceType", "tablet"));
    assertThat(verified.statusCode()).isEqualTo(200);
    HttpResponse<String> completed = send("POST", "/api/pairing/" + sessionId + "/complete", admin,
        Map.of("clientName", "Kitchen", "assignedAreas", areas));
    assertThat(completed.statusCode()).isEqualTo(200);
    return json(completed);
  }

  @Test
  void fullPairingFlow_thenRevocationLocksClientOut() throws Exception {
    String admin = adminToken();

    HttpResponse<String> created = send("POST", "/api/pairing/create", admin, Map.of());
    assertThat(created.statusCode()).isEqualTo(200);
    JsonNode session = json(created);
    String sessionId = session.get("id").asText();
    String pin = session.get("pin").asText();
    assertThat(pin).matches("\\d{6}");

    HttpResponse<String> status = send("GET", "/api/pairing/" + sessionId, null, null);
    assertThat(status.statusCode()).isEqualTo(200);
    assertThat(json(status).get("status").asText()).isEqualTo("pending");
    assertThat(status.body()).doesNotContain("\"pin\"").doesNotContain(pin);

    HttpResponse<String> verified = send("POST", "/api/pairing/" + sessionId + "/verify", null,
        Map.of("pin", pin, "deviceName", "Kitchen Tablet", "deviceType", "tablet"));
    assertThat(verified.statusCode()).isEqualTo(200);
    assertThat(json(verified).get("status").asText()).isEqualTo("verified");

    HttpResponse<String> completed = send("POST", "/api/pairing/" + sessionId + "/complete", admin,
        Map.of("clientName", "Kitchen", "assignedAreas", List.of("area_1")));
    assertThat(completed.statusCode()).isEqualTo(200);
    JsonNode pairing = json(completed);
    String clientId = pairing.get("clientId").asText();
    String clientToken = pairing.get("token").asText();

    HttpResponse<String> me = send("GET", "/api/clients/me", clientToken, null);
    assertThat(me.statusCode()).isEqualTo(200);
    assertThat(json(me).get("id").asText()).isEqualTo(clientId);
    assertThat(json(me).get("assignedAreas").get(0).asText()).isEqualTo("area_1");

    JsonNode tokens = json(send("GET", "/api/client-tokens?clientId=" + clientId, admin, null));
    assertThat(tokens.size()).isEqualTo(1);
    assertThat(tokens.get(0).has("tokenHash")).isFalse();
    String tokenId = tokens.get(0).get("id").asText();

    HttpResponse<String> revoked = send("POST", "/api/client-tokens/" + tokenId + "/revoke", admin,
        Map.of("reason", "Lost device"));
    assertThat(revoked.statusCode()).isEqualTo(200);
    assertThat(json(revoked).get("isRevoked").asBoolean()).isTrue();

    assertThat(send("GET", "/api/clients/me", clientToken, null).statusCode()).isEqualTo(401);
    assertThat(send("POST", "/api/client-tokens/" + tokenId + "/revoke", admin, Map.of()).statusCode())
        .isEqualTo(409);
  }

  @Test
  void adminRoute_withoutCredential_returns401() throws Exception {
    assertThat(send("GET", "/api/clients", null, null).statusCode()).isEqualTo(401);
    assertThat(send("GET", "/api/clients", "not-a-jwt", null).statusCode()).isEqualTo(401);
    Base64.Encoder b64 = Base64.getUrlEncoder().withoutPadding();
    String nullPayload = b64.encodeToString("{\"alg\":\"HS256\"}".getBytes(StandardCharsets.UTF_8))
        + "." + b64.encodeToString("null".getBytes(StandardCharsets.UTF_8)) + ".sig";
    assertThat(send("GET", "/api/clients", nullPayload, null).statusCode()).isEqualTo(401);
  }

  @Test
  void adminRoute_withClientCredential_returns403() throws Exception {
    JsonNode pairing = pairDevice(adminToken(), List.of());

    HttpResponse<String> response = send("GET", "/api/clients", pairing.get("token").asText(), null);

    assertThat(response.statusCode()).isEqualTo(403);
    assertThat(json(response).get("error").asText()).isEqualTo("FORBIDDEN");
  }

  @Test
  void login_wrongPassword_returns401WithGenericMessage() throws Exception {
    HttpResponse<String> response = send("POST", "/api/auth/login", null,
        Map.of("username", "admin", "password", "wrong"));

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(json(response).get("message").asText()).isEqualTo("Authentication required");
  }

  @Test
  void verify_wrongPin_returns401_andMalformedPin_returns400() throws Exception {
    JsonNode created = json(send("POST", "/api/pairing/create", adminToken(), Map.of()));
    String sessionId = created.get("id").asText();
    String wrongPin = created.get("pin").asText().equals("111111") ? "222222" : "111111";

    assertThat(send("POST", "/api/pairing/" + sessionId + "/verify", null,
        Map.of("pin", wrongPin, "deviceName", "Phone", "deviceType", "mobile")).statusCode()).isEqualTo(401);

    HttpResponse<String> malformed = send("POST", "/api/pairing/" + sessionId + "/verify", null,
        Map.of("pin", "12", "deviceName", "Phone", "deviceType", "mobile"));
    assertThat(malformed.statusCode()).isEqualTo(400);
    assertThat(json(malformed).get("field").asText()).isEqualTo("pin");
  }

  @Test
  void unknownSession_returns404() throws Exception {
    assertThat(send("GET", "/api/pairing/pairing_missing", null, null).statusCode()).isEqualTo(404);
  }

  @Test
  void whoAmI_resolvesBothPrincipalKinds() throws Exception {
    String admin = adminToken();
    JsonNode pairing = pairDevice(admin, List.of("area_1"));

    assertThat(json(send("GET", "/api/whoami", admin, null)).get("role").asText()).isEqualTo("admin");
    JsonNode client = json(send("GET", "/api/whoami", pairing.get("token").asText(), null));
    assertThat(client.get("role").asText()).isEqualTo("client");
    assertThat(client.get("name").asText()).isEqualTo(pairing.get("clientId").asText());
  }

  @Test
  void areaCheck_followsCredentialScope() throws Exception {
    String admin = adminToken();
    String clientToken = pairDevice(admin, List.of("area_1")).get("token").asText();

    assertThat(send("GET", "/api/clients/me/areas/area_1", clientToken, null).statusCode()).isEqualTo(204);
    assertThat(send("GET", "/api/clients/me/areas/area_2", clientToken, null).statusCode()).isEqualTo(403);
    assertThat(send("GET", "/api/clients/me/areas/area_2", admin, null).statusCode()).isEqualTo(204);
    assertThat(send("GET", "/api/clients/me/areas/area_1", null, null).statusCode()).isEqualTo(401);
  }

  @Test
  void deletingClient_pushesRevocationOverEventStream() throws Exception {
    String admin = adminToken();
    JsonNode pairing = pairDevice(admin, List.of("area_1"));
    String clientId = pairing.get("clientId").asText();

    HttpRequest streamRequest = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/api/events"))
        .header("Accept", "text/event-stream")
        .header("Authorization", "Bearer " + pairing.get("token").asText())
        .GET()
        .build();
    HttpResponse<Stream<String>> stream =
        httpClient.sendAsync(streamRequest, HttpResponse.BodyHandlers.ofLines()).get(10, TimeUnit.SECONDS);
    assertThat(stream.statusCode()).isEqualTo(200);

    BlockingQueue<String> events = new LinkedBlockingQueue<>();
    ExecutorService reader = Executors.newSingleThreadExecutor();
    try {
      reader.submit(() -> stream.body()
          .filter(line -> line.startsWith("event:"))
          .forEach(line -> events.add(line.substring("event:".length()).trim())));

      assertThat(events.poll(10, TimeUnit.SECONDS)).isEqualTo("connected");

      NotificationRegistry registry = ((PairingApplication) APP.getApplication()).bundle().getNotificationRegistry();
      assertThat(registry.pruneStale()).isZero();
      assertThat(registry.isConnected(clientId)).isTrue();
      assertThat(registry.notifyByArea("area_1", EventType.AREA_ENABLED, Map.of("areaId", "area_1")))
          .isEqualTo(1);
      assertThat(registry.notifyByArea("area_2", EventType.AREA_ENABLED, Map.of("areaId", "area_2")))
          .isZero();
      assertThat(events.poll(10, TimeUnit.SECONDS)).isEqualTo("area_enabled");

      assertThat(send("DELETE", "/api/clients/" + clientId, admin, null).statusCode()).isEqualTo(204);

      assertThat(events.poll(10, TimeUnit.SECONDS)).isEqualTo("token_revoked");
    } finally {
      reader.shutdownNow();
    }
    assertThat(send("GET", "/api/clients/" + clientId, admin, null).statusCode()).isEqualTo(404);
  }

  @Test
  void healthCheck_reportsPairingStore() throws Exception {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create("http://localhost:" + APP.getAdminPort() + "/healthcheck"))
        .GET()
        .build();

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).contains("pairing-store");
  }
}
