package com.trakbridge.bridge.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;

class TraccarClientTest {

  private final HttpClient httpClient = mock(HttpClient.class);
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final TraccarClient client = new TraccarClient(
      TraccarTestFixtures.properties("https://traccar.example/"),
      httpClient,
      new ObjectMapper(),
      meterRegistry);

  @Test
  void fetchPositionsMapsResponseAndSendsBasicAuth() throws Exception {
    HttpResponse<String> response = response(200, """
        [
          {"id": 11, "deviceId": 7, "latitude": 48.8566, "longitude": 2.3522, "altitude": 35.0,
           "speed": 10.0, "course": 90.0, "fixTime": "2025-03-01T12:00:00.000+00:00",
           "deviceTime": "2025-03-01T11:59:58.000+00:00", "attributes": {"battery": 80}}
        ]
        """);
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(response);

    List<TraccarPosition> positions = client.fetchPositions();

    assertThat(positions).hasSize(1);
    TraccarPosition position = positions.get(0);
    assertThat(position.deviceId()).isEqualTo(7L);
    assertThat(position.latitude()).isEqualTo(48.8566);
    assertThat(position.speed()).isEqualTo(10.0);
    assertThat(position.deviceTime()).isEqualTo("2025-03-01T11:59:58.000+00:00");

    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    HttpRequest request = captor.getValue();
    assertThat(request.uri().toString()).isEqualTo("https://traccar.example/api/positions");
    String expectedToken = Base64.getEncoder()
        .encodeToString("admin:secret".getBytes(StandardCharsets.UTF_8));
    assertThat(request.headers().firstValue("Authorization")).hasValue("Basic " + expectedToken);
    assertThat(outcome("success")).isEqualTo(1.0);
  }

  @Test
  void fetchDeviceNamesSkipsUnnamedDevices() throws Exception {
    HttpResponse<String> response = response(200, """
        [{"id": 7, "name": " Van 7 "}, {"id": 8, "name": ""}, {"id": 9}]
        """);
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(response);

    Map<Long, String> names = client.fetchDeviceNames();

    assertThat(names).containsExactly(Map.entry(7L, "Van 7"));
  }

  @Test
  void httpErrorYieldsEmptyResult() throws Exception {
    HttpResponse<String> unauthorized = response(401, "");
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(unauthorized);

    assertThat(client.fetchPositions()).isEmpty();
    assertThat(outcome("client_error")).isEqualTo(1.0);
  }

  @Test
  void ioFailureYieldsEmptyResult() throws Exception {
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenThrow(new IOException("connection reset"));

    assertThat(client.fetchDeviceNames()).isEmpty();
    assertThat(outcome("exception")).isEqualTo(1.0);
  }

  @Test
  void interruptRestoresFlag() throws Exception {
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenThrow(new InterruptedException("shutdown"));

    try {
      assertThat(client.fetchPositions()).isEmpty();
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }

  @SuppressWarnings("unchecked")
  private static HttpResponse<String> response(int status, String body) {
    HttpResponse<String> response = (HttpResponse<String>) mock(HttpResponse.class);
    when(response.statusCode()).thenReturn(status);
    when(response.body()).thenReturn(body);
    return response;
  }

  private double outcome(String outcome) {
    return meterRegistry.get("bridge.traccar.http.requests.total").tag("outcome", outcome).counter().count();
  }
}
