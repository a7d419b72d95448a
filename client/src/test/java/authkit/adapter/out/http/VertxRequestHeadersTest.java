package authkit.adapter.out.http;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import authkit.core.service.request.SimpleInMemoryRequestAuthenticator;

@DisplayName("VertxRequestHeaders")
class VertxRequestHeadersTest {

    private WireMockServer wireMockServer;
    private Vertx vertx;
    private WebClient webClient;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        webClient = WebClient.create(vertx);
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();
        wireMockServer.stubFor(get(urlEqualTo("/api/items")).willReturn(aResponse().withStatus(200)));
    }

    @AfterEach
    void tearDown() {
        webClient.close();
        wireMockServer.stop();
        vertx.close().await().indefinitely();
    }

    @Test
    @DisplayName("should decorate a WebClient request with the authenticator's headers")
    void shouldAuthenticateRequest() {
        final var authenticator = new SimpleInMemoryRequestAuthenticator("at-1", "Bearer", "Authorization");
        final var request = webClient.getAbs(wireMockServer.baseUrl() + "/api/items");

        final var status = VertxRequestHeaders.authenticate(request, authenticator)
                .send()
                .await()
                .atMost(Duration.ofSeconds(5))
                .statusCode();

        assertEquals(200, status);
        wireMockServer.verify(getRequestedFor(urlEqualTo("/api/items"))
                .withHeader("Authorization", equalTo("Bearer at-1"))
                .withHeader("X-Authkit-App", equalTo("authkit-java")));
    }

    @Test
    @DisplayName("should keep an application header already on the request")
    void shouldKeepExistingApplicationHeader() {
        final var authenticator = new SimpleInMemoryRequestAuthenticator("at-1", "Bearer", "Authorization");
        final var request = webClient.getAbs(wireMockServer.baseUrl() + "/api/items")
                .putHeader("X-Authkit-App", "my-tool");

        VertxRequestHeaders.authenticate(request, authenticator).send().await().atMost(Duration.ofSeconds(5));

        wireMockServer.verify(getRequestedFor(urlEqualTo("/api/items"))
                .withHeader("X-Authkit-App", equalTo("my-tool")));
    }
}
