package com.cred.freestyle.arbitrage.infrastructure.webhook;

import com.cred.freestyle.arbitrage.domain.model.AlertRule;
import com.cred.freestyle.arbitrage.domain.model.Offer;
import com.cred.freestyle.arbitrage.exception.DeliveryException;
import com.cred.freestyle.arbitrage.infrastructure.metrics.ArbitrageMetricsService;
import com.cred.freestyle.arbitrage.service.ledger.OpportunityMatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.List;

import static com.cred.freestyle.arbitrage.testutil.TestDataBuilder.NOW;
import static com.cred.freestyle.arbitrage.testutil.TestDataBuilder.aResaleOffer;
import static com.cred.freestyle.arbitrage.testutil.TestDataBuilder.aRetailOffer;
import static com.cred.freestyle.arbitrage.testutil.TestDataBuilder.anAlertRule;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

/**
 * Unit tests for WebhookDispatcher against a mock HTTP server.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("WebhookDispatcher Unit Tests")
class WebhookDispatcherTest {

    private static final String URL = "https://hooks.example.com/arbitrage";

    @Mock
    private ArbitrageMetricsService metricsService;

    private MockRestServiceServer server;

    private WebhookDispatcher dispatcher;

    private WebhookPayload payload;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        dispatcher = new WebhookDispatcher(restTemplate, metricsService, 3, 0);

        AlertRule rule = anAlertRule().alertRuleId("RULE-1").build();
        Offer retail = aRetailOffer(12000).offerId("OFF-R").build();
        Offer resale = aResaleOffer(18000).offerId("OFF-S").build();
        payload = WebhookPayload.of(rule,
                List.of(OpportunityMatcher.pair(retail, resale, "US 9 (MEN)").orElseThrow()), NOW);
    }

    @Test
    @DisplayName("deliver - 2xx on first attempt: JSON payload posted once")
    void deliver_Success() {
        // Given
        server.expect(ExpectedCount.once(), requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.rule_id").value("RULE-1"))
                .andExpect(jsonPath("$.currency").value("EUR"))
                .andExpect(jsonPath("$.opportunities[0].product_id").value("dunk-low-panda"))
                .andExpect(jsonPath("$.opportunities[0].size").value("US 9 (MEN)"))
                .andExpect(jsonPath("$.opportunities[0].profit").value(60.0))
                .andRespond(withSuccess());

        // When
        dispatcher.deliver(URL, payload);

        // Then
        server.verify();
        verify(metricsService).recordWebhookAttempt(eq("2xx"), anyLong());
    }

    @Test
    @DisplayName("deliver - Transient 503 then 200: delivered on second attempt")
    void deliver_RetryThenSuccess() {
        // Given
        server.expect(ExpectedCount.once(), requestTo(URL)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        server.expect(ExpectedCount.once(), requestTo(URL)).andRespond(withSuccess());

        // When
        dispatcher.deliver(URL, payload);

        // Then
        server.verify();
    }

    @Test
    @DisplayName("deliver - Three 500 responses: DeliveryException with last status 500")
    void deliver_RetriesExhausted() {
        // Given
        server.expect(ExpectedCount.times(3), requestTo(URL)).andRespond(withServerError());

        // When / Then
        assertThatThrownBy(() -> dispatcher.deliver(URL, payload))
                .isInstanceOfSatisfying(DeliveryException.class, e -> {
                    assertThat(e.getAttempts()).isEqualTo(3);
                    assertThat(e.getLastStatus()).isEqualTo(500);
                    assertThat(e.getWebhookUrl()).isEqualTo(URL);
                });
        server.verify();
    }

    @Test
    @DisplayName("deliver - 400 is not retried")
    void deliver_ClientError_NoRetry() {
        // Given
        server.expect(ExpectedCount.once(), requestTo(URL)).andRespond(withBadRequest());

        // When / Then
        assertThatThrownBy(() -> dispatcher.deliver(URL, payload))
                .isInstanceOfSatisfying(DeliveryException.class, e -> {
                    assertThat(e.getAttempts()).isEqualTo(1);
                    assertThat(e.getLastStatus()).isEqualTo(400);
                });
        server.verify();
    }

    @Test
    @DisplayName("deliver - 429 is retried")
    void deliver_TooManyRequests_Retried() {
        // Given
        server.expect(ExpectedCount.once(), requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
        server.expect(ExpectedCount.once(), requestTo(URL)).andRespond(withSuccess());

        // When
        dispatcher.deliver(URL, payload);

        // Then
        server.verify();
    }

    @Test
    @DisplayName("deliver - I/O errors are retried and reported without a status")
    void deliver_IoError() {
        // Given
        server.expect(ExpectedCount.times(3), requestTo(URL))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        // When / Then
        assertThatThrownBy(() -> dispatcher.deliver(URL, payload))
                .isInstanceOfSatisfying(DeliveryException.class, e -> {
                    assertThat(e.getAttempts()).isEqualTo(3);
                    assertThat(e.getLastStatus()).isNull();
                    assertThat(e.getMessage()).contains("I/O error");
                });
        verify(metricsService, times(3)).recordWebhookAttempt(eq("IO_ERROR"), anyLong());
    }

    @Test
    @DisplayName("isRetryable - 5xx, 408 and 429 only")
    void isRetryable() {
        assertThat(WebhookDispatcher.isRetryable(500)).isTrue();
        assertThat(WebhookDispatcher.isRetryable(502)).isTrue();
        assertThat(WebhookDispatcher.isRetryable(408)).isTrue();
        assertThat(WebhookDispatcher.isRetryable(429)).isTrue();
        assertThat(WebhookDispatcher.isRetryable(400)).isFalse();
        assertThat(WebhookDispatcher.isRetryable(404)).isFalse();
        assertThat(WebhookDispatcher.isRetryable(410)).isFalse();
    }
}
