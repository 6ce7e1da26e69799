package com.cred.freestyle.arbitrage.config;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client used for webhook delivery.
 * Apache HttpClient 5 with bounded connect and response timeouts.
 *
 * @author Arbitrage Team
 */
@Configuration
public class RestTemplateConfig {

    @Value("${arbitrage.alerts.webhook.connect-timeout-seconds:5}")
    private int connectTimeoutSeconds;

    @Value("${arbitrage.alerts.webhook.read-timeout-seconds:15}")
    private int readTimeoutSeconds;

    @Bean
    public RestTemplate webhookRestTemplate() {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.ofSeconds(connectTimeoutSeconds))
                .setConnectTimeout(Timeout.ofSeconds(connectTimeoutSeconds))
                .setResponseTimeout(Timeout.ofSeconds(readTimeoutSeconds))
                .build();
        CloseableHttpClient httpClient = HttpClients.custom()
                .setDefaultRequestConfig(requestConfig)
                .disableAutomaticRetries()
                .build();

        HttpComponentsClientHttpRequestFactory factory = new HttpComponentsClientHttpRequestFactory(httpClient);
        factory.setConnectTimeout(connectTimeoutSeconds * 1000);
        return new RestTemplate(factory);
    }
}
