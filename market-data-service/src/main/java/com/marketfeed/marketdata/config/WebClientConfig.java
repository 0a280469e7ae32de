package com.marketfeed.marketdata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketfeed.marketdata.client.GmxCandleClient;
import com.marketfeed.marketdata.client.GmxSidecarClient;
import com.marketfeed.marketdata.client.SynthApiClient;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * One {@link WebClient} per upstream host, all sharing the same connector timeouts and the
 * redacting request log. Timeouts live here; the cache layer never times out a fetch.
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Value("${gmx.sidecar.base-url:http://localhost:8090}")
    private String gmxSidecarBaseUrl;

    @Value("${gmx.api.base-url:https://arbitrum-api.gmxinfra.io}")
    private String gmxApiBaseUrl;

    @Value("${synth.base-url:https://api.synthdata.co}")
    private String synthBaseUrl;

    @Value("${synth.api-key:}")
    private String synthApiKey;

    @Bean
    public WebClient gmxSidecarWebClient(WebClient.Builder builder) {
        return build(builder, gmxSidecarBaseUrl);
    }

    @Bean
    public WebClient gmxApiWebClient(WebClient.Builder builder) {
        return build(builder, gmxApiBaseUrl);
    }

    @Bean
    public WebClient synthWebClient(WebClient.Builder builder) {
        return build(builder, synthBaseUrl);
    }

    @Bean
    public GmxSidecarClient gmxSidecarClient(WebClient gmxSidecarWebClient, ObjectMapper objectMapper) {
        return new GmxSidecarClient(gmxSidecarWebClient, objectMapper);
    }

    @Bean
    public GmxCandleClient gmxCandleClient(WebClient gmxApiWebClient, ObjectMapper objectMapper) {
        return new GmxCandleClient(gmxApiWebClient, objectMapper);
    }

    @Bean
    public SynthApiClient synthApiClient(WebClient synthWebClient, ObjectMapper objectMapper) {
        return new SynthApiClient(synthWebClient, objectMapper, synthApiKey);
    }

    // WebClient.Builder is a prototype bean; each call gets its own copy.
    private WebClient build(WebClient.Builder builder, String baseUrl) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(15))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(15, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            boolean authorized = clientRequest.headers().containsKey(HttpHeaders.AUTHORIZATION);
            log.debug("Outbound request: {} {} authorization={}",
                      clientRequest.method(), clientRequest.url(), authorized ? "***" : "none");
            return Mono.just(clientRequest);
        });
    }
}
