package com.quotefeed.marketdata.config;

import com.quotefeed.common.exception.ProviderException;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * One HTTP client per upstream host. Reactive {@link WebClient}s for every provider except
 * Yahoo Finance, whose synchronous {@link RestClient} is only ever called from the blocking pool.
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    static final String BROWSER_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0 Safari/537.36";

    @Value("${market-data.http.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${market-data.http.read-timeout-seconds:10}")
    private int readTimeoutSeconds;

    @Value("${market-data.indian-stock-api.base-url:https://indian-stock-market-api.onrender.com}")
    private String indianStockApiBaseUrl;

    @Value("${market-data.nse.base-url:https://www.nseindia.com}")
    private String nseBaseUrl;

    @Value("${market-data.binance.base-url:https://api.binance.com}")
    private String binanceBaseUrl;

    @Value("${market-data.coingecko.base-url:https://api.coingecko.com}")
    private String coinGeckoBaseUrl;

    @Value("${market-data.yahoo.base-url:https://query1.finance.yahoo.com}")
    private String yahooBaseUrl;

    @Bean
    public WebClient indianStockApiClient(WebClient.Builder builder) {
        return base(builder, "INDIAN_STOCK_API", indianStockApiBaseUrl).build();
    }

    /** NSE rejects requests that do not look like a browser session. */
    @Bean
    public WebClient nseClient(WebClient.Builder builder) {
        return base(builder, "NSE_DIRECT", nseBaseUrl)
            .defaultHeader(HttpHeaders.USER_AGENT, BROWSER_USER_AGENT)
            .defaultHeader(HttpHeaders.ACCEPT, "application/json")
            .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9")
            .defaultHeader(HttpHeaders.REFERER, "https://www.nseindia.com/")
            .build();
    }

    @Bean
    public WebClient binanceClient(WebClient.Builder builder) {
        return base(builder, "BINANCE", binanceBaseUrl).build();
    }

    @Bean
    public WebClient coinGeckoClient(WebClient.Builder builder) {
        return base(builder, "COINGECKO", coinGeckoBaseUrl).build();
    }

    @Bean
    public RestClient yahooRestClient() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout((int) TimeUnit.SECONDS.toMillis(readTimeoutSeconds));
        return RestClient.builder()
            .baseUrl(yahooBaseUrl)
            .requestFactory(requestFactory)
            .defaultHeader(HttpHeaders.USER_AGENT, BROWSER_USER_AGENT)
            .build();
    }

    // ── shared client setup ──────────────────────────────────────────────────

    private WebClient.Builder base(WebClient.Builder builder, String provider, String baseUrl) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofSeconds(readTimeoutSeconds))
            .compress(true)
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutSeconds, TimeUnit.SECONDS))
            );

        return builder.clone()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(serverErrorFilter(provider))
            .filter(loggingFilter(provider));
    }

    private static ExchangeFilterFunction serverErrorFilter(String provider) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return clientResponse.releaseBody()
                    .then(Mono.error(new ProviderException(provider, "upstream server error: " + clientResponse.statusCode())));
            }
            return Mono.just(clientResponse);
        });
    }

    private static ExchangeFilterFunction loggingFilter(String provider) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String sanitized = sanitize(clientRequest.url().toString());
            log.debug("Outbound request. provider={} {} {}", provider, clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }

    static String sanitize(String uri) {
        return uri.replaceAll("(?i)(apikey|api_key|x_cg_demo_api_key)=[^&]+", "$1=***");
    }
}
