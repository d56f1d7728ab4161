package com.quotefeed.marketdata.client;

import com.quotefeed.common.event.QuoteBroadcastMessage;
import com.quotefeed.common.model.AssetClass;
import com.quotefeed.common.model.CanonicalQuote;
import com.quotefeed.common.normalize.QuoteNormalizer;
import com.quotefeed.marketdata.broadcast.ReactiveQuoteBroadcastSink;
import com.quotefeed.marketdata.model.HistoryResponse;
import com.quotefeed.marketdata.model.LatestResponse;
import com.quotefeed.marketdata.model.WatchlistRequest;
import com.quotefeed.marketdata.service.MarketDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/market-data")
public class MarketDataController {

    private static final Logger log = LoggerFactory.getLogger(MarketDataController.class);

    static final int MIN_HISTORY_DAYS    = 1;
    static final int MAX_HISTORY_DAYS    = 365;
    static final int MAX_CRYPTO_HISTORY_DAYS = 30;

    private final MarketDataService          service;
    private final ReactiveQuoteBroadcastSink broadcastSink;

    public MarketDataController(MarketDataService service, ReactiveQuoteBroadcastSink broadcastSink) {
        this.service       = service;
        this.broadcastSink = broadcastSink;
    }

    @GetMapping("/quote/{ticker}")
    public Mono<ResponseEntity<CanonicalQuote>> getQuote(@PathVariable String ticker) {
        return service.getQuote(ticker)
            .map(ResponseEntity::ok)
            .onErrorResume(e -> {
                log.error("Quote endpoint error. ticker={}", ticker, e);
                return Mono.just(ResponseEntity.internalServerError().build());
            });
    }

    @GetMapping("/history/{ticker}")
    public Mono<ResponseEntity<HistoryResponse>> getHistory(@PathVariable String ticker,
                                                            @RequestParam(defaultValue = "180") int days) {
        AssetClass type = QuoteNormalizer.classify(ticker);
        int effectiveDays = clampDays(type, days);
        return service.getHistory(ticker, effectiveDays)
            .map(bars -> ResponseEntity.ok(HistoryResponse.of(ticker, type, effectiveDays, bars)))
            .onErrorResume(e -> Mono.just(ResponseEntity.internalServerError().build()));
    }

    @GetMapping("/latest")
    public ResponseEntity<LatestResponse> getAllLatest() {
        return ResponseEntity.ok(LatestResponse.of(service.getAllLatest()));
    }

    @GetMapping("/latest/{symbol}")
    public ResponseEntity<CanonicalQuote> getLatest(@PathVariable String symbol) {
        return service.getLatest(symbol)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/watchlist")
    public ResponseEntity<Map<AssetClass, List<String>>> getWatchlist() {
        return ResponseEntity.ok(service.watchlist());
    }

    @PostMapping("/watchlist")
    public ResponseEntity<Map<AssetClass, List<String>>> addToWatchlist(@RequestBody WatchlistRequest request) {
        if (request == null || request.symbol() == null || request.symbol().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        service.addToWatchlist(request.symbol(), request.type());
        return ResponseEntity.ok(service.watchlist());
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<QuoteBroadcastMessage>> stream() {
        log.info("SSE quote stream client connected");
        return broadcastSink.stream()
            .map(message -> ServerSentEvent.<QuoteBroadcastMessage>builder()
                .event("quote")
                .data(message)
                .build());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    static int clampDays(AssetClass type, int requested) {
        int days = Math.max(MIN_HISTORY_DAYS, Math.min(MAX_HISTORY_DAYS, requested));
        return type == AssetClass.CRYPTO ? Math.min(days, MAX_CRYPTO_HISTORY_DAYS) : days;
    }
}
