package com.ethval.ingestion.adapter;

import com.ethval.catalog.SourceApi;
import com.ethval.common.RetryPolicy;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.net.URI;
import java.time.Duration;

/**
 * Blocking GET for source adapters. Per-API rate limiting, retry with backoff on 429/5xx/I/O errors,
 * manual redirect following (relative locations resolved), and a response cache keyed by URL so
 * metrics sharing an endpoint within a run fetch it once.
 */
@Slf4j
public class SourceHttpClient {

    private final WebClient webClient;
    private final ApiRateLimiters rateLimiters;
    private final RetryPolicy retryPolicy;
    private final Cache<String, String> responseCache;
    private final Duration readTimeout;
    private final int maxRedirects;

    public SourceHttpClient(WebClient webClient, ApiRateLimiters rateLimiters, RetryPolicy retryPolicy,
                            Cache<String, String> responseCache, Duration readTimeout, int maxRedirects) {
        this.webClient = webClient;
        this.rateLimiters = rateLimiters;
        this.retryPolicy = retryPolicy;
        this.responseCache = responseCache;
        this.readTimeout = readTimeout;
        this.maxRedirects = maxRedirects;
    }

    /**
     * @return response body, empty string for an empty 2xx body
     * @throws SourceUnavailableException on HTTP errors, timeouts, I/O errors or too many redirects
     */
    public String get(SourceApi api, String url) {
        String cached = responseCache.getIfPresent(url);
        if (cached != null) {
            log.debug("Cache hit {}", UrlTemplate.redact(url));
            return cached;
        }
        String current = url;
        for (int hop = 0; hop <= maxRedirects; hop++) {
            Response response = getWithRetry(api, current);
            if (response.location() == null) {
                responseCache.put(url, response.body());
                return response.body();
            }
            String next = URI.create(current).resolve(response.location()).toString();
            log.debug("Redirect {} -> {}", UrlTemplate.redact(current), UrlTemplate.redact(next));
            current = next;
        }
        throw new SourceUnavailableException("More than " + maxRedirects + " redirects for " + UrlTemplate.redact(url));
    }

    private Response getWithRetry(SourceApi api, String url) {
        for (int attempt = 0; ; attempt++) {
            RuntimeException failure;
            try {
                return getOnce(api, url);
            } catch (RetryableException e) {
                failure = e;
            }
            if (!retryPolicy.canRetry(attempt)) {
                throw new SourceUnavailableException(failure.getMessage(), failure.getCause());
            }
            long delay = retryPolicy.delayMs(attempt);
            log.debug("Retrying {} in {} ms after: {}", UrlTemplate.redact(url), delay, failure.getMessage());
            sleep(delay);
        }
    }

    private Response getOnce(SourceApi api, String url) {
        rateLimiters.forApi(api).acquire();
        ResponseEntity<String> entity;
        try {
            entity = webClient.get()
                    .uri(URI.create(url))
                    .exchangeToMono(r -> r.toEntity(String.class))
                    .timeout(readTimeout)
                    .block();
        } catch (WebClientException e) {
            throw new RetryableException("I/O error for " + UrlTemplate.redact(url) + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // Reactor wraps the TimeoutException from timeout() in an unchecked exception
            throw new RetryableException("Request failed for " + UrlTemplate.redact(url) + ": " + e.getMessage(), e);
        }
        if (entity == null) {
            throw new RetryableException("No response for " + UrlTemplate.redact(url), null);
        }
        HttpStatusCode status = entity.getStatusCode();
        if (status.is3xxRedirection()) {
            String location = entity.getHeaders().getFirst(HttpHeaders.LOCATION);
            if (location == null || location.isBlank()) {
                throw new SourceUnavailableException("HTTP " + status.value() + " without Location from "
                        + UrlTemplate.redact(url));
            }
            return new Response(null, location);
        }
        if (status.value() == 429 || status.is5xxServerError()) {
            throw new RetryableException("HTTP " + status.value() + " from " + UrlTemplate.redact(url), null);
        }
        if (!status.is2xxSuccessful()) {
            throw new SourceUnavailableException("HTTP " + status.value() + " from " + UrlTemplate.redact(url));
        }
        String body = entity.getBody();
        return new Response(body == null ? "" : body, null);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException("Interrupted while waiting to retry", e);
        }
    }

    private record Response(String body, String location) {
    }

    private static final class RetryableException extends RuntimeException {
        RetryableException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
