package com.stlmonitor.collectors.feed;

import com.stlmonitor.collectors.config.RelayConfig;
import com.stlmonitor.core.bus.EventBus;
import com.stlmonitor.core.events.FeedFetchFailed;
import com.stlmonitor.core.events.FeedFetched;
import com.stlmonitor.core.model.FeedSource;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Fetches feed text over an ordered chain of {@link FetchRoute}s. Each route gets one bounded attempt; the first
 * response that looks like a feed wins. Exhausting the chain yields an empty result, not an error.
 */
public class FeedTransport {
    private static final Logger LOGGER = Logger.getLogger(FeedTransport.class.getName());

    private final HttpClient httpClient;
    private final EventBus eventBus;
    private final Clock clock;
    private final List<FetchRoute> routes;
    private final Duration timeout;

    public FeedTransport(HttpClient httpClient, EventBus eventBus, Clock clock, List<FetchRoute> routes, Duration timeout) {
        if (routes.isEmpty()) {
            throw new IllegalArgumentException("at least one fetch route is required");
        }
        this.httpClient = httpClient;
        this.eventBus = eventBus;
        this.clock = clock;
        this.routes = List.copyOf(routes);
        this.timeout = timeout;
    }

    /**
     * Direct access first, then every relay in the given order.
     */
    public static List<FetchRoute> routes(List<RelayConfig> relays) {
        List<FetchRoute> routes = new ArrayList<>();
        routes.add(new DirectRoute());
        relays.stream().map(RelayRoute::new).forEach(routes::add);
        return routes;
    }

    public List<FetchRoute> routes() {
        return routes;
    }

    public CompletableFuture<Optional<String>> fetch(String url) {
        return attempt(url, 0);
    }

    /**
     * Primary URL through the whole route chain, then each fallback URL in turn.
     */
    public CompletableFuture<Optional<String>> fetchWithFallbacks(FeedSource source) {
        List<String> urls = new ArrayList<>();
        urls.add(source.url());
        urls.addAll(source.fallbackUrls());
        return fetchFirst(source.name(), urls, 0);
    }

    private CompletableFuture<Optional<String>> fetchFirst(String sourceName, List<String> urls, int index) {
        if (index >= urls.size()) {
            LOGGER.warning(() -> sourceName + ": all " + urls.size() + " URL(s) failed on every route");
            return CompletableFuture.completedFuture(Optional.empty());
        }
        if (index > 0) {
            LOGGER.info(() -> sourceName + ": trying fallback URL " + urls.get(index));
        }
        return fetch(urls.get(index)).thenCompose(body -> body.isPresent()
                ? CompletableFuture.completedFuture(body)
                : fetchFirst(sourceName, urls, index + 1));
    }

    private CompletableFuture<Optional<String>> attempt(String url, int routeIndex) {
        if (routeIndex >= routes.size()) {
            LOGGER.warning(() -> "No route delivered a feed for " + url);
            return CompletableFuture.completedFuture(Optional.empty());
        }
        FetchRoute route = routes.get(routeIndex);
        Instant startedAt = clock.instant();

        HttpRequest request;
        try {
            request = route.request(url, timeout);
        } catch (IllegalArgumentException e) {
            failed(url, route, FeedFetchFailed.Stage.ERROR, "bad request URI: " + e.getMessage());
            return attempt(url, routeIndex + 1);
        }

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> evaluate(url, route, response, error, startedAt))
                .thenCompose(body -> body.isPresent()
                        ? CompletableFuture.completedFuture(body)
                        : attempt(url, routeIndex + 1));
    }

    private Optional<String> evaluate(
            String url,
            FetchRoute route,
            HttpResponse<String> response,
            Throwable error,
            Instant startedAt
    ) {
        if (error != null) {
            Throwable root = unwrap(error);
            FeedFetchFailed.Stage stage = root instanceof TimeoutException || root instanceof HttpTimeoutException
                    ? FeedFetchFailed.Stage.TIMEOUT
                    : FeedFetchFailed.Stage.ERROR;
            failed(url, route, stage, rootMessage(root));
            return Optional.empty();
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            failed(url, route, FeedFetchFailed.Stage.HTTP_STATUS, "HTTP " + response.statusCode());
            return Optional.empty();
        }

        String body;
        try {
            body = route.unwrap(response.body());
        } catch (IOException e) {
            failed(url, route, FeedFetchFailed.Stage.INVALID_CONTENT, "unreadable envelope: " + e.getMessage());
            return Optional.empty();
        }
        if (!FeedContentValidator.isValidFeedContent(body)) {
            boolean html = FeedContentValidator.looksLikeHtml(body);
            failed(url, route,
                    html ? FeedFetchFailed.Stage.HTML_PAGE : FeedFetchFailed.Stage.INVALID_CONTENT,
                    html ? "HTML page instead of feed" : "response is not RSS or Atom");
            return Optional.empty();
        }

        long durationMillis = Duration.between(startedAt, clock.instant()).toMillis();
        eventBus.publish(new FeedFetched(clock.instant(), url, route.name(), body.length(), durationMillis));
        LOGGER.fine(() -> "Fetched " + url + " via " + route.name());
        return Optional.of(body);
    }

    private void failed(String url, FetchRoute route, FeedFetchFailed.Stage stage, String detail) {
        LOGGER.fine(() -> "Route " + route.name() + " failed for " + url + " at " + stage + ": " + detail);
        eventBus.publish(new FeedFetchFailed(clock.instant(), url, route.name(), stage, detail));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
