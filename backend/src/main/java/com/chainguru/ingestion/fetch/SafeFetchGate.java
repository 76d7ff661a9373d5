package com.chainguru.ingestion.fetch;

import com.chainguru.ingestion.config.FetchGateProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Single outbound path for operator-supplied URLs. Every URL is validated (scheme, host name, literal and resolved
 * addresses) before any connection; redirects are never followed so a public URL cannot bounce into internal
 * infrastructure. Failures surface as {@link FetchException} with a short diagnostic message.
 * <p>
 * Known limitation: the address checked here is resolved again by the HTTP client, so a DNS answer that changes
 * between the two lookups is not caught.
 */
@Slf4j
@Component
public class SafeFetchGate {

    static final String TIMEOUT = "timeout";
    static final String RATE_LIMITED = "rate_limited";
    static final String INTERRUPTED = "interrupted";
    static final String BODY_TOO_LARGE = "body_too_large";
    static final String INVALID_JSON = "invalid_json";

    private static final Set<String> LOCAL_NAMES = Set.of(
            "localhost", "localhost.localdomain", "ip6-localhost", "ip6-loopback");

    private final WebClient webClient;
    private final HostResolver hostResolver;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final String userAgent;

    public SafeFetchGate(@Qualifier("fetchWebClient") WebClient webClient,
                         HostResolver hostResolver,
                         @Qualifier("fetchRateLimiter") RateLimiter rateLimiter,
                         ObjectMapper objectMapper,
                         FetchGateProperties properties) {
        this.webClient = webClient;
        this.hostResolver = hostResolver;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.timeout = Duration.ofMillis(Math.max(1L, properties.getTimeoutMs()));
        this.userAgent = properties.getUserAgent();
    }

    /**
     * Decides whether {@code url} may be fetched. Checks run in a fixed order and the first failing check names
     * the reason; DNS is consulted only for non-literal hosts.
     */
    public UrlValidation validate(String url) {
        URI uri;
        try {
            uri = new URI(url == null ? "" : url.trim());
        } catch (URISyntaxException e) {
            return UrlValidation.reject(UrlValidation.INVALID_URL);
        }
        String scheme = uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            return UrlValidation.reject(UrlValidation.INVALID_SCHEME);
        }
        String host = normalizeHost(hostOf(uri));
        if (host.isEmpty()) {
            return UrlValidation.reject(UrlValidation.MISSING_HOST);
        }
        if (isLocalName(host)) {
            return UrlValidation.reject(UrlValidation.LOCALHOST_BLOCKED);
        }
        Optional<InetAddress> literal = IpAddressClassifier.parseLiteral(host);
        if (literal.isPresent()) {
            return IpAddressClassifier.isBlocked(literal.get())
                    ? UrlValidation.reject(UrlValidation.PRIVATE_IP_BLOCKED)
                    : UrlValidation.allow();
        }
        List<InetAddress> resolved;
        try {
            resolved = hostResolver.resolve(host, portOf(uri, scheme));
        } catch (UnknownHostException | RuntimeException e) {
            log.debug("DNS resolution failed for {}: {}", host, e.getMessage());
            return UrlValidation.reject(UrlValidation.DNS_ERROR);
        }
        if (resolved == null || resolved.isEmpty()) {
            return UrlValidation.reject(UrlValidation.DNS_ERROR);
        }
        for (InetAddress address : resolved) {
            if (IpAddressClassifier.isBlocked(address)) {
                return UrlValidation.reject(UrlValidation.PRIVATE_IP_BLOCKED);
            }
        }
        return UrlValidation.allow();
    }

    /**
     * Validates then fetches {@code url}. Returns the body of a 2xx response.
     *
     * @throws FetchBlockedException when validation rejects the URL (no connection is made)
     * @throws FetchException        on non-2xx ("http_&lt;code&gt;"), timeout, throttling or transport failure
     */
    public byte[] fetch(String url, FetchOptions options) {
        UrlValidation validation = validate(url);
        if (!validation.allowed()) {
            throw new FetchBlockedException(url, validation.reason());
        }
        if (!rateLimiter.acquirePermission()) {
            throw new FetchException(RATE_LIMITED);
        }
        URI uri = URI.create(url.trim());
        WebClient.RequestBodySpec spec = webClient.method(options.method())
                .uri(uri)
                .header(HttpHeaders.USER_AGENT, userAgent);
        WebClient.RequestHeadersSpec<?> request = options.jsonBody() != null
                ? spec.contentType(MediaType.APPLICATION_JSON).bodyValue(options.jsonBody())
                : spec;
        try {
            byte[] body = request.retrieve()
                    .onStatus(status -> !status.is2xxSuccessful(),
                            response -> response.releaseBody()
                                    .then(Mono.error(new FetchException("http_" + response.statusCode().value()))))
                    .bodyToMono(byte[].class)
                    .timeout(timeout)
                    .block();
            return body != null ? body : new byte[0];
        } catch (FetchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw translate(url, e);
        }
    }

    public JsonNode getJson(String url) {
        return parseJson(fetch(url, FetchOptions.get()));
    }

    public JsonNode postJson(String url, Object body) {
        return parseJson(fetch(url, FetchOptions.postJson(body)));
    }

    /** Body decoded as UTF-8; used for HTML pages. */
    public String getText(String url) {
        return new String(fetch(url, FetchOptions.get()), StandardCharsets.UTF_8);
    }

    private JsonNode parseJson(byte[] body) {
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new FetchException(INVALID_JSON, e);
        }
    }

    private FetchException translate(String url, RuntimeException error) {
        Throwable cause = Exceptions.unwrap(error);
        if (cause instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
            Thread.currentThread().interrupt();
            return new FetchException(INTERRUPTED, cause);
        }
        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException
                    || t instanceof io.netty.handler.timeout.TimeoutException
                    || t instanceof io.netty.channel.ConnectTimeoutException) {
                return new FetchException(TIMEOUT, cause);
            }
            if (t instanceof DataBufferLimitException) {
                return new FetchException(BODY_TOO_LARGE, cause);
            }
        }
        if (cause instanceof WebClientRequestException requestException) {
            Throwable root = requestException.getMostSpecificCause();
            log.debug("Transport failure for {}: {}", url, root.toString());
            return new FetchException("connection_error: " + root.getClass().getSimpleName(), cause);
        }
        log.debug("Fetch failed for {}: {}", url, cause.toString());
        return new FetchException("fetch_error: " + cause.getClass().getSimpleName(), cause);
    }

    /** URI.getHost() is null for names with underscores; fall back to the raw authority. */
    private static String hostOf(URI uri) {
        if (uri.getHost() != null) {
            return uri.getHost();
        }
        String authority = uri.getRawAuthority();
        if (authority == null) {
            return "";
        }
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            authority = authority.substring(at + 1);
        }
        if (authority.startsWith("[")) {
            int close = authority.indexOf(']');
            return close > 0 ? authority.substring(0, close + 1) : authority;
        }
        int colon = authority.lastIndexOf(':');
        return colon >= 0 ? authority.substring(0, colon) : authority;
    }

    private static String normalizeHost(String host) {
        String h = host == null ? "" : host.toLowerCase(Locale.ROOT);
        int start = 0;
        int end = h.length();
        while (start < end && h.charAt(start) == '.') {
            start++;
        }
        while (end > start && h.charAt(end - 1) == '.') {
            end--;
        }
        return h.substring(start, end);
    }

    private static boolean isLocalName(String host) {
        return LOCAL_NAMES.contains(host) || host.endsWith(".localhost") || host.endsWith(".local");
    }

    private static int portOf(URI uri, String scheme) {
        if (uri.getPort() > 0) {
            return uri.getPort();
        }
        return "https".equals(scheme) ? 443 : 80;
    }
}
