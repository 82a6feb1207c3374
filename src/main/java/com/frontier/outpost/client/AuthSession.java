package com.frontier.outpost.client;

import com.frontier.outpost.config.AppMetrics;
import com.frontier.outpost.model.AuthToken;
import com.frontier.outpost.model.LoginRequest;
import com.frontier.outpost.model.LoginResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds zero or one bearer token for a single outpost.
 *
 * One instance per node per process; every client and every concurrent sync
 * addressing that node shares it. Reads are lock-free, refreshes are serialized
 * so that concurrent callers seeing the same stale token trigger a single login.
 * Expiry is lazy: {@link #currentToken()} drops the token once it has expired.
 */
@Slf4j
public class AuthSession {

    static final String LOGIN_PATH = "/auth/login";
    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final String node;
    private final URI loginUri;
    private final ResilientRequestExecutor executor;
    private final RetryPolicy loginPolicy;
    private final Clock clock;
    private final AppMetrics metrics;

    private final AtomicReference<AuthToken> token = new AtomicReference<>();
    private final ReentrantLock refreshLock = new ReentrantLock();
    private volatile LoginRequest credentials;

    public AuthSession(String node, String baseUrl, ResilientRequestExecutor executor,
                       RetryPolicy loginPolicy, Clock clock, AppMetrics metrics) {
        this.node = node;
        this.loginUri = UriComponentsBuilder.fromHttpUrl(baseUrl).path(LOGIN_PATH).build().toUri();
        this.executor = executor;
        this.loginPolicy = loginPolicy;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Caches credentials for later transparent re-authentication without logging in now.
     */
    public void rememberCredentials(String username, String password) {
        this.credentials = new LoginRequest(username, password);
    }

    public boolean hasCredentials() {
        return credentials != null;
    }

    /**
     * Logs in and stores the issued token.
     *
     * @return false when the node rejected the credentials; the token is then cleared
     * @throws OutpostTransientException the node could not be reached within the retry budget
     */
    public boolean authenticate(String username, String password) {
        refreshLock.lock();
        try {
            return login(new LoginRequest(username, password));
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Logs in again with the cached credentials, unless another caller already
     * replaced {@code stale} with a valid token while this one waited.
     *
     * @param stale the token the caller saw fail, or null when it had none
     * @return true when a valid token is held afterwards
     */
    public boolean reauthenticate(AuthToken stale) {
        refreshLock.lock();
        try {
            AuthToken held = token.get();
            if (held != null && held != stale && held.isValidAt(clock.instant())) {
                log.debug("Token for {} already refreshed by another caller", node);
                return true;
            }
            LoginRequest cached = credentials;
            if (cached == null) {
                log.warn("Cannot re-authenticate with {}: no cached credentials", node);
                return false;
            }
            log.info("Re-authenticating with {} as {}", node, cached.username());
            metrics.incrementReauth(node);
            return login(cached);
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * The held token if it has not expired; an expired token is discarded.
     */
    public Optional<AuthToken> currentToken() {
        AuthToken held = token.get();
        if (held == null) {
            return Optional.empty();
        }
        if (held.isValidAt(clock.instant())) {
            return Optional.of(held);
        }
        if (token.compareAndSet(held, null)) {
            log.info("Token for {} ({}) expired at {}", node, held.principal(), held.expiresAt());
        }
        return Optional.empty();
    }

    /**
     * Discards the token unconditionally. Cached credentials are kept.
     */
    public void clear() {
        AuthToken previous = token.getAndSet(null);
        if (previous != null) {
            log.info("Cleared token for {} ({})", node, previous.principal());
        }
    }

    public String node() {
        return node;
    }

    private boolean login(LoginRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        LoginResponse response;
        try {
            response = executor.execute(node, "login", HttpMethod.POST, loginUri,
                    new HttpEntity<>(request, headers),
                    new ParameterizedTypeReference<LoginResponse>() {},
                    loginPolicy).getBody();
        } catch (OutpostAuthenticationException | OutpostValidationException e) {
            // credential failure is terminal: forget the credentials so they are not replayed
            token.set(null);
            if (request.equals(credentials)) {
                credentials = null;
            }
            log.warn("Login to {} as {} rejected: {}", node, request.username(), e.getMessage());
            return false;
        } catch (OutpostTransientException e) {
            token.set(null);
            throw e;
        }

        if (response == null || response.accessToken() == null || response.accessToken().isBlank()) {
            token.set(null);
            log.warn("Login to {} as {} returned no access token", node, request.username());
            return false;
        }

        Instant issuedAt = clock.instant();
        long expiresIn = response.expiresIn() != null ? response.expiresIn() : DEFAULT_EXPIRES_IN_SECONDS;
        AuthToken issued = new AuthToken(response.accessToken(), issuedAt,
                issuedAt.plus(Duration.ofSeconds(expiresIn)), request.username());
        token.set(issued);
        credentials = request;
        log.info("Authenticated with {} as {} (expires {})", node, request.username(), issued.expiresAt());
        return true;
    }
}
