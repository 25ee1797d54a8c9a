package com.clientsync.security;

import com.clientsync.config.ClientSyncProperties;
import com.clientsync.util.ApiKeyUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Filter for admin API key authentication.
 * Validates Bearer tokens on /v1/admin/** against clientsync.admin.api-key.
 */
@Slf4j
@RequiredArgsConstructor
public class AdminApiKeyAuthenticationFilter implements WebFilter {

    static final String ADMIN_PATH_PREFIX = "/v1/admin/";
    private static final String BEARER_PREFIX = "Bearer ";

    private final ClientSyncProperties properties;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (!path.startsWith(ADMIN_PATH_PREFIX)) {
            return chain.filter(exchange);
        }

        String expected = properties.getAdmin().getApiKey();
        if (expected == null || expected.isBlank()) {
            log.warn("Admin request to {} refused: clientsync.admin.api-key is not configured", path);
            return unauthorized(exchange);
        }

        String authHeader = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            log.warn("Missing or invalid Authorization header on {}", path);
            return unauthorized(exchange);
        }

        String apiKey = authHeader.substring(BEARER_PREFIX.length()).trim();
        if (!ApiKeyUtil.matches(apiKey, expected)) {
            log.warn("Invalid admin API key {}... on {}", ApiKeyUtil.getKeyPrefix(apiKey), path);
            return unauthorized(exchange);
        }

        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                "admin", null, List.of(new SimpleGrantedAuthority("ROLE_ADMIN")));
        return chain.filter(exchange)
                .contextWrite(ReactiveSecurityContextHolder.withAuthentication(authentication));
    }

    private Mono<Void> unauthorized(ServerWebExchange exchange) {
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        return exchange.getResponse().setComplete();
    }
}
