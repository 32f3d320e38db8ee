package com.heroku.relay.config;

import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

@Component
public class StreamResponseHeadersFilter implements WebFilter {

    @Override
    public @NonNull Mono<Void> filter(@NonNull ServerWebExchange exchange, @NonNull WebFilterChain chain) {
        // Keep proxies (including the Heroku router and nginx) from caching or buffering the event stream
        String path = exchange.getRequest().getPath().pathWithinApplication().value();
        if (path.endsWith("/stream")) {
            ServerHttpResponse response = exchange.getResponse();
            response.getHeaders().set(HttpHeaders.CACHE_CONTROL, "no-cache");
            response.getHeaders().set(HttpHeaders.CONNECTION, "keep-alive");
            response.getHeaders().set("X-Accel-Buffering", "no");
        }
        return chain.filter(exchange);
    }
}
