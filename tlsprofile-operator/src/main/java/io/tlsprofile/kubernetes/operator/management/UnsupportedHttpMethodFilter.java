/*
 * Copyright TLS Profile Watcher Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.tlsprofile.kubernetes.operator.management;

import java.io.IOException;
import java.util.Locale;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;

/**
 * Rejects requests to the management endpoints which are not {@code GET}.
 * <p>
 * {@code GET} is passed on to the handler. Every other method, {@code HEAD} included, receives a
 * <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/405">405 Method Not Allowed</a>
 * without the request body being read.
 */
public class UnsupportedHttpMethodFilter extends Filter {

    public static final Filter INSTANCE = new UnsupportedHttpMethodFilter();

    static final String ALLOW_HEADER_VALUE = "GET";

    private UnsupportedHttpMethodFilter() {
    }

    @Override
    public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
        if (ALLOW_HEADER_VALUE.equals(exchange.getRequestMethod().toUpperCase(Locale.ROOT))) {
            chain.doFilter(exchange);
            return;
        }
        try (exchange) {
            exchange.getResponseHeaders().add("Allow", ALLOW_HEADER_VALUE);
            exchange.sendResponseHeaders(405, -1);
        }
    }

    @Override
    public String description() {
        return "Rejects non-GET requests to management endpoints";
    }
}
