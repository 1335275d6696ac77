/*
 * Copyright TLS Profile Watcher Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tlsprofile.kubernetes.operator;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.function.IntSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpServer;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.openshift.api.model.config.v1.APIServer;
import io.javaoperatorsdk.operator.Operator;
import io.javaoperatorsdk.operator.monitoring.micrometer.MicrometerMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.prometheus.metrics.exporter.httpserver.MetricsHandler;

import io.tlsprofile.kubernetes.operator.management.UnsupportedHttpMethodFilter;
import io.tlsprofile.kubernetes.operator.profile.ProfileResolutionException;
import io.tlsprofile.kubernetes.operator.profile.TlsProfileResolver;
import io.tlsprofile.kubernetes.operator.profile.TlsProfileSpec;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The {@code main} method entrypoint for the operator
 */
public class OperatorMain {

    private static final Logger LOGGER = LoggerFactory.getLogger(OperatorMain.class);
    private static final String BIND_ADDRESS_VAR_NAME = "BIND_ADDRESS";
    private static final int DEFAULT_MANAGEMENT_PORT = 8080;
    static final String HTTP_PATH_LIVEZ = "/livez";
    static final String HTTP_PATH_METRICS = "/metrics";
    static final String PROFILE_CHANGES_METRIC_NAME = "tls_profile_changes";

    private final KubernetesClient kubeClient;
    private final Operator operator;
    private final HttpServer managementServer;
    private final Counter profileChanges;
    @Nullable
    private SecurityProfileWatcher watcher;

    public OperatorMain() throws IOException {
        this(new KubernetesClientBuilder().build(), createHttpServer());
    }

    OperatorMain(KubernetesClient kubeClient, HttpServer managementServer) {
        this.kubeClient = kubeClient;
        configurePrometheusMetrics(managementServer);
        // o.withMetrics is invoked multiple times so can cause issues with enabling metrics.
        operator = new Operator(o -> {
            o.withMetrics(enablePrometheusMetrics());
            o.withKubernetesClient(kubeClient);
        });
        this.managementServer = managementServer;
        this.profileChanges = Counter.builder(PROFILE_CHANGES_METRIC_NAME)
                .description("Number of changes to the cluster TLS security profile observed since startup")
                .register(Metrics.globalRegistry);
    }

    public static void main(String[] args) {
        try {
            new OperatorMain().start();
        }
        catch (Exception e) {
            LOGGER.error("Operator has thrown exception during startup. Will now exit.", e);
            System.exit(1);
        }
    }

    /**
     * Starts the operator instance and returns once that has completed successfully.
     * @throws OperatorConfigurationException If the TLS profile in effect at startup cannot be determined.
     */
    void start() {
        ApiServerFetcher fetcher = ApiServerFetcher.fromClient(kubeClient);
        TlsProfileSpec initialProfile = initialProfile(fetcher);
        LOGGER.info("Initial TLS security profile has minTLSVersion {} and {} ciphers",
                initialProfile.minTlsVersion(), initialProfile.ciphers().size());
        watcher = new SecurityProfileWatcher(fetcher, initialProfile, this::onProfileChange);
        operator.installShutdownHook(Duration.ofSeconds(10));
        watcher.setupWithOperator(operator);
        addHttpGetHandler("/", () -> 404);
        managementServer.start();
        addHttpGetHandler(HTTP_PATH_LIVEZ, this::livezStatusCode);
        operator.start();
        LOGGER.info("Operator started, watching APIServer {}", SecurityProfileWatcher.API_SERVER_NAME);
    }

    /**
     * Determines the profile in effect at startup. This is the profile the watcher assumes
     * before it observes any change.
     */
    static TlsProfileSpec initialProfile(ApiServerFetcher fetcher) {
        try {
            APIServer apiServer = fetcher.fetch(SecurityProfileWatcher.API_SERVER_NAME);
            return TlsProfileResolver.resolve(apiServer == null ? null : SecurityProfileWatcher.tlsSecurityProfile(apiServer));
        }
        catch (ProfileFetchException | ProfileResolutionException e) {
            throw new OperatorConfigurationException("Unable to determine the initial TLS security profile", e);
        }
    }

    private void onProfileChange(TlsProfileSpec previous, TlsProfileSpec current) {
        profileChanges.increment();
        LOGGER.atWarn()
                .addKeyValue("previousMinTLSVersion", previous.minTlsVersion())
                .addKeyValue("currentMinTLSVersion", current.minTlsVersion())
                .log("Cluster TLS security profile changed from {} to {}", previous, current);
    }

    @Nullable
    SecurityProfileWatcher watcher() {
        return watcher;
    }

    private void addHttpGetHandler(
                                   String path,
                                   IntSupplier statusCodeSupplier) {
        managementServer.createContext(path, exchange -> {
            try (exchange) {
                // we only accept reads so there is no request body to drain
                exchange.sendResponseHeaders(statusCodeSupplier.getAsInt(), -1);
            }
        }).getFilters().add(UnsupportedHttpMethodFilter.INSTANCE);
    }

    private int livezStatusCode() {
        int sc;
        try {
            sc = operator.getRuntimeInfo().allEventSourcesAreHealthy() ? 200 : 400;
        }
        catch (Exception e) {
            sc = 400;
            LOGGER.error("Ignoring exception caught while getting operator health info", e);
        }
        (sc != 200 ? LOGGER.atWarn() : LOGGER.atDebug()).log("Responding {} to GET {}", sc, HTTP_PATH_LIVEZ);
        return sc;
    }

    void stop() {
        operator.stop();
        managementServer.stop(0);
        LOGGER.info("Operator stopped.");
    }

    private MicrometerMetrics enablePrometheusMetrics() {
        return MicrometerMetrics.newPerResourceCollectingMicrometerMetricsBuilder(Metrics.globalRegistry)
                .withCleanUpDelayInSeconds(35)
                .withCleaningThreadNumber(1)
                .build();
    }

    private void configurePrometheusMetrics(HttpServer managementServer) {
        final PrometheusMeterRegistry prometheusMeterRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        final HttpContext metricsContext = managementServer.createContext(HTTP_PATH_METRICS,
                new MetricsHandler(prometheusMeterRegistry.getPrometheusRegistry()));
        metricsContext.getFilters().add(UnsupportedHttpMethodFilter.INSTANCE);
        Metrics.globalRegistry.add(prometheusMeterRegistry);
    }

    static HttpServer createHttpServer() throws IOException {
        final Properties systemProps = System.getProperties();
        if (!systemProps.containsKey("sun.net.httpserver.maxReqTime")) {
            System.setProperty("sun.net.httpserver.maxReqTime", "60");
        }

        if (!systemProps.containsKey("sun.net.httpserver.maxRspTime")) {
            System.setProperty("sun.net.httpserver.maxRspTime", "120");
        }

        return HttpServer.create(getBindAddress(System.getenv()), 0);
    }

    static InetSocketAddress getBindAddress(Map<String, String> envVars) {
        final String bindAddress = envVars.getOrDefault(BIND_ADDRESS_VAR_NAME, "0.0.0.0:" + DEFAULT_MANAGEMENT_PORT);
        String bindToInterface;
        int bindToPort;
        int colon = bindAddress.lastIndexOf(':');
        if (colon >= 0) {
            bindToInterface = bindAddress.substring(0, colon);
            try {
                bindToPort = Integer.parseInt(bindAddress.substring(colon + 1));
            }
            catch (NumberFormatException e) {
                throw new OperatorConfigurationException(BIND_ADDRESS_VAR_NAME + " env var has an invalid port: " + bindAddress, e);
            }
            if (bindToPort < 0 || bindToPort > 65535) {
                throw new OperatorConfigurationException(BIND_ADDRESS_VAR_NAME + " env var has a port outside 0-65535: " + bindAddress);
            }
        }
        else if (!bindAddress.isEmpty()) {
            LOGGER.warn("{} env var is set but does not contain `:` assuming hostname only and binding to default port ({})",
                    BIND_ADDRESS_VAR_NAME,
                    DEFAULT_MANAGEMENT_PORT);
            bindToInterface = bindAddress;
            bindToPort = DEFAULT_MANAGEMENT_PORT;
        }
        else {
            bindToInterface = "0.0.0.0";
            bindToPort = DEFAULT_MANAGEMENT_PORT;
        }

        LOGGER.info("Starting management server on: {}:{}", bindToInterface, bindToPort);
        return new InetSocketAddress(bindToInterface, bindToPort);
    }
}
