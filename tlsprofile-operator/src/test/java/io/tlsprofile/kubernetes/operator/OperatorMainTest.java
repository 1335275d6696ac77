/*
 * Copyright TLS Profile Watcher Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.tlsprofile.kubernetes.operator;

import java.io.IOException;
import java.util.ArrayList;
import java.util.concurrent.TimeUnit;

import org.assertj.core.api.ListAssert;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.base.CustomResourceDefinitionContext;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.kubernetes.client.server.mock.KubernetesMockServer;
import io.fabric8.openshift.api.model.config.v1.APIServer;
import io.fabric8.openshift.api.model.config.v1.APIServerBuilder;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

import io.tlsprofile.kubernetes.operator.management.UnsupportedHttpMethodFilter;
import io.tlsprofile.kubernetes.operator.profile.ProfileResolutionException;
import io.tlsprofile.kubernetes.operator.profile.TlsProfileType;

import static io.tlsprofile.kubernetes.operator.SecurityProfileWatcherTest.apiServerWith;
import static io.tlsprofile.kubernetes.operator.SecurityProfileWatcherTest.preset;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@EnableKubernetesMockClient(crud = true)
@ExtendWith(MockitoExtension.class)
class OperatorMainTest {

    KubernetesClient kubeClient;
    KubernetesMockServer mockServer;

    private OperatorMain operatorMain;

    @Mock
    HttpServer managementServer;

    @Mock
    HttpContext httpContext;

    @BeforeEach
    void setUp() {
        mockServer.expectCustomResource(new CustomResourceDefinitionContext.Builder()
                .withGroup("config.openshift.io")
                .withVersion("v1")
                .withKind("APIServer")
                .withPlural("apiservers")
                .withScope("Cluster")
                .build());
        when(managementServer.createContext(anyString(), any(HttpHandler.class))).thenReturn(httpContext);
        operatorMain = new OperatorMain(kubeClient, managementServer);
    }

    @AfterEach
    void tearDown() {
        if (operatorMain != null) {
            operatorMain.stop();
        }
    }

    @Test
    void shouldRegisterPrometheusMeterRegistry() {
        // Given
        kubeClient.resource(apiServerWith(preset("Intermediate"))).create();

        // When
        operatorMain.start();

        // Then
        assertThat(Metrics.globalRegistry.getRegistries())
                .hasAtLeastOneElementOfType(PrometheusMeterRegistry.class);
    }

    @Test
    void shouldSeedWatcherFromLiveApiServer() {
        // Given
        kubeClient.resource(apiServerWith(preset("Modern"))).create();

        // When
        operatorMain.start();

        // Then
        assertThat(operatorMain.watcher()).isNotNull();
        assertThat(operatorMain.watcher().currentProfile()).isEqualTo(TlsProfileType.MODERN.spec());
    }

    @Test
    void shouldSeedWatcherWithDefaultWhenApiServerIsAbsent() {
        // Given
        // no APIServer

        // When
        operatorMain.start();

        // Then
        assertThat(operatorMain.watcher()).isNotNull();
        assertThat(operatorMain.watcher().currentProfile()).isEqualTo(TlsProfileType.INTERMEDIATE.spec());
    }

    @Test
    void shouldFailStartupWhenInitialProfileCannotBeResolved() {
        // Given
        kubeClient.resource(apiServerWith(preset("Paranoid"))).create();
        OperatorMain unstartable = operatorMain;
        operatorMain = null;

        // When/Then
        assertThatThrownBy(unstartable::start)
                .isInstanceOf(OperatorConfigurationException.class)
                .hasCauseInstanceOf(ProfileResolutionException.class);
    }

    @Test
    void shouldCountProfileChanges() {
        // Given
        kubeClient.resource(apiServerWith(preset("Intermediate"))).create();
        double before = Metrics.globalRegistry.get(OperatorMain.PROFILE_CHANGES_METRIC_NAME).counter().count();
        operatorMain.start();

        // When
        kubeClient.resources(APIServer.class)
                .withName(SecurityProfileWatcher.API_SERVER_NAME)
                .edit(apiServer -> new APIServerBuilder(apiServer)
                        .editSpec()
                        .withTlsSecurityProfile(preset("Modern"))
                        .endSpec()
                        .build());

        // Then
        Awaitility.await()
                .atMost(10, TimeUnit.SECONDS)
                .untilAsserted(() -> assertThat(Metrics.globalRegistry.get(OperatorMain.PROFILE_CHANGES_METRIC_NAME).counter().count())
                        .isEqualTo(before + 1));
        assertThat(operatorMain.watcher().currentProfile()).isEqualTo(TlsProfileType.MODERN.spec());
    }

    @Test
    void shouldStartHttpServer() {
        // Given
        kubeClient.resource(apiServerWith(preset("Intermediate"))).create();

        // When
        operatorMain.start();

        // Then
        verify(managementServer).start();
    }

    @Test
    void shouldRegisterMetricsWithManagementServer() {
        // Given
        kubeClient.resource(apiServerWith(preset("Intermediate"))).create();

        // When
        operatorMain.start();

        // Then
        verify(managementServer).createContext(eq(OperatorMain.HTTP_PATH_METRICS), any(HttpHandler.class));
    }

    @Test
    void shouldRegisterLivezWithManagementServer() {
        // Given
        kubeClient.resource(apiServerWith(preset("Intermediate"))).create();

        // When
        operatorMain.start();

        // Then
        verify(managementServer).createContext(eq(OperatorMain.HTTP_PATH_LIVEZ), any(HttpHandler.class));
    }

    @Test
    void shouldRegisterUnsupportedMethodsFilterWithManagementServer() {
        // Given
        kubeClient.resource(apiServerWith(preset("Intermediate"))).create();
        final ArrayList<Filter> filters = new ArrayList<>();
        when(httpContext.getFilters()).thenReturn(filters);

        // When
        operatorMain.start();

        // Then
        verify(managementServer).createContext(eq("/"), any(HttpHandler.class));
        ListAssert<Filter> filterListAssert = assertThat(filters).hasSize(2);
        filterListAssert.first()
                .isInstanceOf(UnsupportedHttpMethodFilter.class);
        filterListAssert.last()
                .isInstanceOf(UnsupportedHttpMethodFilter.class);
    }

    @Test
    void shouldRespondWith404ForUnknownPaths() throws IOException {
        shouldRespondWithStatusCode("/", 404);
    }

    @Test
    void shouldRespondWith200ForLivez() throws IOException {
        shouldRespondWithStatusCode(OperatorMain.HTTP_PATH_LIVEZ, 200);
    }

    private void shouldRespondWithStatusCode(
                                             String path,
                                             int statusCode)
            throws IOException {
        // Given
        kubeClient.resource(apiServerWith(preset("Intermediate"))).create();
        final ArgumentCaptor<HttpHandler> captor = ArgumentCaptor.forClass(HttpHandler.class);
        when(managementServer.createContext(eq(path), captor.capture())).thenReturn(httpContext);
        operatorMain.start();
        final HttpExchange httpExchange = mock(HttpExchange.class);

        // When
        captor.getValue().handle(httpExchange);

        // Then
        verify(httpExchange).sendResponseHeaders(statusCode, -1);
    }
}
