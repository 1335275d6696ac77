/*
 * Copyright TLS Profile Watcher Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.tlsprofile.kubernetes.operator;

import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LoggingEventBuilder;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.openshift.api.model.config.v1.APIServer;
import io.fabric8.openshift.api.model.config.v1.APIServerSpec;
import io.fabric8.openshift.api.model.config.v1.TLSSecurityProfile;
import io.javaoperatorsdk.operator.Operator;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.ErrorStatusUpdateControl;
import io.javaoperatorsdk.operator.api.reconciler.Reconciler;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;

import io.tlsprofile.kubernetes.operator.profile.ProfileResolutionException;
import io.tlsprofile.kubernetes.operator.profile.TlsProfileResolver;
import io.tlsprofile.kubernetes.operator.profile.TlsProfileSpec;
import io.tlsprofile.kubernetes.operator.watch.ProfileChangeDispatcher;
import io.tlsprofile.kubernetes.operator.watch.ProfileChangeListener;
import io.tlsprofile.kubernetes.operator.watch.WatcherState;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Watches the cluster's {@code APIServer} and calls a {@link ProfileChangeListener} once for
 * each change to the effective TLS profile selected by {@code spec.tlsSecurityProfile}.
 * <p>
 * Changes are detected by comparing resolved profiles, so switching between a preset and a
 * {@code Custom} profile with the same settings is not a change. Reconciliation may be
 * repeated, replayed or run concurrently; each transition is still notified once.
 * <p>
 * The watcher is seeded with the profile the caller assumes is in effect when watching starts.
 * It does not re-resolve the live resource at startup, so if the two differ the difference is
 * only noticed when the resource next changes.
 */
public class SecurityProfileWatcher implements Reconciler<APIServer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(SecurityProfileWatcher.class);

    /** The name of the singleton {@code APIServer} resource holding the cluster-wide configuration. */
    public static final String API_SERVER_NAME = "cluster";

    private final ApiServerFetcher fetcher;
    private final WatcherState state;
    private final ProfileChangeDispatcher dispatcher;

    /**
     * @param fetcher Used to get the current {@code APIServer}.
     * @param initialProfile The profile assumed to be in effect before watching begins.
     * @param listener The listener to notify of changes.
     */
    public SecurityProfileWatcher(ApiServerFetcher fetcher,
                                  TlsProfileSpec initialProfile,
                                  ProfileChangeListener listener) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.state = new WatcherState(initialProfile);
        this.dispatcher = new ProfileChangeDispatcher(listener);
    }

    /**
     * Registers this watcher with the given operator, which must not yet have been started.
     * @param operator The operator.
     */
    public void setupWithOperator(Operator operator) {
        operator.register(this);
    }

    /**
     * @return The last known TLS profile.
     */
    public TlsProfileSpec currentProfile() {
        return state.snapshot();
    }

    @Override
    public UpdateControl<APIServer> reconcile(APIServer resource, Context<APIServer> context) {
        if (!API_SERVER_NAME.equals(name(resource))) {
            LOGGER.debug("Ignoring APIServer {}, only {} is watched", name(resource), API_SERVER_NAME);
            return UpdateControl.noUpdate();
        }
        reconcileProfile();
        return UpdateControl.noUpdate();
    }

    /**
     * Fetches the {@code APIServer}, resolves its profile and notifies the listener if
     * the resolved profile differs from the last known one.
     * @throws ProfileFetchException If the {@code APIServer} could not be retrieved.
     * @throws ProfileResolutionException If its profile could not be resolved.
     */
    void reconcileProfile() {
        APIServer apiServer = fetcher.fetch(API_SERVER_NAME);
        if (apiServer == null) {
            LOGGER.debug("APIServer {} does not exist, nothing to reconcile", API_SERVER_NAME);
            return;
        }
        TlsProfileSpec resolved = TlsProfileResolver.resolve(tlsSecurityProfile(apiServer));
        state.transitionTo(resolved).ifPresentOrElse(transition -> {
            try {
                addResourceKeys(apiServer, LOGGER.atInfo())
                        .addKeyValue("minTLSVersion", resolved.minTlsVersion())
                        .log("TLS security profile changed");
            }
            finally {
                // a committed transition must reach the dispatcher or later ones never get their turn
                dispatcher.dispatch(transition);
            }
        }, () -> LOGGER.debug("TLS security profile of APIServer {} unchanged", API_SERVER_NAME));
    }

    @Override
    public ErrorStatusUpdateControl<APIServer> updateErrorStatus(APIServer resource, Context<APIServer> context, Exception e) {
        if (e instanceof ProfileResolutionException resolutionException) {
            addResourceKeys(resource, LOGGER.atWarn())
                    .addKeyValue("kind", resolutionException.getKind())
                    .log("Could not resolve TLS security profile: {}", e.getMessage());
        }
        else {
            addResourceKeys(resource, LOGGER.atError())
                    .setCause(e)
                    .log("Failed to reconcile TLS security profile");
        }
        // the APIServer is not ours to update, retry applies as normal
        return ErrorStatusUpdateControl.noStatusUpdate();
    }

    @Nullable
    static TLSSecurityProfile tlsSecurityProfile(APIServer apiServer) {
        return Optional.ofNullable(apiServer.getSpec())
                .map(APIServerSpec::getTlsSecurityProfile)
                .orElse(null);
    }

    @Nullable
    private static String name(HasMetadata resource) {
        return resource.getMetadata() == null ? null : resource.getMetadata().getName();
    }

    private static LoggingEventBuilder addResourceKeys(HasMetadata resource, LoggingEventBuilder loggingEventBuilder) {
        return loggingEventBuilder.addKeyValue("resourceKind", resource.getKind())
                .addKeyValue("name", name(resource));
    }
}
