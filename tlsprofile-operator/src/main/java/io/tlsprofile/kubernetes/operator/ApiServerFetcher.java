/*
 * Copyright TLS Profile Watcher Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.tlsprofile.kubernetes.operator;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.openshift.api.model.config.v1.APIServer;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Looks up an {@code APIServer} resource by name.
 */
@FunctionalInterface
public interface ApiServerFetcher {

    /**
     * @param name The name of the resource.
     * @return The resource, or null if there is no such resource.
     * @throws ProfileFetchException If the resource could not be retrieved.
     */
    @Nullable
    APIServer fetch(String name);

    /**
     * @param client The client to fetch with.
     * @return A fetcher which reads from the Kubernetes API via the given client.
     */
    static ApiServerFetcher fromClient(KubernetesClient client) {
        return name -> {
            try {
                return client.resources(APIServer.class).withName(name).get();
            }
            catch (KubernetesClientException e) {
                throw new ProfileFetchException(name, e);
            }
        };
    }
}
