/*
 * Copyright TLS Profile Watcher Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.tlsprofile.kubernetes.operator;

/**
 * The {@code APIServer} resource could not be retrieved, typically because of a transient
 * failure talking to the Kubernetes API. Reconciliation fails and is retried.
 */
public class ProfileFetchException extends RuntimeException {

    public ProfileFetchException(String name, Exception cause) {
        super("Failed to get APIServer '" + name + "'", cause);
    }
}
