/*
 * Copyright TLS Profile Watcher Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.tlsprofile.kubernetes.operator.watch;

import io.tlsprofile.kubernetes.operator.profile.TlsProfileSpec;

/**
 * Callback for changes to the cluster's effective TLS profile.
 */
@FunctionalInterface
public interface ProfileChangeListener {

    /**
     * Called once for each detected change, on the reconciling thread and in the order
     * the changes were detected. A slow implementation delays the reconciliation that
     * detected the change. Exceptions thrown are logged and the change is not redelivered.
     * @param previous The profile in effect before the change.
     * @param current The profile now in effect.
     */
    void onProfileChange(TlsProfileSpec previous, TlsProfileSpec current);
}
