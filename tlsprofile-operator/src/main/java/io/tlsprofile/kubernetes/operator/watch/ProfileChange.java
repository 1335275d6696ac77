/*
 * Copyright TLS Profile Watcher Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.tlsprofile.kubernetes.operator.watch;

import java.util.Objects;

import io.tlsprofile.kubernetes.operator.profile.TlsProfileComparator;
import io.tlsprofile.kubernetes.operator.profile.TlsProfileSpec;

/**
 * A detected transition between two profiles which are not equal.
 * @param previous The profile before the transition.
 * @param current The profile after the transition.
 */
public record ProfileChange(TlsProfileSpec previous, TlsProfileSpec current) {

    public ProfileChange {
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(current, "current");
        if (TlsProfileComparator.equal(previous, current)) {
            throw new IllegalArgumentException("A profile change requires distinct profiles, but both were " + current);
        }
    }
}
