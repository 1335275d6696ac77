/*
 * Copyright TLS Profile Watcher Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.tlsprofile.kubernetes.operator.profile;

import java.util.Arrays;
import java.util.Optional;

/**
 * The minimum TLS protocol versions a profile may require, named as they
 * appear in {@code minTLSVersion} of an {@code APIServer} resource.
 */
public enum TlsVersion {
    TLS_1_0("VersionTLS10"),
    TLS_1_1("VersionTLS11"),
    TLS_1_2("VersionTLS12"),
    TLS_1_3("VersionTLS13");

    private final String value;

    TlsVersion(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * @param value The name used in the resource, e.g. {@code VersionTLS12}.
     * @return The matching version, or empty if the name is not recognised.
     */
    public static Optional<TlsVersion> fromValue(String value) {
        return Arrays.stream(values())
                .filter(version -> version.value.equals(value))
                .findFirst();
    }

    @Override
    public String toString() {
        return value;
    }
}
