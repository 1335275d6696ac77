/*
 * Copyright TLS Profile Watcher Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.tlsprofile.kubernetes.operator.profile;

import java.util.List;
import java.util.Objects;

/**
 * A resolved TLS profile: the form used for every equality decision,
 * whatever selector it was produced from.
 * @param ciphers The ciphers, in negotiation priority order.
 * @param minTlsVersion The minimum protocol version.
 */
public record TlsProfileSpec(List<String> ciphers, TlsVersion minTlsVersion) {

    public TlsProfileSpec {
        ciphers = List.copyOf(Objects.requireNonNull(ciphers, "ciphers"));
        Objects.requireNonNull(minTlsVersion, "minTlsVersion");
    }

    public static TlsProfileSpec of(TlsVersion minTlsVersion, String... ciphers) {
        return new TlsProfileSpec(List.of(ciphers), minTlsVersion);
    }
}
