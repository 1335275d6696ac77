/*
 * Copyright TLS Profile Watcher Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.tlsprofile.kubernetes.operator.profile;

/**
 * A {@code tlsSecurityProfile} which cannot be resolved to TLS settings.
 * Reconciliation fails and is retried; the watcher's known profile is left as it was.
 */
public class ProfileResolutionException extends RuntimeException {

    public enum Kind {
        /** The {@code type} is not one of the known presets nor {@code Custom}. */
        UNKNOWN_PRESET,
        /** The {@code type} is {@code Custom} but no {@code custom} block is present. */
        MISSING_CUSTOM_PROFILE,
        /** The custom {@code minTLSVersion} is missing or not a known version. */
        UNKNOWN_TLS_VERSION,
        /** The custom {@code ciphers} list contains a missing entry. */
        INVALID_CIPHER
    }

    private final Kind kind;

    public ProfileResolutionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
