/*
 * Copyright TLS Profile Watcher Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.tlsprofile.kubernetes.operator.profile;

import java.util.List;
import java.util.Objects;

import io.fabric8.openshift.api.model.config.v1.CustomTLSProfile;
import io.fabric8.openshift.api.model.config.v1.TLSSecurityProfile;

import edu.umd.cs.findbugs.annotations.Nullable;

import static io.tlsprofile.kubernetes.operator.profile.ProfileResolutionException.Kind.INVALID_CIPHER;
import static io.tlsprofile.kubernetes.operator.profile.ProfileResolutionException.Kind.MISSING_CUSTOM_PROFILE;
import static io.tlsprofile.kubernetes.operator.profile.ProfileResolutionException.Kind.UNKNOWN_PRESET;
import static io.tlsprofile.kubernetes.operator.profile.ProfileResolutionException.Kind.UNKNOWN_TLS_VERSION;

/**
 * Resolves the {@code tlsSecurityProfile} of an {@code APIServer} to the
 * {@link TlsProfileSpec} it stands for.
 */
public final class TlsProfileResolver {

    private TlsProfileResolver() {
    }

    /**
     * Resolves a profile selector.
     * <ul>
     *     <li>An absent selector, or one without a {@code type}, resolves to the {@link TlsProfileType#DEFAULT} preset.</li>
     *     <li>A preset {@code type} resolves to that preset's settings.</li>
     *     <li>{@code Custom} resolves to the settings of its {@code custom} block, with cipher order preserved.</li>
     * </ul>
     * @param selector The selector, possibly null.
     * @return The resolved profile.
     * @throws ProfileResolutionException If the selector names an unknown preset, or a custom profile is incomplete.
     */
    public static TlsProfileSpec resolve(@Nullable TLSSecurityProfile selector) {
        if (selector == null || selector.getType() == null || selector.getType().isEmpty()) {
            return TlsProfileType.DEFAULT.spec();
        }
        String type = selector.getType();
        if (TlsProfileType.CUSTOM.equals(type)) {
            return resolveCustom(selector.getCustom());
        }
        return TlsProfileType.fromValue(type)
                .map(TlsProfileType::spec)
                .orElseThrow(() -> new ProfileResolutionException(UNKNOWN_PRESET, "Unknown TLS security profile type '" + type + "'"));
    }

    private static TlsProfileSpec resolveCustom(@Nullable CustomTLSProfile custom) {
        if (custom == null) {
            throw new ProfileResolutionException(MISSING_CUSTOM_PROFILE,
                    "TLS security profile type is '" + TlsProfileType.CUSTOM + "' but no custom profile is given");
        }
        String minTlsVersion = custom.getMinTLSVersion();
        TlsVersion version = TlsVersion.fromValue(minTlsVersion)
                .orElseThrow(() -> new ProfileResolutionException(UNKNOWN_TLS_VERSION,
                        "Custom TLS security profile has unknown minTLSVersion '" + minTlsVersion + "'"));
        List<String> ciphers = custom.getCiphers() == null ? List.of() : custom.getCiphers();
        if (ciphers.stream().anyMatch(Objects::isNull)) {
            throw new ProfileResolutionException(INVALID_CIPHER, "Custom TLS security profile has a null entry in its ciphers");
        }
        return new TlsProfileSpec(ciphers, version);
    }
}
