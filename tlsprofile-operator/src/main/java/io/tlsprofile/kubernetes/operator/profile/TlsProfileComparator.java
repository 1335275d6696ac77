/*
 * Copyright TLS Profile Watcher Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.tlsprofile.kubernetes.operator.profile;

import java.util.List;

/**
 * Decides whether two resolved profiles describe the same effective TLS settings.
 * This is the only place that decides whether a profile has really changed:
 * a {@code Custom} profile whose fields match a preset is equal to that preset.
 */
public final class TlsProfileComparator {

    private TlsProfileComparator() {
    }

    /**
     * @param a A resolved profile.
     * @param b Another resolved profile.
     * @return true iff both have the same minimum version and the same ciphers in the same order.
     */
    public static boolean equal(TlsProfileSpec a, TlsProfileSpec b) {
        if (a == b) {
            return true;
        }
        if (a.minTlsVersion() != b.minTlsVersion()) {
            return false;
        }
        return sameCiphersInOrder(a.ciphers(), b.ciphers());
    }

    // cipher order is negotiation priority, so it is significant
    private static boolean sameCiphersInOrder(List<String> a, List<String> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!a.get(i).equals(b.get(i))) {
                return false;
            }
        }
        return true;
    }
}
