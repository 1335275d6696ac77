/*
 * Copyright TLS Profile Watcher Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.tlsprofile.kubernetes.operator;

/**
 * A problem which prevents the operator from starting up, such as
 * being unable to determine the TLS profile in effect at startup.
 */
public class OperatorConfigurationException extends RuntimeException {
    public OperatorConfigurationException(String msg) {
        super(msg);
    }

    public OperatorConfigurationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
