/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.model;

/**
 * Wire format of the textual private key block
 */
public enum KeyEncoding {
    /**
     * {@code RSA PRIVATE KEY} for RSA keys, {@code EC PRIVATE KEY} (SEC 1) for elliptic curve keys
     */
    PKCS1,
    /**
     * {@code PRIVATE KEY}
     */
    PKCS8;

    public static KeyEncoding fromWireName(String name) {
        for (KeyEncoding encoding : values()) {
            if (encoding.name().equalsIgnoreCase(name)) {
                return encoding;
            }
        }
        throw new IssuanceException(IssuanceException.Failure.UNSUPPORTED_ENCODING,
                                    "unsupported private key encoding: " + name);
    }
}
