/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.model;

/**
 * Private key algorithms that may be requested for a certificate
 */
public enum KeyAlgorithm {

    ECDSA {
        @Override
        public String jcaName() {
            return "EC";
        }

        @Override
        public boolean supports(int keySize) {
            return keySize == 256 || keySize == 384 || keySize == 521;
        }

        @Override
        public String wireName() {
            return "ecdsa";
        }
    },

    RSA {
        @Override
        public String jcaName() {
            return "RSA";
        }

        @Override
        public boolean supports(int keySize) {
            return keySize >= MIN_RSA_KEY_SIZE && keySize <= MAX_RSA_KEY_SIZE;
        }

        @Override
        public String wireName() {
            return "rsa";
        }
    };

    public static final int MAX_RSA_KEY_SIZE = 8192;
    public static final int MIN_RSA_KEY_SIZE = 2048;

    public static KeyAlgorithm fromWireName(String name) {
        for (KeyAlgorithm algorithm : values()) {
            if (algorithm.wireName().equalsIgnoreCase(name)) {
                return algorithm;
            }
        }
        throw new IssuanceException(IssuanceException.Failure.UNSUPPORTED_ALGORITHM,
                                    "unsupported private key algorithm: " + name);
    }

    /**
     * @return the JCA key algorithm name used for key factories and generators
     */
    public abstract String jcaName();

    public abstract boolean supports(int keySize);

    public abstract String wireName();
}
