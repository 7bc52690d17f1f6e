/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.model;

import static java.util.Objects.requireNonNull;

/**
 * The requested private key: algorithm, size in bits (curve size for ECDSA) and the encoding of its textual form.
 * The size is not validated here; key generation rejects sizes its algorithm does not support.
 */
public record PrivateKeyOptions(KeyAlgorithm algorithm, int size, KeyEncoding encoding) {

    public static PrivateKeyOptions ecdsa(int size) {
        return new PrivateKeyOptions(KeyAlgorithm.ECDSA, size, KeyEncoding.PKCS1);
    }

    public static PrivateKeyOptions rsa(int size) {
        return new PrivateKeyOptions(KeyAlgorithm.RSA, size, KeyEncoding.PKCS1);
    }

    public PrivateKeyOptions {
        requireNonNull(algorithm, "algorithm");
    }

    public PrivateKeyOptions withEncoding(KeyEncoding encoding) {
        return new PrivateKeyOptions(algorithm, size, encoding);
    }
}
