/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.csr;

import com.salesforce.certreq.model.KeyAlgorithm;
import com.salesforce.certreq.model.PrivateKeyOptions;

/**
 * Signature algorithms used to self-sign a CSR, each bound to the key algorithm it requires
 */
public enum CsrSignatureAlgorithm {
    SHA256_WITH_ECDSA(KeyAlgorithm.ECDSA, "SHA256WITHECDSA"), SHA256_WITH_RSA(KeyAlgorithm.RSA, "SHA256WITHRSA"),
    SHA384_WITH_ECDSA(KeyAlgorithm.ECDSA, "SHA384WITHECDSA"), SHA384_WITH_RSA(KeyAlgorithm.RSA, "SHA384WITHRSA"),
    SHA512_WITH_ECDSA(KeyAlgorithm.ECDSA, "SHA512WITHECDSA"), SHA512_WITH_RSA(KeyAlgorithm.RSA, "SHA512WITHRSA");

    /**
     * Select the signature algorithm for the requested key: the digest strength grows with the key size.
     */
    public static CsrSignatureAlgorithm forKey(PrivateKeyOptions key) {
        switch (key.algorithm()) {
        case RSA:
            if (key.size() >= 4096) {
                return SHA512_WITH_RSA;
            }
            if (key.size() >= 3072) {
                return SHA384_WITH_RSA;
            }
            return SHA256_WITH_RSA;
        case ECDSA:
            if (key.size() == 521) {
                return SHA512_WITH_ECDSA;
            }
            if (key.size() == 384) {
                return SHA384_WITH_ECDSA;
            }
            return SHA256_WITH_ECDSA;
        default:
            throw new IllegalArgumentException("Unknown key algorithm: " + key.algorithm());
        }
    }

    private final String       jcaName;
    private final KeyAlgorithm keyAlgorithm;

    private CsrSignatureAlgorithm(KeyAlgorithm keyAlgorithm, String jcaName) {
        this.keyAlgorithm = keyAlgorithm;
        this.jcaName = jcaName;
    }

    public String jcaName() {
        return jcaName;
    }

    public KeyAlgorithm keyAlgorithm() {
        return keyAlgorithm;
    }
}
