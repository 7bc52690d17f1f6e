/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.csr;

import static java.util.Objects.requireNonNull;

import java.util.List;

import org.bouncycastle.asn1.x500.X500Name;

import com.salesforce.certreq.csr.ext.CertExtension;
import com.salesforce.certreq.model.KeyAlgorithm;

/**
 * The unsigned content of a certificate signing request: the subject, the extensions to request and the algorithms
 * the signing key must match. Holds no key material.
 */
public record CsrTemplate(X500Name subject, List<CertExtension> extensions, KeyAlgorithm keyAlgorithm,
                          CsrSignatureAlgorithm signatureAlgorithm) {

    public CsrTemplate {
        requireNonNull(subject, "subject");
        requireNonNull(keyAlgorithm, "keyAlgorithm");
        requireNonNull(signatureAlgorithm, "signatureAlgorithm");
        extensions = List.copyOf(extensions);
        if (signatureAlgorithm.keyAlgorithm() != keyAlgorithm) {
            throw new IllegalArgumentException(String.format("Signature algorithm %s cannot sign with a %s key",
                                                             signatureAlgorithm, keyAlgorithm));
        }
    }
}
