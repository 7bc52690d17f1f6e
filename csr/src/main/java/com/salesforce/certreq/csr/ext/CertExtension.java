/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.csr.ext;

import java.io.IOException;

import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x509.ExtensionsGenerator;

/**
 * An X.509 extension requested through the CSR's extension request attribute
 */
public class CertExtension {
    private final boolean              isCritical;
    private final ASN1ObjectIdentifier oid;
    private final ASN1Encodable        value;

    public CertExtension(final ASN1ObjectIdentifier oid, final boolean isCritical, final ASN1Encodable value) {
        this.oid = oid;
        this.isCritical = isCritical;
        this.value = value;
    }

    public void addTo(ExtensionsGenerator generator) throws IOException {
        generator.addExtension(oid, isCritical, value);
    }

    public ASN1ObjectIdentifier getOid() {
        return oid;
    }

    public ASN1Encodable getValue() {
        return value;
    }

    public boolean isCritical() {
        return isCritical;
    }

    @Override
    public String toString() {
        return "Extension [" + oid + (isCritical ? "!" : "") + "=" + value + "]";
    }
}
