/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.csr;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.Provider;
import java.security.PublicKey;
import java.util.Arrays;

import org.bouncycastle.asn1.pkcs.Attribute;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x500.style.IETFUtils;
import org.bouncycastle.asn1.x509.Extensions;
import org.bouncycastle.openssl.PEMException;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;

import com.salesforce.certreq.cryptography.Pem;

/**
 * A signed PKCS#10 certificate signing request, immutable once produced
 */
public class SignedCsr {
    public static final String PEM_LABEL = "CERTIFICATE REQUEST";

    public static SignedCsr fromDer(byte[] der) {
        try {
            return new SignedCsr(new PKCS10CertificationRequest(der));
        } catch (IOException e) {
            throw new IllegalArgumentException("Not a PKCS#10 certification request", e);
        }
    }

    public static SignedCsr fromPem(String pem) {
        return fromDer(Pem.decode(PEM_LABEL, pem));
    }

    private final byte[]                     der;
    private final PKCS10CertificationRequest request;

    SignedCsr(PKCS10CertificationRequest request) {
        this.request = request;
        try {
            this.der = request.getEncoded();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * @return the first common name of the subject, or the empty string
     */
    public String commonName() {
        RDN[] cns = subject().getRDNs(BCStyle.CN);
        return cns.length == 0 ? "" : IETFUtils.valueToString(cns[0].getFirst().getValue());
    }

    public byte[] der() {
        return der.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SignedCsr)) {
            return false;
        }
        return Arrays.equals(der, ((SignedCsr) obj).der);
    }

    /**
     * @return the requested extensions, or null if the request carries none
     */
    public Extensions extensions() {
        Attribute[] attributes = request.getAttributes(PKCSObjectIdentifiers.pkcs_9_at_extensionRequest);
        if (attributes.length == 0) {
            return null;
        }
        return Extensions.getInstance(attributes[0].getAttrValues().getObjectAt(0));
    }

    public PKCS10CertificationRequest getBcCsr() {
        return request;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(der);
    }

    public String pem() {
        return Pem.encode(PEM_LABEL, der);
    }

    public byte[] pemBytes() {
        return pem().getBytes(StandardCharsets.US_ASCII);
    }

    public PublicKey publicKey(Provider provider) {
        try {
            return new JcaPEMKeyConverter().setProvider(provider).getPublicKey(request.getSubjectPublicKeyInfo());
        } catch (PEMException e) {
            throw new IllegalStateException("Cannot decode subject public key", e);
        }
    }

    public X500Name subject() {
        return request.getSubject();
    }

    @Override
    public String toString() {
        return "SignedCsr[" + subject() + "]";
    }
}
