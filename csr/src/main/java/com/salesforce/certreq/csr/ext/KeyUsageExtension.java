/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.csr.ext;

import java.util.Collection;
import java.util.List;

import org.bouncycastle.asn1.x509.Extension;

import com.salesforce.certreq.model.KeyUsage;

/**
 * The critical key usage extension. Usages without a key usage bit (the extended purposes) contribute nothing.
 */
public class KeyUsageExtension extends CertExtension {

    /**
     * Requested when a certificate spec lists no usages at all
     */
    public static final List<KeyUsage> DEFAULT_USAGES = List.of(KeyUsage.DIGITAL_SIGNATURE,
                                                                KeyUsage.KEY_ENCIPHERMENT);

    public static int bitOf(final KeyUsage usage) {
        switch (usage) {
        case SIGNING:
        case DIGITAL_SIGNATURE:
            return org.bouncycastle.asn1.x509.KeyUsage.digitalSignature;
        case CONTENT_COMMITMENT:
            return org.bouncycastle.asn1.x509.KeyUsage.nonRepudiation;
        case KEY_ENCIPHERMENT:
            return org.bouncycastle.asn1.x509.KeyUsage.keyEncipherment;
        case KEY_AGREEMENT:
            return org.bouncycastle.asn1.x509.KeyUsage.keyAgreement;
        case DATA_ENCIPHERMENT:
            return org.bouncycastle.asn1.x509.KeyUsage.dataEncipherment;
        case CERT_SIGN:
            return org.bouncycastle.asn1.x509.KeyUsage.keyCertSign;
        case CRL_SIGN:
            return org.bouncycastle.asn1.x509.KeyUsage.cRLSign;
        case ENCIPHER_ONLY:
            return org.bouncycastle.asn1.x509.KeyUsage.encipherOnly;
        case DECIPHER_ONLY:
            return org.bouncycastle.asn1.x509.KeyUsage.decipherOnly;
        default:
            return 0;
        }
    }

    /**
     * @return the combined key usage bits, including {@code keyCertSign} for a CA
     */
    public static int bitsOf(final Collection<KeyUsage> usages, final boolean isCA) {
        int bits = isCA ? org.bouncycastle.asn1.x509.KeyUsage.keyCertSign : 0;
        for (final KeyUsage usage : usages) {
            bits |= bitOf(usage);
        }
        return bits;
    }

    public static KeyUsageExtension create(final int bits) {
        return new KeyUsageExtension(bits);
    }

    KeyUsageExtension(final int bits) {
        super(Extension.keyUsage, true, new org.bouncycastle.asn1.x509.KeyUsage(bits));
    }
}
