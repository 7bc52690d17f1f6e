/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.csr.ext;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyPurposeId;

import com.salesforce.certreq.model.KeyUsage;

public class ExtKeyUsageExtension extends CertExtension {
    private static final KeyPurposeId MICROSOFT_SGC = KeyPurposeId.getInstance(
    new ASN1ObjectIdentifier("1.3.6.1.4.1.311.10.3.3"));
    private static final KeyPurposeId NETSCAPE_SGC  = KeyPurposeId.getInstance(
    new ASN1ObjectIdentifier("2.16.840.1.113730.4.1"));

    public static ExtKeyUsageExtension create(final KeyPurposeId... purposes) {
        return new ExtKeyUsageExtension(purposes);
    }

    /**
     * @return the extended key purpose of the usage, or null if the usage is a plain key usage bit
     */
    public static KeyPurposeId purposeOf(final KeyUsage usage) {
        switch (usage) {
        case ANY:
            return KeyPurposeId.anyExtendedKeyUsage;
        case SERVER_AUTH:
            return KeyPurposeId.id_kp_serverAuth;
        case CLIENT_AUTH:
            return KeyPurposeId.id_kp_clientAuth;
        case CODE_SIGNING:
            return KeyPurposeId.id_kp_codeSigning;
        case EMAIL_PROTECTION:
        case SMIME:
            return KeyPurposeId.id_kp_emailProtection;
        case IPSEC_END_SYSTEM:
            return KeyPurposeId.id_kp_ipsecEndSystem;
        case IPSEC_TUNNEL:
            return KeyPurposeId.id_kp_ipsecTunnel;
        case IPSEC_USER:
            return KeyPurposeId.id_kp_ipsecUser;
        case TIMESTAMPING:
            return KeyPurposeId.id_kp_timeStamping;
        case OCSP_SIGNING:
            return KeyPurposeId.id_kp_OCSPSigning;
        case MICROSOFT_SGC:
            return MICROSOFT_SGC;
        case NETSCAPE_SGC:
            return NETSCAPE_SGC;
        default:
            return null;
        }
    }

    /**
     * @return the distinct extended purposes of the usages, in request order
     */
    public static KeyPurposeId[] purposesOf(final Collection<KeyUsage> usages) {
        final Set<KeyPurposeId> purposes = new LinkedHashSet<>();
        for (final KeyUsage usage : usages) {
            final KeyPurposeId purpose = purposeOf(usage);
            if (purpose != null) {
                purposes.add(purpose);
            }
        }
        return purposes.toArray(new KeyPurposeId[purposes.size()]);
    }

    ExtKeyUsageExtension(final KeyPurposeId[] purposes) {
        super(Extension.extendedKeyUsage, false, new ExtendedKeyUsage(purposes));
    }
}
