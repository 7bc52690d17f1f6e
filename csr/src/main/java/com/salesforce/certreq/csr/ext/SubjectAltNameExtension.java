/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.csr.ext;

import java.util.ArrayList;
import java.util.List;

import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;

import com.salesforce.certreq.model.CertificateSpec;

/**
 * Subject alternative names. Critical when the subject DN is empty (RFC 5280, 4.2.1.6).
 */
public class SubjectAltNameExtension extends CertExtension {

    /**
     * @return the SAN extension of the spec, or null if the spec requests no alternative names
     */
    public static SubjectAltNameExtension create(final CertificateSpec spec, final boolean emptySubject) {
        final List<GeneralName> names = new ArrayList<>();
        spec.dnsNames().forEach(n -> names.add(NameType.DNS_NAME.generalName(n)));
        spec.emailAddresses().forEach(n -> names.add(NameType.RFC_822_NAME.generalName(n)));
        spec.ipAddresses().forEach(n -> names.add(NameType.IP_ADDRESS.generalName(n)));
        spec.uris().forEach(n -> names.add(NameType.URI.generalName(n)));
        if (names.isEmpty()) {
            return null;
        }
        return new SubjectAltNameExtension(emptySubject,
                                           new GeneralNames(names.toArray(new GeneralName[names.size()])));
    }

    SubjectAltNameExtension(final boolean isCritical, final GeneralNames names) {
        super(Extension.subjectAlternativeName, isCritical, names);
    }
}
