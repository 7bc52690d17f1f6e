/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.csr;

import java.util.List;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;

import com.salesforce.certreq.model.Subject;

/**
 * Builds the subject distinguished name. RDNs are emitted in the order C, ST, L, STREET, postalCode, O, OU, CN,
 * serialNumber; empty attribute values are skipped.
 */
class SubjectDnBuilder {
    private final X500NameBuilder builder = new X500NameBuilder(BCStyle.INSTANCE);

    SubjectDnBuilder add(final ASN1ObjectIdentifier type, final List<String> values) {
        values.forEach(v -> add(type, v));
        return this;
    }

    SubjectDnBuilder add(final ASN1ObjectIdentifier type, final String value) {
        if (value != null && !value.isEmpty()) {
            builder.addRDN(type, value);
        }
        return this;
    }

    SubjectDnBuilder addAll(final Subject subject) {
        return add(BCStyle.C, subject.countries()).add(BCStyle.ST, subject.provinces())
                                                  .add(BCStyle.L, subject.localities())
                                                  .add(BCStyle.STREET, subject.streetAddresses())
                                                  .add(BCStyle.POSTAL_CODE, subject.postalCodes())
                                                  .add(BCStyle.O, subject.organizations())
                                                  .add(BCStyle.OU, subject.organizationalUnits())
                                                  .add(BCStyle.CN, subject.commonName())
                                                  .add(BCStyle.SERIALNUMBER, subject.serialNumber());
    }

    X500Name build() {
        return builder.build();
    }
}
