/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.csr;

import java.util.ArrayList;
import java.util.List;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.KeyPurposeId;

import com.salesforce.certreq.csr.ext.BasicConstraintsExtension;
import com.salesforce.certreq.csr.ext.CertExtension;
import com.salesforce.certreq.csr.ext.ExtKeyUsageExtension;
import com.salesforce.certreq.csr.ext.KeyUsageExtension;
import com.salesforce.certreq.csr.ext.SubjectAltNameExtension;
import com.salesforce.certreq.model.CertificateSpec;
import com.salesforce.certreq.model.IssuanceException;
import com.salesforce.certreq.model.IssuanceException.Failure;
import com.salesforce.certreq.model.KeyUsage;

/**
 * Translates a certificate spec into the unsigned content of its CSR. Works strictly from the spec.
 */
public class CsrBuilder {

    /**
     * @throws IssuanceException {@link Failure#INVALID_SPEC} if the spec names neither a common name nor a DNS, URI
     *                           or email alternative name, or if an alternative name is malformed
     */
    public CsrTemplate build(CertificateSpec spec) {
        if (spec.commonName().isEmpty() && spec.dnsNames().isEmpty() && spec.uris().isEmpty()
        && spec.emailAddresses().isEmpty()) {
            throw new IssuanceException(Failure.INVALID_SPEC,
                                        "no common name, DNS name, URI SAN, or Email SAN specified on certificate: "
                                        + spec.name());
        }
        final X500Name subject = new SubjectDnBuilder().addAll(spec.subject()).build();
        final List<CertExtension> extensions = new ArrayList<>();

        final SubjectAltNameExtension sans = SubjectAltNameExtension.create(spec, subject.getRDNs().length == 0);
        if (sans != null) {
            extensions.add(sans);
        }

        final List<KeyUsage> usages = spec.usages().isEmpty() ? KeyUsageExtension.DEFAULT_USAGES : spec.usages();
        final int keyUsage = KeyUsageExtension.bitsOf(usages, spec.isCA());
        if (keyUsage != 0) {
            extensions.add(KeyUsageExtension.create(keyUsage));
        }
        final KeyPurposeId[] purposes = ExtKeyUsageExtension.purposesOf(usages);
        if (purposes.length != 0) {
            extensions.add(ExtKeyUsageExtension.create(purposes));
        }
        if (spec.isCA()) {
            extensions.add(BasicConstraintsExtension.certificateAuthority());
        }

        return new CsrTemplate(subject, extensions, spec.privateKey().algorithm(),
                               CsrSignatureAlgorithm.forKey(spec.privateKey()));
    }
}
