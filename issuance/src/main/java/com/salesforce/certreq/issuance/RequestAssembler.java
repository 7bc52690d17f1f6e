/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.issuance;

import java.util.LinkedHashMap;
import java.util.Map;

import com.salesforce.certreq.csr.SignedCsr;
import com.salesforce.certreq.model.CertificateSpec;

/**
 * Merges a spec, its request name and its signed CSR into an {@link IssuanceRequest}. The secret name and
 * certificate name annotations are always injected and take precedence over annotations of the same key on the
 * spec.
 */
public class RequestAssembler {
    private final String certificateNameAnnotation;
    private final String secretNameAnnotation;

    public RequestAssembler(Parameters parameters) {
        this.secretNameAnnotation = parameters.secretNameAnnotation();
        this.certificateNameAnnotation = parameters.certificateNameAnnotation();
    }

    public IssuanceRequest assemble(CertificateSpec spec, String requestName, SignedCsr csr) {
        final Map<String, String> annotations = new LinkedHashMap<>(spec.annotations());
        annotations.put(secretNameAnnotation, spec.secretName());
        annotations.put(certificateNameAnnotation, spec.name());
        return new IssuanceRequest(requestName, spec.name() + "-", annotations, spec.labels(), csr.pemBytes(),
                                   spec.duration(), spec.issuerRef(), spec.isCA(), spec.usages());
    }
}
