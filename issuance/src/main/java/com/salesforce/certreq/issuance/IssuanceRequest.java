/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.issuance;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.salesforce.certreq.model.IssuerReference;
import com.salesforce.certreq.model.KeyUsage;

/**
 * The request handed to an issuing authority: a named, annotated envelope around a PEM encoded CSR. Immutable; the
 * PEM bytes are copied in and out.
 */
public record IssuanceRequest(String requestName, String generateName, Map<String, String> annotations,
                              Map<String, String> labels, byte[] csrPem, Duration duration,
                              IssuerReference issuerRef, boolean isCA, List<KeyUsage> usages) {

    public IssuanceRequest {
        annotations = Collections.unmodifiableMap(new LinkedHashMap<>(annotations));
        labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        csrPem = csrPem.clone();
        usages = List.copyOf(usages);
    }

    @Override
    public byte[] csrPem() {
        return csrPem.clone();
    }

    public String csrPemText() {
        return new String(csrPem, StandardCharsets.US_ASCII);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof IssuanceRequest)) {
            return false;
        }
        IssuanceRequest other = (IssuanceRequest) obj;
        return isCA == other.isCA && requestName.equals(other.requestName)
        && generateName.equals(other.generateName) && annotations.equals(other.annotations)
        && labels.equals(other.labels) && Arrays.equals(csrPem, other.csrPem)
        && Objects.equals(duration, other.duration) && issuerRef.equals(other.issuerRef)
        && usages.equals(other.usages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(requestName, generateName, annotations, labels, Arrays.hashCode(csrPem), duration,
                            issuerRef, isCA, usages);
    }

    @Override
    public String toString() {
        return "IssuanceRequest[" + requestName + ", issuer=" + issuerRef.name() + ", isCA=" + isCA + ", usages="
        + usages + "]";
    }
}
