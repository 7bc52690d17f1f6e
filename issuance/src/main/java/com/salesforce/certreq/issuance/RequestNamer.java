/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.issuance;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

import org.bouncycastle.util.encoders.Hex;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.salesforce.certreq.model.CertificateSpec;
import com.salesforce.certreq.model.IssuanceException;
import com.salesforce.certreq.model.IssuanceException.Failure;
import com.salesforce.certreq.model.KeyUsage;
import com.salesforce.certreq.model.Subject;

/**
 * Derives the deterministic request name of a certificate spec:
 * {@code <name, truncated>-<hex prefix of the SHA-256 of the canonical spec>}.
 * <p>
 * The canonical form is a JSON object with a fixed member order covering every field that shapes the issued
 * certificate. The name, labels and annotations do not take part in the hash.
 */
public class RequestNamer {
    private static final String HASH_ALGORITHM = "SHA-256";

    private final int          hashLength;
    private final ObjectMapper mapper = new ObjectMapper();
    private final int          maxNamePrefix;

    public RequestNamer(Parameters parameters) {
        this.maxNamePrefix = parameters.maxNamePrefix();
        this.hashLength = parameters.hashLength();
    }

    /**
     * @throws IssuanceException {@link Failure#HASHING_FAILURE} if the spec cannot be encoded or digested
     */
    public String computeName(CertificateSpec spec) {
        final byte[] digest;
        try {
            digest = MessageDigest.getInstance(HASH_ALGORITHM).digest(canonicalBytes(spec));
        } catch (NoSuchAlgorithmException e) {
            throw new IssuanceException(Failure.HASHING_FAILURE, "no " + HASH_ALGORITHM + " digest available", e);
        }
        String prefix = spec.name();
        if (prefix.length() > maxNamePrefix) {
            prefix = prefix.substring(0, maxNamePrefix);
        }
        return prefix + "-" + Hex.toHexString(digest).substring(0, hashLength);
    }

    byte[] canonicalBytes(CertificateSpec spec) {
        try {
            return mapper.writeValueAsBytes(canonical(spec));
        } catch (JsonProcessingException e) {
            throw new IssuanceException(Failure.HASHING_FAILURE, "cannot encode certificate spec: " + spec.name(), e);
        }
    }

    ObjectNode canonical(CertificateSpec spec) {
        final ObjectNode node = mapper.createObjectNode();

        final Subject subject = spec.subject();
        final ObjectNode subjectNode = node.putObject("subject");
        subjectNode.put("commonName", subject.commonName());
        strings(subjectNode.putArray("organizations"), subject.organizations());
        strings(subjectNode.putArray("organizationalUnits"), subject.organizationalUnits());
        strings(subjectNode.putArray("countries"), subject.countries());
        strings(subjectNode.putArray("provinces"), subject.provinces());
        strings(subjectNode.putArray("localities"), subject.localities());
        strings(subjectNode.putArray("streetAddresses"), subject.streetAddresses());
        strings(subjectNode.putArray("postalCodes"), subject.postalCodes());
        subjectNode.put("serialNumber", subject.serialNumber());

        strings(node.putArray("dnsNames"), spec.dnsNames());
        strings(node.putArray("ipAddresses"), spec.ipAddresses());
        strings(node.putArray("uris"), spec.uris());
        strings(node.putArray("emailAddresses"), spec.emailAddresses());
        if (spec.duration() == null) {
            node.putNull("duration");
        } else {
            node.put("duration", spec.duration().toString());
        }

        final ObjectNode issuer = node.putObject("issuerRef");
        issuer.put("name", spec.issuerRef().name());
        issuer.put("kind", spec.issuerRef().kind());
        issuer.put("group", spec.issuerRef().group());

        node.put("isCA", spec.isCA());
        final ArrayNode usages = node.putArray("usages");
        for (KeyUsage usage : spec.usages()) {
            usages.add(usage.wireName());
        }

        final ObjectNode key = node.putObject("privateKey");
        key.put("algorithm", spec.privateKey().algorithm().wireName());
        key.put("size", spec.privateKey().size());
        key.put("encoding", spec.privateKey().encoding() == null ? null : spec.privateKey().encoding().name());

        node.put("secretName", spec.secretName());
        return node;
    }

    private void strings(ArrayNode array, List<String> values) {
        values.forEach(array::add);
    }
}
