/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.ctl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.salesforce.certreq.model.CertificateSpec;
import com.salesforce.certreq.model.IssuanceException;
import com.salesforce.certreq.model.IssuanceException.Failure;
import com.salesforce.certreq.model.IssuerReference;
import com.salesforce.certreq.model.KeyAlgorithm;
import com.salesforce.certreq.model.KeyEncoding;
import com.salesforce.certreq.model.KeyUsage;
import com.salesforce.certreq.model.PrivateKeyOptions;
import com.salesforce.certreq.model.Subject;

/**
 * The supported API versions of certificate manifests, each with its conversion of the manifest's {@code spec}
 * block. Absent key sizes and encodings are defaulted from the configuration here.
 */
public enum ApiVersion {
    V1("cert-manager.io/v1") {
        @Override
        CertificateSpec.Builder convert(JsonNode spec, CtlConfiguration configuration) {
            final JsonNode subject = spec.path("subject");
            final JsonNode key = spec.path("privateKey");
            return common(spec).setSubject(subject(spec, subject).setOrganizations(strings(subject, "organizations"))
                                                                 .build())
                               .setUris(strings(spec, "uris"))
                               .setEmailAddresses(strings(spec, "emailAddresses"))
                               .setPrivateKey(privateKey(text(key, "algorithm"), key.path("size").asInt(0),
                                                         text(key, "encoding"), configuration));
        }
    },
    V1ALPHA2("cert-manager.io/v1alpha2") {
        @Override
        CertificateSpec.Builder convert(JsonNode spec, CtlConfiguration configuration) {
            final Subject subject = subject(spec, spec.path("subject")).setOrganizations(strings(spec, "organization"))
                                                                       .build();
            return common(spec).setSubject(subject)
                               .setUris(strings(spec, "uriSANs"))
                               .setEmailAddresses(strings(spec, "emailSANs"))
                               .setPrivateKey(privateKey(text(spec, "keyAlgorithm"), spec.path("keySize").asInt(0),
                                                         text(spec, "keyEncoding"), configuration));
        }
    };

    public static ApiVersion fromString(String apiVersion) {
        for (ApiVersion version : values()) {
            if (version.apiVersion.equals(apiVersion)) {
                return version;
            }
        }
        throw new IssuanceException(Failure.MALFORMED_MANIFEST, "unsupported apiVersion: " + apiVersion);
    }

    private static CertificateSpec.Builder common(JsonNode spec) {
        final JsonNode issuer = spec.path("issuerRef");
        final String issuerName = text(issuer, "name");
        if (issuerName.isEmpty()) {
            throw new IssuanceException(Failure.MALFORMED_MANIFEST, "spec.issuerRef.name is required");
        }
        final List<KeyUsage> usages = new ArrayList<>();
        for (String usage : strings(spec, "usages")) {
            usages.add(KeyUsage.fromWireName(usage));
        }
        return CertificateSpec.newBuilder()
                              .setSecretName(text(spec, "secretName"))
                              .setDnsNames(strings(spec, "dnsNames"))
                              .setIpAddresses(strings(spec, "ipAddresses"))
                              .setDuration(Durations.parse(text(spec, "duration")))
                              .setIssuerRef(new IssuerReference(issuerName, text(issuer, "kind"),
                                                                text(issuer, "group")))
                              .setIsCA(spec.path("isCA").asBoolean(false))
                              .setUsages(usages);
    }

    private static PrivateKeyOptions privateKey(String algorithm, int size, String encoding,
                                                CtlConfiguration configuration) {
        final KeyAlgorithm keyAlgorithm = algorithm.isEmpty() ? KeyAlgorithm.RSA
                                                              : KeyAlgorithm.fromWireName(algorithm);
        int keySize = size;
        if (keySize == 0) {
            keySize = keyAlgorithm == KeyAlgorithm.RSA ? configuration.defaultRsaKeySize
                                                       : configuration.defaultEcdsaKeySize;
        }
        final KeyEncoding keyEncoding = encoding.isEmpty() ? configuration.defaultKeyEncoding
                                                           : KeyEncoding.fromWireName(encoding);
        return new PrivateKeyOptions(keyAlgorithm, keySize, keyEncoding);
    }

    static List<String> strings(JsonNode node, String field) {
        final JsonNode values = node.path(field);
        if (values.isMissingNode() || values.isNull()) {
            return Collections.emptyList();
        }
        if (!values.isArray()) {
            throw new IssuanceException(Failure.MALFORMED_MANIFEST, field + " must be a list");
        }
        final List<String> result = new ArrayList<>();
        values.forEach(v -> result.add(v.asText()));
        return result;
    }

    private static Subject.Builder subject(JsonNode spec, JsonNode subject) {
        return Subject.newBuilder()
                      .setCommonName(text(spec, "commonName"))
                      .setOrganizationalUnits(strings(subject, "organizationalUnits"))
                      .setCountries(strings(subject, "countries"))
                      .setProvinces(strings(subject, "provinces"))
                      .setLocalities(strings(subject, "localities"))
                      .setStreetAddresses(strings(subject, "streetAddresses"))
                      .setPostalCodes(strings(subject, "postalCodes"))
                      .setSerialNumber(text(subject, "serialNumber"));
    }

    static String text(JsonNode node, String field) {
        final JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return "";
        }
        if (!value.isValueNode()) {
            throw new IssuanceException(Failure.MALFORMED_MANIFEST, field + " must be a scalar");
        }
        return value.asText();
    }

    private final String apiVersion;

    ApiVersion(String apiVersion) {
        this.apiVersion = apiVersion;
    }

    public String apiVersion() {
        return apiVersion;
    }

    /**
     * @return a builder holding everything of the manifest's spec block; metadata is left to the caller
     */
    abstract CertificateSpec.Builder convert(JsonNode spec, CtlConfiguration configuration);
}
