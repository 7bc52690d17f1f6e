/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.model;

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.salesforce.certreq.model.IssuanceException.Failure;

/**
 * The desired certificate: who it is for, which key backs it, what it may be used for and who should issue it. Name,
 * labels and annotations are administrative metadata; everything else shapes the issued certificate.
 * <p>
 * Instances are immutable and fully resolved; any defaulting happens before a spec is built.
 */
public record CertificateSpec(String name, String secretName, Map<String, String> labels,
                              Map<String, String> annotations, Subject subject, List<String> dnsNames,
                              List<String> ipAddresses, List<String> uris, List<String> emailAddresses,
                              Duration duration, IssuerReference issuerRef, boolean isCA, List<KeyUsage> usages,
                              PrivateKeyOptions privateKey) {

    public static Builder newBuilder() {
        return new Builder();
    }

    public CertificateSpec {
        if (name == null || name.isBlank()) {
            throw new IssuanceException(Failure.INVALID_SPEC, "certificate name must not be empty");
        }
        requireNonNull(issuerRef, "issuerRef");
        requireNonNull(privateKey, "privateKey");
        secretName = secretName == null ? "" : secretName;
        subject = subject == null ? Subject.EMPTY : subject;
        labels = labels == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        annotations = annotations == null ? Collections.emptyMap()
                                          : Collections.unmodifiableMap(new LinkedHashMap<>(annotations));
        dnsNames = copy(dnsNames);
        ipAddresses = copy(ipAddresses);
        uris = copy(uris);
        emailAddresses = copy(emailAddresses);
        usages = usages == null ? Collections.emptyList() : List.copyOf(usages);
    }

    private static List<String> copy(List<String> values) {
        return values == null ? Collections.emptyList() : List.copyOf(values);
    }

    public String commonName() {
        return subject.commonName();
    }

    public boolean hasSubjectAlternativeNames() {
        return !dnsNames.isEmpty() || !ipAddresses.isEmpty() || !uris.isEmpty() || !emailAddresses.isEmpty();
    }

    public Builder toBuilder() {
        return newBuilder().setName(name)
                           .setSecretName(secretName)
                           .setLabels(labels)
                           .setAnnotations(annotations)
                           .setSubject(subject)
                           .setDnsNames(dnsNames)
                           .setIpAddresses(ipAddresses)
                           .setUris(uris)
                           .setEmailAddresses(emailAddresses)
                           .setDuration(duration)
                           .setIssuerRef(issuerRef)
                           .setIsCA(isCA)
                           .setUsages(usages)
                           .setPrivateKey(privateKey);
    }

    public static class Builder {
        private Map<String, String> annotations    = new LinkedHashMap<>();
        private List<String>        dnsNames       = new ArrayList<>();
        /**
         * Requested validity; null leaves the choice to the issuer
         */
        private Duration            duration;
        private List<String>        emailAddresses = new ArrayList<>();
        private List<String>        ipAddresses    = new ArrayList<>();
        private boolean             isCA           = false;
        private IssuerReference     issuerRef;
        private Map<String, String> labels         = new LinkedHashMap<>();
        private String              name;
        private PrivateKeyOptions   privateKey     = PrivateKeyOptions.rsa(KeyAlgorithm.MIN_RSA_KEY_SIZE);
        private String              secretName     = "";
        private Subject             subject        = Subject.EMPTY;
        private List<String>        uris           = new ArrayList<>();
        private List<KeyUsage>      usages         = new ArrayList<>();

        public Builder addDnsName(String dnsName) {
            dnsNames.add(dnsName);
            return this;
        }

        public Builder addUsage(KeyUsage usage) {
            usages.add(usage);
            return this;
        }

        public CertificateSpec build() {
            return new CertificateSpec(name, secretName, labels, annotations, subject, dnsNames, ipAddresses, uris,
                                       emailAddresses, duration, issuerRef, isCA, usages, privateKey);
        }

        public Map<String, String> getAnnotations() {
            return annotations;
        }

        public Builder setAnnotations(Map<String, String> annotations) {
            this.annotations = new LinkedHashMap<>(annotations);
            return this;
        }

        public List<String> getDnsNames() {
            return dnsNames;
        }

        public Builder setDnsNames(List<String> dnsNames) {
            this.dnsNames = new ArrayList<>(dnsNames);
            return this;
        }

        public Duration getDuration() {
            return duration;
        }

        public Builder setDuration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public List<String> getEmailAddresses() {
            return emailAddresses;
        }

        public Builder setEmailAddresses(List<String> emailAddresses) {
            this.emailAddresses = new ArrayList<>(emailAddresses);
            return this;
        }

        public List<String> getIpAddresses() {
            return ipAddresses;
        }

        public Builder setIpAddresses(List<String> ipAddresses) {
            this.ipAddresses = new ArrayList<>(ipAddresses);
            return this;
        }

        public boolean isCA() {
            return isCA;
        }

        public Builder setIsCA(boolean isCA) {
            this.isCA = isCA;
            return this;
        }

        public IssuerReference getIssuerRef() {
            return issuerRef;
        }

        public Builder setIssuerRef(IssuerReference issuerRef) {
            this.issuerRef = issuerRef;
            return this;
        }

        public Map<String, String> getLabels() {
            return labels;
        }

        public Builder setLabels(Map<String, String> labels) {
            this.labels = new LinkedHashMap<>(labels);
            return this;
        }

        public String getName() {
            return name;
        }

        public Builder setName(String name) {
            this.name = name;
            return this;
        }

        public PrivateKeyOptions getPrivateKey() {
            return privateKey;
        }

        public Builder setPrivateKey(PrivateKeyOptions privateKey) {
            this.privateKey = privateKey;
            return this;
        }

        public String getSecretName() {
            return secretName;
        }

        public Builder setSecretName(String secretName) {
            this.secretName = secretName;
            return this;
        }

        public Subject getSubject() {
            return subject;
        }

        public Builder setSubject(Subject subject) {
            this.subject = subject;
            return this;
        }

        public List<String> getUris() {
            return uris;
        }

        public Builder setUris(List<String> uris) {
            this.uris = new ArrayList<>(uris);
            return this;
        }

        public List<KeyUsage> getUsages() {
            return usages;
        }

        public Builder setUsages(List<KeyUsage> usages) {
            this.usages = new ArrayList<>(usages);
            return this;
        }
    }
}
