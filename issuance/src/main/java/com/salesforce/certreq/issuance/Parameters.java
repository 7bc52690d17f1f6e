/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.issuance;

import java.security.Provider;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

/**
 * Tunables of the issuance pipeline
 */
public record Parameters(int maxNamePrefix, int hashLength, String secretNameAnnotation,
                         String certificateNameAnnotation, Provider provider) {

    public static final String CERTIFICATE_NAME_ANNOTATION = "cert-manager.io/certificate-name";
    public static final String SECRET_NAME_ANNOTATION      = "cert-manager.io/private-key-secret-name";

    public static Builder newBuilder() {
        return new Builder();
    }

    public Parameters {
        if (maxNamePrefix < 1) {
            throw new IllegalArgumentException("maxNamePrefix must be positive: " + maxNamePrefix);
        }
        if (hashLength < 1 || hashLength > 64) {
            throw new IllegalArgumentException("hashLength must be in [1, 64]: " + hashLength);
        }
        if (provider == null) {
            throw new IllegalArgumentException("provider must not be null");
        }
    }

    public static class Builder {
        /**
         * Annotation naming the certificate a request was created for
         */
        private String   certificateNameAnnotation = CERTIFICATE_NAME_ANNOTATION;
        /**
         * Number of hex characters of the spec hash appended to the request name
         */
        private int      hashLength                = 10;
        /**
         * Longest readable prefix of the certificate name kept in the request name
         */
        private int      maxNamePrefix             = 52;
        /**
         * JCA provider for key generation, encoding and signing. Never registered globally.
         */
        private Provider provider                  = new BouncyCastleProvider();
        /**
         * Annotation naming the secret the private key is destined for
         */
        private String   secretNameAnnotation      = SECRET_NAME_ANNOTATION;

        public Parameters build() {
            return new Parameters(maxNamePrefix, hashLength, secretNameAnnotation, certificateNameAnnotation,
                                  provider);
        }

        public String getCertificateNameAnnotation() {
            return certificateNameAnnotation;
        }

        public int getHashLength() {
            return hashLength;
        }

        public int getMaxNamePrefix() {
            return maxNamePrefix;
        }

        public Provider getProvider() {
            return provider;
        }

        public String getSecretNameAnnotation() {
            return secretNameAnnotation;
        }

        public Builder setCertificateNameAnnotation(String certificateNameAnnotation) {
            this.certificateNameAnnotation = certificateNameAnnotation;
            return this;
        }

        public Builder setHashLength(int hashLength) {
            this.hashLength = hashLength;
            return this;
        }

        public Builder setMaxNamePrefix(int maxNamePrefix) {
            this.maxNamePrefix = maxNamePrefix;
            return this;
        }

        public Builder setProvider(Provider provider) {
            this.provider = provider;
            return this;
        }

        public Builder setSecretNameAnnotation(String secretNameAnnotation) {
            this.secretNameAnnotation = secretNameAnnotation;
            return this;
        }
    }
}
