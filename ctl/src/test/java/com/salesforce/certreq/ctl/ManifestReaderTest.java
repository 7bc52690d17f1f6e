/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.ctl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.salesforce.certreq.model.CertificateSpec;
import com.salesforce.certreq.model.IssuanceException;
import com.salesforce.certreq.model.IssuanceException.Failure;
import com.salesforce.certreq.model.IssuerReference;
import com.salesforce.certreq.model.KeyAlgorithm;
import com.salesforce.certreq.model.KeyEncoding;
import com.salesforce.certreq.model.KeyUsage;
import com.salesforce.certreq.model.PrivateKeyOptions;

public class ManifestReaderTest {

    private static InputStream resource(String name) {
        return ManifestReaderTest.class.getResourceAsStream("/manifests/" + name);
    }

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private final ManifestReader reader = new ManifestReader(new CtlConfiguration());

    private Failure failureOf(String manifest) {
        return assertThrows(IssuanceException.class, () -> reader.read(yaml(manifest))).getFailure();
    }

    @Test
    public void configuredDefaults() {
        CtlConfiguration configuration = new CtlConfiguration();
        configuration.defaultRsaKeySize = 4096;
        configuration.defaultKeyEncoding = KeyEncoding.PKCS8;
        configuration.namespace = "certificates";
        Manifest manifest = new ManifestReader(configuration).read(resource("v1.yaml"));
        assertEquals("certificates", manifest.namespace());
        assertEquals(new PrivateKeyOptions(KeyAlgorithm.RSA, 4096, KeyEncoding.PKCS8), manifest.spec().privateKey());

        Manifest ecdsa = new ManifestReader(configuration).read(yaml("""
                apiVersion: cert-manager.io/v1
                kind: Certificate
                metadata:
                  name: web
                spec:
                  commonName: example.com
                  issuerRef:
                    name: ca-issuer
                  privateKey:
                    algorithm: ECDSA
                    encoding: PKCS1
                """));
        assertEquals(PrivateKeyOptions.ecdsa(256), ecdsa.spec().privateKey());
    }

    @Test
    public void invalidManifests() {
        assertEquals(Failure.MALFORMED_MANIFEST, failureOf(""));
        assertEquals(Failure.MALFORMED_MANIFEST, failureOf("- just\n- a list\n"));
        assertEquals(Failure.MALFORMED_MANIFEST, failureOf("""
                apiVersion: cert-manager.io/v1beta1
                kind: Certificate
                metadata:
                  name: web
                spec: {}
                """));
        assertEquals(Failure.MALFORMED_MANIFEST, failureOf("""
                apiVersion: cert-manager.io/v1
                kind: Issuer
                metadata:
                  name: web
                spec: {}
                """));
        assertEquals(Failure.MALFORMED_MANIFEST, failureOf("""
                apiVersion: cert-manager.io/v1
                kind: Certificate
                metadata: {}
                spec:
                  issuerRef:
                    name: ca-issuer
                """));
        assertEquals(Failure.MALFORMED_MANIFEST, failureOf("""
                apiVersion: cert-manager.io/v1
                kind: Certificate
                metadata:
                  name: web
                spec:
                  commonName: example.com
                """));
        assertEquals(Failure.MALFORMED_MANIFEST, failureOf("""
                apiVersion: cert-manager.io/v1
                kind: Certificate
                metadata:
                  name: web
                spec:
                  dnsNames: example.com
                  issuerRef:
                    name: ca-issuer
                """));
        assertEquals(Failure.MALFORMED_MANIFEST, failureOf("apiVersion: [unterminated\n"));
    }

    @Test
    public void multipleObjects() {
        var e = assertThrows(IssuanceException.class, () -> reader.read(resource("multiple.yaml")));
        assertEquals(Failure.MALFORMED_MANIFEST, e.getFailure());
        assertTrue(e.getMessage().contains("multiple objects"));
    }

    @Test
    public void unsupportedValues() {
        assertEquals(Failure.UNSUPPORTED_ALGORITHM, failureOf("""
                apiVersion: cert-manager.io/v1
                kind: Certificate
                metadata:
                  name: web
                spec:
                  commonName: example.com
                  issuerRef:
                    name: ca-issuer
                  privateKey:
                    algorithm: Ed25519
                """));
        assertEquals(Failure.UNSUPPORTED_ENCODING, failureOf("""
                apiVersion: cert-manager.io/v1alpha2
                kind: Certificate
                metadata:
                  name: web
                spec:
                  commonName: example.com
                  issuerRef:
                    name: ca-issuer
                  keyEncoding: der
                """));
        assertEquals(Failure.INVALID_SPEC, failureOf("""
                apiVersion: cert-manager.io/v1
                kind: Certificate
                metadata:
                  name: web
                spec:
                  commonName: example.com
                  issuerRef:
                    name: ca-issuer
                  usages:
                    - world domination
                """));
    }

    @Test
    public void v1() {
        Manifest manifest = reader.read(resource("v1.yaml"));
        assertEquals(ApiVersion.V1, manifest.apiVersion());
        assertEquals("default", manifest.namespace());

        CertificateSpec spec = manifest.spec();
        assertEquals("web", spec.name());
        assertTrue(spec.labels().isEmpty());
        assertEquals("example.com", spec.commonName());
        assertEquals(List.of("Example Inc"), spec.subject().organizations());
        assertEquals(List.of("US"), spec.subject().countries());
        assertEquals(List.of("spiffe://cluster.local/ns/edge/sa/web"), spec.uris());
        assertEquals(List.of("ops@example.com"), spec.emailAddresses());
        assertEquals(Duration.ofHours(90).plusMinutes(30), spec.duration());
        assertEquals(new IssuerReference("ca-issuer", "ClusterIssuer", "cert-manager.io"), spec.issuerRef());
        assertTrue(spec.isCA());
        assertEquals(List.of(KeyUsage.DIGITAL_SIGNATURE), spec.usages());
        assertEquals(PrivateKeyOptions.rsa(2048), spec.privateKey());
    }

    @Test
    public void v1alpha2() {
        Manifest manifest = reader.read(resource("v1alpha2.yaml"));
        assertEquals(ApiVersion.V1ALPHA2, manifest.apiVersion());
        assertEquals("edge", manifest.namespace());

        CertificateSpec spec = manifest.spec();
        assertEquals("web", spec.name());
        assertEquals("web-tls", spec.secretName());
        assertEquals(Map.of("team", "edge"), spec.labels());
        assertEquals(Map.of("owner", "ops"), spec.annotations());
        assertEquals("example.com", spec.commonName());
        assertEquals(List.of("Example Inc"), spec.subject().organizations());
        assertEquals(List.of("US"), spec.subject().countries());
        assertEquals(List.of("example.com", "www.example.com"), spec.dnsNames());
        assertEquals(List.of("spiffe://cluster.local/ns/edge/sa/web"), spec.uris());
        assertEquals(List.of("ops@example.com"), spec.emailAddresses());
        assertEquals(Duration.ofDays(90), spec.duration());
        assertEquals(new IssuerReference("ca-issuer", "Issuer", ""), spec.issuerRef());
        assertEquals(List.of(KeyUsage.SERVER_AUTH, KeyUsage.CLIENT_AUTH), spec.usages());
        assertEquals(PrivateKeyOptions.ecdsa(384).withEncoding(KeyEncoding.PKCS8), spec.privateKey());
    }
}
