/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.issuance;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.salesforce.certreq.cryptography.KeyGenerator;
import com.salesforce.certreq.csr.CsrBuilder;
import com.salesforce.certreq.csr.CsrSigner;
import com.salesforce.certreq.csr.SignedCsr;
import com.salesforce.certreq.model.CertificateSpec;
import com.salesforce.certreq.model.IssuerReference;
import com.salesforce.certreq.model.KeyUsage;
import com.salesforce.certreq.model.PrivateKeyOptions;
import com.salesforce.certreq.model.Subject;

public class RequestAssemblerTest {
    private static SignedCsr       csr;
    private static CertificateSpec spec;

    @BeforeAll
    public static void beforeClass() {
        var provider = new BouncyCastleProvider();
        Map<String, String> annotations = new LinkedHashMap<>();
        annotations.put("owner", "ops");
        annotations.put(Parameters.CERTIFICATE_NAME_ANNOTATION, "spoofed");
        spec = CertificateSpec.newBuilder()
                              .setName("web")
                              .setSecretName("web-tls")
                              .setLabels(Map.of("team", "edge"))
                              .setAnnotations(annotations)
                              .setSubject(Subject.newBuilder().setCommonName("example.com").build())
                              .setDuration(Duration.ofDays(90))
                              .setIssuerRef(IssuerReference.named("ca-issuer"))
                              .addUsage(KeyUsage.SERVER_AUTH)
                              .setPrivateKey(PrivateKeyOptions.ecdsa(256))
                              .build();
        csr = new CsrSigner(provider, new SecureRandom()).sign(new CsrBuilder().build(spec),
                                                               new KeyGenerator(provider,
                                                                                new SecureRandom()).generate(spec));
    }

    @Test
    public void customAnnotationKeys() {
        var assembler = new RequestAssembler(Parameters.newBuilder()
                                                       .setSecretNameAnnotation("example.com/secret")
                                                       .setCertificateNameAnnotation("example.com/certificate")
                                                       .build());
        IssuanceRequest request = assembler.assemble(spec, "web-0123456789", csr);
        assertEquals("web-tls", request.annotations().get("example.com/secret"));
        assertEquals("web", request.annotations().get("example.com/certificate"));
        assertEquals("spoofed", request.annotations().get(Parameters.CERTIFICATE_NAME_ANNOTATION));
    }

    @Test
    public void merge() {
        IssuanceRequest request = new RequestAssembler(Parameters.newBuilder().build()).assemble(spec,
                                                                                                 "web-0123456789",
                                                                                                 csr);
        assertEquals("web-0123456789", request.requestName());
        assertEquals("web-", request.generateName());
        assertEquals(Map.of("team", "edge"), request.labels());
        assertEquals(3, request.annotations().size());
        assertEquals("ops", request.annotations().get("owner"));
        assertEquals("web-tls", request.annotations().get(Parameters.SECRET_NAME_ANNOTATION));
        assertEquals("web", request.annotations().get(Parameters.CERTIFICATE_NAME_ANNOTATION));
        assertEquals(Duration.ofDays(90), request.duration());
        assertEquals(IssuerReference.named("ca-issuer"), request.issuerRef());
        assertEquals(List.of(KeyUsage.SERVER_AUTH), request.usages());
        assertArrayEquals(csr.pemBytes(), request.csrPem());
        assertEquals(csr, SignedCsr.fromPem(request.csrPemText()));
    }

    @Test
    public void immutable() {
        IssuanceRequest request = new RequestAssembler(Parameters.newBuilder().build()).assemble(spec,
                                                                                                 "web-0123456789",
                                                                                                 csr);
        byte[] pem = request.csrPem();
        assertNotSame(pem, request.csrPem());
        pem[0] = 0;
        assertEquals((byte) '-', request.csrPem()[0]);
        assertThrows(UnsupportedOperationException.class, () -> request.annotations().put("x", "y"));
        assertThrows(UnsupportedOperationException.class, () -> request.labels().put("x", "y"));
    }
}
