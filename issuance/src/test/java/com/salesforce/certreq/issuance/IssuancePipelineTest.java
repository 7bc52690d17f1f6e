/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.issuance;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.operator.jcajce.JcaContentVerifierProviderBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.salesforce.certreq.csr.SignedCsr;
import com.salesforce.certreq.issuance.IssuancePipeline.State;
import com.salesforce.certreq.model.CertificateSpec;
import com.salesforce.certreq.model.IssuanceException;
import com.salesforce.certreq.model.IssuanceException.Failure;
import com.salesforce.certreq.model.IssuerReference;
import com.salesforce.certreq.model.KeyEncoding;
import com.salesforce.certreq.model.KeyUsage;
import com.salesforce.certreq.model.PrivateKeyOptions;
import com.salesforce.certreq.model.Subject;

public class IssuancePipelineTest {

    private static CertificateSpec.Builder web() {
        return CertificateSpec.newBuilder()
                              .setName("web")
                              .setSecretName("web-tls")
                              .setSubject(Subject.newBuilder().setCommonName("example.com").build())
                              .setDuration(Duration.ofDays(90))
                              .setIssuerRef(IssuerReference.named("ca-issuer"))
                              .addUsage(KeyUsage.SERVER_AUTH)
                              .setPrivateKey(PrivateKeyOptions.rsa(2048));
    }

    private Parameters       parameters;
    private IssuancePipeline pipeline;
    private List<State>      states;

    @BeforeEach
    public void before() {
        parameters = Parameters.newBuilder().build();
        states = new ArrayList<>();
        pipeline = new IssuancePipeline(parameters, new SecureRandom(), (state, spec) -> states.add(state));
    }

    @ParameterizedTest
    @MethodSource("keyOptions")
    public void everyKeyAndEncoding(PrivateKeyOptions key) throws Exception {
        IssuanceRequest request = pipeline.issue(web().setPrivateKey(key).build());
        SignedCsr csr = SignedCsr.fromPem(request.csrPemText());
        assertTrue(csr.getBcCsr()
                      .isSignatureValid(new JcaContentVerifierProviderBuilder().setProvider(parameters.provider())
                                                                               .build(csr.getBcCsr()
                                                                                         .getSubjectPublicKeyInfo())));
        assertEquals(State.DONE, states.get(states.size() - 1));
    }

    private static Stream<PrivateKeyOptions> keyOptions() {
        return Stream.of(PrivateKeyOptions.rsa(2048), PrivateKeyOptions.rsa(2048).withEncoding(KeyEncoding.PKCS8),
                         PrivateKeyOptions.ecdsa(256), PrivateKeyOptions.ecdsa(384).withEncoding(KeyEncoding.PKCS8),
                         PrivateKeyOptions.ecdsa(521), PrivateKeyOptions.ecdsa(521).withEncoding(KeyEncoding.PKCS8));
    }

    @Test
    public void freshKeyPerInvocation() {
        IssuanceRequest first = pipeline.issue(web().build());
        IssuanceRequest second = pipeline.issue(web().build());
        assertEquals(first.requestName(), second.requestName());
        assertNotEquals(SignedCsr.fromPem(first.csrPemText()).getBcCsr().getSubjectPublicKeyInfo(),
                        SignedCsr.fromPem(second.csrPemText()).getBcCsr().getSubjectPublicKeyInfo());
    }

    @Test
    public void invalidSpecFailsAfterKeyEncoding() {
        var e = assertThrows(IssuanceException.class,
                             () -> pipeline.issue(web().setSubject(Subject.EMPTY)
                                                       .setPrivateKey(PrivateKeyOptions.ecdsa(256))
                                                       .build()));
        assertEquals(Failure.INVALID_SPEC, e.getFailure());
        assertEquals(List.of(State.SPEC_LOADED, State.NAME_COMPUTED, State.KEY_GENERATED, State.KEY_ENCODED,
                             State.FAILED),
                     states);
    }

    @Test
    public void issue() throws Exception {
        IssuanceRequest request = pipeline.issue(web().build());

        assertTrue(request.requestName().matches("web-[0-9a-f]{10}"), request.requestName());
        assertEquals("web-", request.generateName());
        assertEquals("web", request.annotations().get(Parameters.CERTIFICATE_NAME_ANNOTATION));
        assertEquals("web-tls", request.annotations().get(Parameters.SECRET_NAME_ANNOTATION));
        assertEquals(Duration.ofDays(90), request.duration());
        assertEquals("ca-issuer", request.issuerRef().name());
        assertEquals(List.of(KeyUsage.SERVER_AUTH), request.usages());

        String pem = request.csrPemText();
        assertTrue(pem.startsWith("-----BEGIN CERTIFICATE REQUEST-----"));
        assertTrue(pem.trim().endsWith("-----END CERTIFICATE REQUEST-----"));

        SignedCsr csr = SignedCsr.fromPem(pem);
        assertEquals("example.com", csr.commonName());
        assertTrue(csr.getBcCsr()
                      .isSignatureValid(new JcaContentVerifierProviderBuilder().setProvider(parameters.provider())
                                                                               .build(csr.getBcCsr()
                                                                                         .getSubjectPublicKeyInfo())));
        Extension eku = csr.extensions().getExtension(Extension.extendedKeyUsage);
        assertNotNull(eku);
        assertTrue(ExtendedKeyUsage.getInstance(eku.getParsedValue()).hasKeyPurposeId(KeyPurposeId.id_kp_serverAuth));

        assertEquals(List.of(State.SPEC_LOADED, State.NAME_COMPUTED, State.KEY_GENERATED, State.KEY_ENCODED,
                             State.CSR_BUILT, State.CSR_SIGNED, State.REQUEST_ASSEMBLED, State.DONE),
                     states);
    }

    @Test
    public void unsupportedKeySize() {
        var e = assertThrows(IssuanceException.class,
                             () -> pipeline.issue(web().setPrivateKey(PrivateKeyOptions.rsa(1024)).build()));
        assertEquals(Failure.UNSUPPORTED_ALGORITHM, e.getFailure());
        assertEquals(List.of(State.SPEC_LOADED, State.NAME_COMPUTED, State.FAILED), states);
    }
}
