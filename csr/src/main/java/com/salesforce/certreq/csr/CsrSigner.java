/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.csr;

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.Provider;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.interfaces.ECKey;
import java.security.interfaces.RSAKey;

import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.x509.ExtensionsGenerator;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.operator.jcajce.JcaContentVerifierProviderBuilder;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.bouncycastle.pkcs.PKCS10CertificationRequestBuilder;
import org.bouncycastle.pkcs.PKCSException;
import org.bouncycastle.pkcs.jcajce.JcaPKCS10CertificationRequestBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.certreq.csr.ext.CertExtension;
import com.salesforce.certreq.model.IssuanceException;
import com.salesforce.certreq.model.IssuanceException.Failure;
import com.salesforce.certreq.model.KeyAlgorithm;

/**
 * Signs CSR templates. The public half of the key pair is embedded in the request and the private half signs it; the
 * resulting signature is verified against the embedded key before the request is returned.
 */
public class CsrSigner {
    private static final Logger log = LoggerFactory.getLogger(CsrSigner.class);

    private static boolean isFamily(KeyAlgorithm algorithm, Object key) {
        switch (algorithm) {
        case RSA:
            return key instanceof RSAKey;
        case ECDSA:
            return key instanceof ECKey;
        default:
            return false;
        }
    }

    private final SecureRandom entropy;
    private final Provider     provider;

    public CsrSigner(Provider provider, SecureRandom entropy) {
        this.provider = requireNonNull(provider, "provider");
        this.entropy = requireNonNull(entropy, "entropy");
    }

    /**
     * @throws IssuanceException {@link Failure#INCOMPATIBLE_KEY_ALGORITHM} if either half of the key pair does not
     *                           belong to the template's key algorithm, {@link Failure#KEY_MISMATCH} if the private
     *                           key does not correspond to the public key
     */
    public SignedCsr sign(CsrTemplate template, KeyPair keyPair) {
        final PublicKey publicKey = keyPair.getPublic();
        final PrivateKey privateKey = keyPair.getPrivate();
        if (!isFamily(template.keyAlgorithm(), publicKey) || !isFamily(template.keyAlgorithm(), privateKey)) {
            throw new IssuanceException(Failure.INCOMPATIBLE_KEY_ALGORITHM,
                                        String.format("%s cannot be signed with a %s/%s key pair",
                                                      template.signatureAlgorithm(), publicKey.getAlgorithm(),
                                                      privateKey.getAlgorithm()));
        }

        final PKCS10CertificationRequestBuilder builder = new JcaPKCS10CertificationRequestBuilder(template.subject(),
                                                                                                   publicKey);
        if (!template.extensions().isEmpty()) {
            final ExtensionsGenerator extensions = new ExtensionsGenerator();
            try {
                for (CertExtension e : template.extensions()) {
                    e.addTo(extensions);
                }
            } catch (IOException | IllegalArgumentException e) {
                throw new IssuanceException(Failure.INVALID_SPEC, "cannot encode requested extensions", e);
            }
            builder.addAttribute(PKCSObjectIdentifiers.pkcs_9_at_extensionRequest, extensions.generate());
        }

        final PKCS10CertificationRequest request;
        try {
            final ContentSigner signer = new JcaContentSignerBuilder(template.signatureAlgorithm().jcaName())
                                         .setProvider(provider)
                                         .setSecureRandom(entropy)
                                         .build(privateKey);
            request = builder.build(signer);
        } catch (OperatorCreationException | IllegalArgumentException e) {
            throw new IssuanceException(Failure.INCOMPATIBLE_KEY_ALGORITHM,
                                        "cannot sign with " + template.signatureAlgorithm(), e);
        }

        try {
            final var verifier = new JcaContentVerifierProviderBuilder().setProvider(provider)
                                                                        .build(request.getSubjectPublicKeyInfo());
            if (!request.isSignatureValid(verifier)) {
                throw new IssuanceException(Failure.KEY_MISMATCH,
                                            "CSR signature does not verify against the embedded public key");
            }
        } catch (OperatorCreationException | PKCSException e) {
            throw new IssuanceException(Failure.KEY_MISMATCH, "cannot verify CSR signature", e);
        }
        log.trace("Signed CSR for: {} with: {}", template.subject(), template.signatureAlgorithm());
        return new SignedCsr(request);
    }
}
