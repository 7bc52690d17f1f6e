/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.cryptography;

import static java.util.Objects.requireNonNull;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Provider;
import java.security.SecureRandom;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.RSAKeyGenParameterSpec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.certreq.model.CertificateSpec;
import com.salesforce.certreq.model.IssuanceException;
import com.salesforce.certreq.model.IssuanceException.Failure;
import com.salesforce.certreq.model.KeyAlgorithm;
import com.salesforce.certreq.model.PrivateKeyOptions;

/**
 * Generates the private key backing a requested certificate. All randomness is drawn from the supplied entropy
 * source.
 */
public class KeyGenerator {
    private static final Logger log = LoggerFactory.getLogger(KeyGenerator.class);

    static String curveName(int keySize) {
        switch (keySize) {
        case 256:
            return "secp256r1";
        case 384:
            return "secp384r1";
        case 521:
            return "secp521r1";
        default:
            throw new IssuanceException(Failure.UNSUPPORTED_ALGORITHM, "unsupported ecdsa key size: " + keySize);
        }
    }

    private final SecureRandom entropy;
    private final Provider     provider;

    public KeyGenerator(Provider provider, SecureRandom entropy) {
        this.provider = requireNonNull(provider, "provider");
        this.entropy = requireNonNull(entropy, "entropy");
    }

    public KeyPair generate(CertificateSpec spec) {
        return generate(spec.privateKey());
    }

    public KeyPair generate(PrivateKeyOptions options) {
        final KeyAlgorithm algorithm = options.algorithm();
        final int size = options.size();
        if (!algorithm.supports(size)) {
            throw new IssuanceException(Failure.UNSUPPORTED_ALGORITHM,
                                        String.format("unsupported %s key size: %s", algorithm.wireName(), size));
        }
        try {
            final KeyPairGenerator gen = KeyPairGenerator.getInstance(algorithm.jcaName(), provider);
            switch (algorithm) {
            case RSA:
                gen.initialize(new RSAKeyGenParameterSpec(size, RSAKeyGenParameterSpec.F4), entropy);
                break;
            case ECDSA:
                gen.initialize(new ECGenParameterSpec(curveName(size)), entropy);
                break;
            default:
                throw new IssuanceException(Failure.UNSUPPORTED_ALGORITHM, "unsupported algorithm: " + algorithm);
            }
            KeyPair pair = gen.generateKeyPair();
            log.trace("Generated {} {} key", algorithm.wireName(), size);
            return pair;
        } catch (GeneralSecurityException | IllegalStateException e) {
            throw new IssuanceException(Failure.GENERATION_FAILURE,
                                        String.format("unable to generate %s %s key", algorithm.wireName(), size),
                                        e);
        }
    }
}
