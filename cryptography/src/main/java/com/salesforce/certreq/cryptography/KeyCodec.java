/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.cryptography;

import static java.util.Objects.requireNonNull;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.Provider;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaMiscPEMGenerator;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.openssl.jcajce.JcaPKCS8Generator;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;
import org.bouncycastle.util.io.pem.PemGenerationException;
import org.bouncycastle.util.io.pem.PemObjectGenerator;

import com.salesforce.certreq.model.IssuanceException;
import com.salesforce.certreq.model.IssuanceException.Failure;
import com.salesforce.certreq.model.KeyEncoding;

/**
 * Encodes private keys into unencrypted PEM blocks and back.
 * <ul>
 * <li>{@link KeyEncoding#PKCS1} yields {@code RSA PRIVATE KEY} or {@code EC PRIVATE KEY}</li>
 * <li>{@link KeyEncoding#PKCS8} yields {@code PRIVATE KEY}</li>
 * </ul>
 * Decoding accepts any of the three labels.
 */
public class KeyCodec {
    public static final String EC_PRIVATE_KEY    = "EC PRIVATE KEY";
    public static final String PKCS8_PRIVATE_KEY = "PRIVATE KEY";
    public static final String RSA_PRIVATE_KEY   = "RSA PRIVATE KEY";

    private final JcaPEMKeyConverter converter;

    public KeyCodec(Provider provider) {
        converter = new JcaPEMKeyConverter().setProvider(requireNonNull(provider, "provider"));
    }

    public PrivateKey decode(byte[] encoded) {
        if (encoded == null || encoded.length == 0) {
            throw new IssuanceException(Failure.MALFORMED_KEY_DATA, "no private key data");
        }
        final Object parsed;
        try (PEMParser parser = new PEMParser(new InputStreamReader(new ByteArrayInputStream(encoded),
                                                                    StandardCharsets.US_ASCII))) {
            parsed = parser.readObject();
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            throw new IssuanceException(Failure.MALFORMED_KEY_DATA, "unable to parse private key PEM", e);
        }
        if (parsed == null) {
            throw new IssuanceException(Failure.MALFORMED_KEY_DATA, "no PEM block found in private key data");
        }
        if (parsed instanceof PEMEncryptedKeyPair || parsed instanceof PKCS8EncryptedPrivateKeyInfo) {
            throw new IssuanceException(Failure.MALFORMED_KEY_DATA, "encrypted private keys are not supported");
        }
        try {
            if (parsed instanceof PEMKeyPair) {
                return converter.getPrivateKey(((PEMKeyPair) parsed).getPrivateKeyInfo());
            }
            if (parsed instanceof PrivateKeyInfo) {
                return converter.getPrivateKey((PrivateKeyInfo) parsed);
            }
        } catch (IOException e) {
            throw new IssuanceException(Failure.MALFORMED_KEY_DATA, "unable to decode private key", e);
        }
        throw new IssuanceException(Failure.MALFORMED_KEY_DATA,
                                    "unknown private key type: " + parsed.getClass().getSimpleName());
    }

    public byte[] encode(PrivateKey key, KeyEncoding encoding) {
        requireNonNull(key, "key");
        if (encoding == null) {
            throw new IssuanceException(Failure.UNSUPPORTED_ENCODING, "no private key encoding specified");
        }
        final PemObjectGenerator generator;
        switch (encoding) {
        case PKCS1:
            try {
                generator = new JcaMiscPEMGenerator(key);
            } catch (IOException e) {
                throw new IssuanceException(Failure.UNSUPPORTED_ENCODING, "cannot encode key as PKCS1", e);
            }
            break;
        case PKCS8:
            try {
                generator = new JcaPKCS8Generator(key, null);
            } catch (PemGenerationException e) {
                throw new IssuanceException(Failure.UNSUPPORTED_ENCODING, "cannot encode key as PKCS8", e);
            }
            break;
        default:
            throw new IssuanceException(Failure.UNSUPPORTED_ENCODING, "unsupported private key encoding: " + encoding);
        }
        final StringWriter sw = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(sw)) {
            writer.writeObject(generator);
            writer.flush();
        } catch (IOException e) {
            throw new IssuanceException(Failure.UNSUPPORTED_ENCODING,
                                        String.format("cannot encode %s key as %s", key.getAlgorithm(), encoding), e);
        }
        return sw.toString().getBytes(StandardCharsets.US_ASCII);
    }
}
