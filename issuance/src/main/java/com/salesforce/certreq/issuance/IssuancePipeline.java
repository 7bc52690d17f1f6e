/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.issuance;

import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.certreq.cryptography.KeyCodec;
import com.salesforce.certreq.cryptography.KeyGenerator;
import com.salesforce.certreq.csr.CsrBuilder;
import com.salesforce.certreq.csr.CsrSigner;
import com.salesforce.certreq.csr.CsrTemplate;
import com.salesforce.certreq.csr.SignedCsr;
import com.salesforce.certreq.model.CertificateSpec;
import com.salesforce.certreq.model.IssuanceException;

/**
 * Drives a certificate spec through naming, key generation, key encoding, CSR construction, signing and request
 * assembly. Each invocation is a single pass: there are no retries and a failed invocation cannot be resumed.
 * <p>
 * The CSR is signed with the key as recovered from its encoded form, so a request is only produced when the
 * encoding round trips to the generated key.
 */
public class IssuancePipeline {

    /**
     * Notified of every state an invocation enters, in order
     */
    @FunctionalInterface
    public interface Listener {
        void entered(State state, CertificateSpec spec);
    }

    public enum State {
        CSR_BUILT, CSR_SIGNED, DONE, FAILED, KEY_ENCODED, KEY_GENERATED, NAME_COMPUTED, REQUEST_ASSEMBLED,
        SPEC_LOADED;
    }

    private static final Logger log = LoggerFactory.getLogger(IssuancePipeline.class);

    private final RequestAssembler assembler;
    private final CsrBuilder       builder = new CsrBuilder();
    private final KeyCodec         codec;
    private final KeyGenerator     generator;
    private final Listener         listener;
    private final RequestNamer     namer;
    private final CsrSigner        signer;

    public IssuancePipeline(Parameters parameters, SecureRandom entropy) {
        this(parameters, entropy, null);
    }

    public IssuancePipeline(Parameters parameters, SecureRandom entropy, Listener listener) {
        this.namer = new RequestNamer(parameters);
        this.generator = new KeyGenerator(parameters.provider(), entropy);
        this.codec = new KeyCodec(parameters.provider());
        this.signer = new CsrSigner(parameters.provider(), entropy);
        this.assembler = new RequestAssembler(parameters);
        this.listener = listener;
    }

    /**
     * @throws IssuanceException with the reason of the first failing step; no request is produced
     */
    public IssuanceRequest issue(CertificateSpec spec) {
        try {
            enter(State.SPEC_LOADED, spec);
            final String requestName = namer.computeName(spec);
            enter(State.NAME_COMPUTED, spec);

            final KeyPair generated = generator.generate(spec);
            enter(State.KEY_GENERATED, spec);

            final byte[] encoded = codec.encode(generated.getPrivate(), spec.privateKey().encoding());
            final PrivateKey decoded;
            try {
                decoded = codec.decode(encoded);
            } finally {
                Arrays.fill(encoded, (byte) 0);
            }
            enter(State.KEY_ENCODED, spec);

            final CsrTemplate template = builder.build(spec);
            enter(State.CSR_BUILT, spec);

            final SignedCsr csr = signer.sign(template, new KeyPair(generated.getPublic(), decoded));
            enter(State.CSR_SIGNED, spec);

            final IssuanceRequest request = assembler.assemble(spec, requestName, csr);
            enter(State.REQUEST_ASSEMBLED, spec);

            enter(State.DONE, spec);
            log.info("Issuance request: {} for certificate: {} issuer: {}", requestName, spec.name(),
                     spec.issuerRef().name());
            return request;
        } catch (IssuanceException e) {
            log.warn("Unable to create issuance request for certificate: {} reason: {}", spec.name(),
                     e.getFailure());
            enter(State.FAILED, spec);
            throw e;
        }
    }

    private void enter(State state, CertificateSpec spec) {
        log.trace("Certificate: {} entered: {}", spec.name(), state);
        if (listener != null) {
            listener.entered(state, spec);
        }
    }
}
