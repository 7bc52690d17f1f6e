/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.ctl;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.salesforce.certreq.issuance.IssuancePipeline;
import com.salesforce.certreq.issuance.IssuanceRequest;
import com.salesforce.certreq.model.IssuanceException;

/**
 * Creates a certificate request for one-time issuance of a certificate manifest, without renewal
 */
public class CreateCertificateRequest {
    private static final Logger log = LoggerFactory.getLogger(CreateCertificateRequest.class);

    public static CtlConfiguration loadConfiguration(Path yaml) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream is = Files.newInputStream(yaml)) {
            return mapper.readValue(is, CtlConfiguration.class);
        }
    }

    public static void main(String[] argv) {
        System.exit(run(argv, System.out, System.err));
    }

    static int run(String[] argv, PrintStream out, PrintStream err) {
        if (argv.length < 1 || argv.length > 2) {
            err.println("usage: CreateCertificateRequest <manifest> [configuration]");
            return 1;
        }
        CtlConfiguration configuration;
        if (argv.length == 2) {
            try {
                configuration = loadConfiguration(Path.of(argv[1]));
            } catch (IOException e) {
                err.println("cannot read configuration: " + argv[1] + ": " + e.getMessage());
                return 1;
            }
        } else {
            configuration = new CtlConfiguration();
        }
        final CreateCertificateRequest command;
        try {
            command = new CreateCertificateRequest(configuration, configuration.submitter.getSubmitter(out),
                                                   new SecureRandom());
        } catch (IllegalArgumentException e) {
            err.println("invalid configuration: " + e.getMessage());
            return 1;
        }
        try {
            command.create(Path.of(argv[0]));
            return 0;
        } catch (IssuanceException e) {
            err.println("error: " + e.getMessage());
            return 2;
        } catch (IOException e) {
            err.println("cannot read manifest: " + argv[0] + ": " + e.getMessage());
            return 1;
        }
    }

    private final IssuancePipeline pipeline;
    private final ManifestReader   reader;
    private final RequestSubmitter submitter;

    public CreateCertificateRequest(CtlConfiguration configuration, RequestSubmitter submitter,
                                    SecureRandom entropy) {
        this.reader = new ManifestReader(configuration);
        this.pipeline = new IssuancePipeline(configuration.toParameters(), entropy);
        this.submitter = submitter;
    }

    public IssuanceRequest create(InputStream manifest) {
        Manifest certificate = reader.read(manifest);
        IssuanceRequest request = pipeline.issue(certificate.spec());
        submitter.submit(certificate.namespace(), request);
        log.info("Submitted: {} namespace: {}", request.requestName(), certificate.namespace());
        return request;
    }

    public IssuanceRequest create(Path manifest) throws IOException {
        try (InputStream is = Files.newInputStream(manifest)) {
            return create(is);
        }
    }
}
