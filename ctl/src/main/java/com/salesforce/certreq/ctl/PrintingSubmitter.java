/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.ctl;

import java.io.PrintStream;
import java.util.Base64;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.salesforce.certreq.ctl.CtlConfiguration.OutputFormat;
import com.salesforce.certreq.issuance.IssuanceRequest;
import com.salesforce.certreq.model.IssuanceException;
import com.salesforce.certreq.model.IssuanceException.Failure;
import com.salesforce.certreq.model.KeyUsage;

/**
 * Renders issuance requests as {@code CertificateRequest} resources, YAML or JSON, on a print stream
 */
public class PrintingSubmitter implements RequestSubmitter {
    public static final String API_VERSION = "cert-manager.io/v1";
    public static final String KIND        = "CertificateRequest";

    private final ObjectMapper mapper;
    private final PrintStream  out;

    public PrintingSubmitter(PrintStream out, OutputFormat format) {
        this(out, format == OutputFormat.JSON ? new ObjectMapper() : new ObjectMapper(new YAMLFactory()));
    }

    PrintingSubmitter(PrintStream out, ObjectMapper mapper) {
        this.out = out;
        this.mapper = mapper;
    }

    @Override
    public void submit(String namespace, IssuanceRequest request) {
        try {
            out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toResource(namespace, request)));
        } catch (JsonProcessingException e) {
            throw new IssuanceException(Failure.SUBMISSION_FAILURE,
                                        "cannot render certificate request: " + request.requestName(), e);
        }
        out.flush();
    }

    ObjectNode toResource(String namespace, IssuanceRequest request) {
        final ObjectNode resource = mapper.createObjectNode();
        resource.put("apiVersion", API_VERSION);
        resource.put("kind", KIND);

        final ObjectNode metadata = resource.putObject("metadata");
        metadata.put("name", request.requestName());
        metadata.put("generateName", request.generateName());
        metadata.put("namespace", namespace);
        putAll(metadata.putObject("annotations"), request.annotations());
        putAll(metadata.putObject("labels"), request.labels());

        final ObjectNode spec = resource.putObject("spec");
        spec.put("request", Base64.getEncoder().encodeToString(request.csrPem()));
        if (request.duration() != null) {
            spec.put("duration", Durations.format(request.duration()));
        }
        final ObjectNode issuer = spec.putObject("issuerRef");
        issuer.put("name", request.issuerRef().name());
        if (!request.issuerRef().kind().isEmpty()) {
            issuer.put("kind", request.issuerRef().kind());
        }
        if (!request.issuerRef().group().isEmpty()) {
            issuer.put("group", request.issuerRef().group());
        }
        spec.put("isCA", request.isCA());
        final ArrayNode usages = spec.putArray("usages");
        for (KeyUsage usage : request.usages()) {
            usages.add(usage.wireName());
        }
        return resource;
    }

    private void putAll(ObjectNode node, Map<String, String> values) {
        values.forEach(node::put);
    }
}
