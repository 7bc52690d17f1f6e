/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.ctl;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.salesforce.certreq.model.IssuanceException;
import com.salesforce.certreq.model.IssuanceException.Failure;

/**
 * Reads a single {@code Certificate} manifest, YAML or JSON, and converts it according to its
 * {@code apiVersion}
 */
public class ManifestReader {
    public static final String KIND = "Certificate";

    private static final Logger log = LoggerFactory.getLogger(ManifestReader.class);

    private final CtlConfiguration configuration;
    private final ObjectMapper     mapper = new ObjectMapper(new YAMLFactory());

    public ManifestReader(CtlConfiguration configuration) {
        this.configuration = configuration;
    }

    /**
     * @throws IssuanceException {@link Failure#MALFORMED_MANIFEST} if the stream does not hold exactly one
     *                           certificate manifest of a supported API version
     */
    public Manifest read(InputStream manifest) {
        final List<JsonNode> documents;
        try {
            documents = mapper.readerFor(JsonNode.class).<JsonNode>readValues(manifest).readAll();
        } catch (IOException e) {
            throw new IssuanceException(Failure.MALFORMED_MANIFEST, "cannot parse manifest", e);
        }
        documents.removeIf(d -> d == null || d.isNull() || d.isMissingNode());
        if (documents.isEmpty()) {
            throw new IssuanceException(Failure.MALFORMED_MANIFEST, "no object passed to create certificaterequest");
        }
        if (documents.size() > 1) {
            throw new IssuanceException(Failure.MALFORMED_MANIFEST,
                                        "multiple objects passed to create certificaterequest");
        }
        return convert(documents.get(0));
    }

    Manifest convert(JsonNode document) {
        if (!document.isObject()) {
            throw new IssuanceException(Failure.MALFORMED_MANIFEST, "manifest is not an object");
        }
        final ApiVersion version = ApiVersion.fromString(ApiVersion.text(document, "apiVersion"));
        final String kind = ApiVersion.text(document, "kind");
        if (!KIND.equals(kind)) {
            throw new IssuanceException(Failure.MALFORMED_MANIFEST, "decoded object is not a Certificate: " + kind);
        }
        final JsonNode metadata = document.path("metadata");
        final String name = ApiVersion.text(metadata, "name");
        if (name.isEmpty()) {
            throw new IssuanceException(Failure.MALFORMED_MANIFEST, "metadata.name is required");
        }
        final JsonNode spec = document.path("spec");
        if (!spec.isObject()) {
            throw new IssuanceException(Failure.MALFORMED_MANIFEST, "spec of certificate " + name + " is missing");
        }
        final String namespace = ApiVersion.text(metadata, "namespace");

        log.debug("Converting {} certificate: {}", version.apiVersion(), name);
        return new Manifest(version, namespace.isEmpty() ? configuration.namespace : namespace,
                            version.convert(spec, configuration)
                                   .setName(name)
                                   .setLabels(strings(metadata, "labels"))
                                   .setAnnotations(strings(metadata, "annotations"))
                                   .build());
    }

    private Map<String, String> strings(JsonNode metadata, String field) {
        final JsonNode values = metadata.path(field);
        final Map<String, String> result = new LinkedHashMap<>();
        if (values.isMissingNode() || values.isNull()) {
            return result;
        }
        if (!values.isObject()) {
            throw new IssuanceException(Failure.MALFORMED_MANIFEST, "metadata." + field + " must be a map");
        }
        values.fields().forEachRemaining(e -> result.put(e.getKey(), e.getValue().asText()));
        return result;
    }
}
