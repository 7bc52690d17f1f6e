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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Base64;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.salesforce.certreq.csr.SignedCsr;
import com.salesforce.certreq.issuance.IssuanceRequest;
import com.salesforce.certreq.issuance.Parameters;
import com.salesforce.certreq.model.IssuanceException;
import com.salesforce.certreq.model.IssuanceException.Failure;

public class CreateCertificateRequestTest {

    private static String path(String resource) throws URISyntaxException {
        return Path.of(CreateCertificateRequestTest.class.getResource(resource).toURI()).toString();
    }

    private ByteArrayOutputStream err;
    private ByteArrayOutputStream out;

    @BeforeEach
    public void before() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    @Test
    public void configuration() throws Exception {
        CtlConfiguration configuration = CreateCertificateRequest.loadConfiguration(Path.of(path("/ctl.yaml")));
        assertEquals("certificates", configuration.namespace);
        assertEquals(3072, configuration.defaultRsaKeySize);
        assertEquals(12, configuration.toParameters().hashLength());
        assertEquals(52, configuration.toParameters().maxNamePrefix());
        assertEquals(Parameters.SECRET_NAME_ANNOTATION, configuration.toParameters().secretNameAnnotation());
        assertTrue(configuration.submitter instanceof CtlConfiguration.PrintingSubmitterFactory);
        assertEquals(CtlConfiguration.OutputFormat.JSON,
                     ((CtlConfiguration.PrintingSubmitterFactory) configuration.submitter).format);
    }

    @Test
    public void failedIssuanceIsNotSubmitted() {
        RequestSubmitter submitter = mock(RequestSubmitter.class);
        var command = new CreateCertificateRequest(new CtlConfiguration(), submitter, new SecureRandom());
        var manifest = CreateCertificateRequestTest.class.getResourceAsStream("/manifests/multiple.yaml");
        var e = assertThrows(IssuanceException.class, () -> command.create(manifest));
        assertEquals(Failure.MALFORMED_MANIFEST, e.getFailure());
        verify(submitter, never()).submit(anyString(), any());
    }

    @Test
    public void printJson() throws Exception {
        int code = CreateCertificateRequest.run(new String[] { path("/manifests/v1.yaml"), path("/ctl.yaml") },
                                                new PrintStream(out, true, StandardCharsets.UTF_8),
                                                new PrintStream(err, true, StandardCharsets.UTF_8));
        assertEquals(0, code, err.toString(StandardCharsets.UTF_8));

        JsonNode resource = new ObjectMapper().readTree(out.toByteArray());
        assertEquals("CertificateRequest", resource.path("kind").asText());
        assertEquals("certificates", resource.path("metadata").path("namespace").asText());
        assertTrue(resource.path("metadata").path("name").asText().matches("web-[0-9a-f]{12}"));
        assertEquals("90h30m0s", resource.path("spec").path("duration").asText());
        assertEquals("ClusterIssuer", resource.path("spec").path("issuerRef").path("kind").asText());
        assertTrue(resource.path("spec").path("isCA").asBoolean());

        String pem = new String(Base64.getDecoder().decode(resource.path("spec").path("request").asText()),
                                StandardCharsets.US_ASCII);
        assertEquals("example.com", SignedCsr.fromPem(pem).commonName());
    }

    @Test
    public void printYaml() throws Exception {
        int code = CreateCertificateRequest.run(new String[] { path("/manifests/v1alpha2.yaml") },
                                                new PrintStream(out, true, StandardCharsets.UTF_8),
                                                new PrintStream(err, true, StandardCharsets.UTF_8));
        assertEquals(0, code, err.toString(StandardCharsets.UTF_8));

        JsonNode resource = new ObjectMapper(new YAMLFactory()).readTree(out.toByteArray());
        assertEquals(PrintingSubmitter.API_VERSION, resource.path("apiVersion").asText());
        JsonNode metadata = resource.path("metadata");
        assertEquals("web-", metadata.path("generateName").asText());
        assertEquals("edge", metadata.path("namespace").asText());
        assertEquals("web-tls", metadata.path("annotations").path(Parameters.SECRET_NAME_ANNOTATION).asText());
        assertEquals("web", metadata.path("annotations").path(Parameters.CERTIFICATE_NAME_ANNOTATION).asText());
        assertEquals("edge", metadata.path("labels").path("team").asText());
        assertEquals("2160h0m0s", resource.path("spec").path("duration").asText());
        assertEquals("server auth", resource.path("spec").path("usages").get(0).asText());
        assertEquals("client auth", resource.path("spec").path("usages").get(1).asText());
    }

    @Test
    public void submit() {
        RequestSubmitter submitter = mock(RequestSubmitter.class);
        var command = new CreateCertificateRequest(new CtlConfiguration(), submitter, new SecureRandom());
        IssuanceRequest request = command.create(getClass().getResourceAsStream("/manifests/v1alpha2.yaml"));

        ArgumentCaptor<IssuanceRequest> captor = ArgumentCaptor.forClass(IssuanceRequest.class);
        verify(submitter).submit(eq("edge"), captor.capture());
        assertEquals(request, captor.getValue());
        assertTrue(request.requestName().startsWith("web-"));
    }

    @Test
    public void rejectedConfiguration() throws Exception {
        int code = CreateCertificateRequest.run(new String[] { path("/manifests/v1.yaml"),
                                                               path("/invalid-ctl.yaml") },
                                                new PrintStream(out), new PrintStream(err));
        assertEquals(1, code);
        assertTrue(err.toString().startsWith("invalid configuration: "), err.toString());
        assertTrue(err.toString().contains("hashLength"), err.toString());
        assertEquals(0, out.size());
    }

    @Test
    public void usage() {
        assertEquals(1, CreateCertificateRequest.run(new String[0], new PrintStream(out), new PrintStream(err)));
        assertTrue(err.toString().startsWith("usage:"));
    }

    @Test
    public void unusableManifest() throws Exception {
        String manifest = path("/manifests/multiple.yaml");
        assertEquals(2, CreateCertificateRequest.run(new String[] { manifest }, new PrintStream(out),
                                                     new PrintStream(err)));
        assertTrue(err.toString().contains("MALFORMED_MANIFEST"), err.toString());
        assertEquals(0, out.size());

        assertEquals(1, CreateCertificateRequest.run(new String[] { manifest + ".missing" }, new PrintStream(out),
                                                     new PrintStream(err)));
    }
}
