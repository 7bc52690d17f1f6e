/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.ctl;

import java.io.PrintStream;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonSubTypes.Type;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.salesforce.certreq.issuance.Parameters;
import com.salesforce.certreq.model.KeyEncoding;

/**
 * Configuration of the command line, bound from YAML
 */
public class CtlConfiguration {

    public enum OutputFormat {
        JSON, YAML;
    }

    public static class PrintingSubmitterFactory implements SubmitterFactory {
        public OutputFormat format = OutputFormat.YAML;

        @Override
        public RequestSubmitter getSubmitter(PrintStream out) {
            return new PrintingSubmitter(out, format);
        }
    }

    public interface SubmitterFactory {
        RequestSubmitter getSubmitter(PrintStream out);
    }

    public static final int DEFAULT_ECDSA_KEY_SIZE = 256;
    public static final int DEFAULT_RSA_KEY_SIZE   = 2048;

    public String           certificateNameAnnotation = Parameters.CERTIFICATE_NAME_ANNOTATION;
    /**
     * Key size used when a manifest names an ECDSA key without a size
     */
    public int              defaultEcdsaKeySize       = DEFAULT_ECDSA_KEY_SIZE;
    public KeyEncoding      defaultKeyEncoding        = KeyEncoding.PKCS1;
    /**
     * Key size used when a manifest names an RSA key, or no key at all, without a size
     */
    public int              defaultRsaKeySize         = DEFAULT_RSA_KEY_SIZE;
    public int              hashLength                = 10;
    public int              maxNamePrefix             = 52;
    /**
     * Namespace of manifests that do not declare one
     */
    public String           namespace                 = "default";
    public String           secretNameAnnotation      = Parameters.SECRET_NAME_ANNOTATION;
    @JsonSubTypes({ @Type(value = PrintingSubmitterFactory.class, name = "print") })
    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type",
                  defaultImpl = PrintingSubmitterFactory.class)
    public SubmitterFactory submitter                 = new PrintingSubmitterFactory();

    public Parameters toParameters() {
        return Parameters.newBuilder()
                         .setMaxNamePrefix(maxNamePrefix)
                         .setHashLength(hashLength)
                         .setSecretNameAnnotation(secretNameAnnotation)
                         .setCertificateNameAnnotation(certificateNameAnnotation)
                         .build();
    }
}
