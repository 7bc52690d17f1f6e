/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.csr.ext;

import java.net.URI;
import java.net.URISyntaxException;

import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.util.IPAddress;

import com.salesforce.certreq.model.IssuanceException;
import com.salesforce.certreq.model.IssuanceException.Failure;

/**
 * The kinds of subject alternative name a certificate spec may request
 */
public enum NameType {
    DNS_NAME(GeneralName.dNSName) {
        @Override
        void validate(String name) {
        }
    },
    IP_ADDRESS(GeneralName.iPAddress) {
        @Override
        void validate(String name) {
            if (!IPAddress.isValid(name)) {
                throw new IssuanceException(Failure.INVALID_SPEC, "invalid IP address: " + name);
            }
        }
    },
    RFC_822_NAME(GeneralName.rfc822Name) {
        @Override
        void validate(String name) {
            final int at = name.indexOf('@');
            if (at <= 0 || at == name.length() - 1) {
                throw new IssuanceException(Failure.INVALID_SPEC, "invalid email address: " + name);
            }
        }
    },
    /**
     * URI : Uniform Resource Identifier
     */
    URI(GeneralName.uniformResourceIdentifier) {
        @Override
        void validate(String name) {
            try {
                new URI(name);
            } catch (URISyntaxException e) {
                throw new IssuanceException(Failure.INVALID_SPEC, "invalid URI: " + name, e);
            }
        }
    };

    private final int tag;

    private NameType(final int tag) {
        this.tag = tag;
    }

    /**
     * @throws IssuanceException if the name is blank or malformed for this name type
     */
    public GeneralName generalName(final String name) {
        if (name == null || name.isBlank()) {
            throw new IssuanceException(Failure.INVALID_SPEC, "empty " + this + " subject alternative name");
        }
        validate(name);
        return new GeneralName(tag, name);
    }

    abstract void validate(String name);
}
