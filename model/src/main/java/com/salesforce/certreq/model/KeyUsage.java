/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.model;

/**
 * Usages a certificate may be requested for. The first group maps onto the X.509 key usage bits, the remainder onto
 * extended key usage purposes.
 */
public enum KeyUsage {
    CERT_SIGN("cert sign"), CONTENT_COMMITMENT("content commitment"), CRL_SIGN("crl sign"),
    DATA_ENCIPHERMENT("data encipherment"), DECIPHER_ONLY("decipher only"), DIGITAL_SIGNATURE("digital signature"),
    ENCIPHER_ONLY("encipher only"), KEY_AGREEMENT("key agreement"), KEY_ENCIPHERMENT("key encipherment"),
    SIGNING("signing"),

    ANY("any"), CLIENT_AUTH("client auth"), CODE_SIGNING("code signing"), EMAIL_PROTECTION("email protection"),
    IPSEC_END_SYSTEM("ipsec end system"), IPSEC_TUNNEL("ipsec tunnel"), IPSEC_USER("ipsec user"),
    MICROSOFT_SGC("microsoft sgc"), NETSCAPE_SGC("netscape sgc"), OCSP_SIGNING("ocsp signing"),
    SERVER_AUTH("server auth"), SMIME("s/mime"), TIMESTAMPING("timestamping");

    public static KeyUsage fromWireName(String name) {
        for (KeyUsage usage : values()) {
            if (usage.wireName.equalsIgnoreCase(name)) {
                return usage;
            }
        }
        throw new IssuanceException(IssuanceException.Failure.INVALID_SPEC, "unknown key usage: " + name);
    }

    private final String wireName;

    KeyUsage(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
