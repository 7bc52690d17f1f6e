/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.cryptography;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;

import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.bouncycastle.util.io.pem.PemWriter;

/**
 * The textual PEM envelope around DER encoded structures
 */
public final class Pem {

    /**
     * Answer the DER content of the first PEM block, which must carry the expected label
     *
     * @throws IllegalArgumentException if there is no PEM block, or the block carries a different label
     */
    public static byte[] decode(String label, String pem) {
        try (PemReader reader = new PemReader(new StringReader(pem))) {
            PemObject object = reader.readPemObject();
            if (object == null) {
                throw new IllegalArgumentException("No PEM block found");
            }
            if (!label.equals(object.getType())) {
                throw new IllegalArgumentException(String.format("Expected PEM block: %s found: %s", label,
                                                                 object.getType()));
            }
            return object.getContent();
        } catch (IOException | IllegalStateException e) {
            throw new IllegalArgumentException("Malformed PEM block", e);
        }
    }

    public static String encode(String label, byte[] der) {
        final StringWriter sw = new StringWriter();
        try (PemWriter writer = new PemWriter(sw)) {
            writer.writeObject(new PemObject(label, der));
            writer.flush();
            return sw.toString();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Pem() {
    }
}
