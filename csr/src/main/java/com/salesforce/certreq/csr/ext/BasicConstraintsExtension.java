/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.csr.ext;

import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;

public class BasicConstraintsExtension extends CertExtension {

    public static BasicConstraintsExtension certificateAuthority() {
        return new BasicConstraintsExtension(true);
    }

    BasicConstraintsExtension(final boolean isCA) {
        super(Extension.basicConstraints, true, new BasicConstraints(isCA));
    }
}
