/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.ctl;

import com.salesforce.certreq.model.CertificateSpec;

/**
 * A certificate manifest converted from its API version: the namespace it lives in and its spec
 */
public record Manifest(ApiVersion apiVersion, String namespace, CertificateSpec spec) {
}
