/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.model;

import static java.util.Objects.requireNonNull;

/**
 * Names the issuing authority a request is addressed to. Kind and group are optional and carried as empty strings
 * when absent.
 */
public record IssuerReference(String name, String kind, String group) {

    public static IssuerReference named(String name) {
        return new IssuerReference(name, "", "");
    }

    public IssuerReference {
        requireNonNull(name, "name");
        kind = kind == null ? "" : kind;
        group = group == null ? "" : group;
    }
}
