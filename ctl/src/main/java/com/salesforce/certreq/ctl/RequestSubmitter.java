/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.ctl;

import com.salesforce.certreq.issuance.IssuanceRequest;
import com.salesforce.certreq.model.IssuanceException;

/**
 * Hands a finished issuance request to whatever issues certificates
 */
public interface RequestSubmitter {

    /**
     * @throws IssuanceException if the request could not be submitted
     */
    void submit(String namespace, IssuanceRequest request);
}
