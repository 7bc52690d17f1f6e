/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.model;

/**
 * The single failure type of request construction. Every failure is terminal for the invocation that raised it; the
 * {@link Failure} tells the caller which step rejected the input.
 */
public class IssuanceException extends RuntimeException {

    public enum Failure {
        GENERATION_FAILURE, HASHING_FAILURE, INCOMPATIBLE_KEY_ALGORITHM, INVALID_SPEC, KEY_MISMATCH,
        MALFORMED_KEY_DATA, MALFORMED_MANIFEST, SUBMISSION_FAILURE, UNSUPPORTED_ALGORITHM, UNSUPPORTED_ENCODING;
    }

    private static final long serialVersionUID = 4735091266415923917L;

    private final Failure failure;

    public IssuanceException(Failure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public IssuanceException(Failure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public Failure getFailure() {
        return failure;
    }

    @Override
    public String getMessage() {
        return failure + ": " + super.getMessage();
    }
}
