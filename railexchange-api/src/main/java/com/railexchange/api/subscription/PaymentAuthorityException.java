package com.railexchange.api.subscription;

/**
 * Raised by {@link PaymentAuthority} implementations when the authority cannot answer.
 * Never escapes the subscription verifier.
 */
public class PaymentAuthorityException extends RuntimeException {

    public PaymentAuthorityException(String message) {
        super(message);
    }

    public PaymentAuthorityException(String message, Throwable cause) {
        super(message, cause);
    }
}
