package com.numbertrack.backend.modules.verification.application;

import java.time.OffsetDateTime;

/**
 * Delivers the confirmation link to one employee. Implementations throw on any delivery failure,
 * including transport timeouts; the batch worker counts that as a failed email.
 */
public interface VerificationMailSender {

    void send(VerificationMail mail);

    record VerificationMail(String toAddress, String employeeName, String verificationLink, OffsetDateTime expiresAt) {
    }
}
