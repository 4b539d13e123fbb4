package com.numbertrack.backend.modules.verification.infrastructure.mail;

import java.time.format.DateTimeFormatter;

import com.numbertrack.backend.modules.verification.application.VerificationMailSender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

/**
 * Plain-text SMTP delivery through Spring's {@link JavaMailSender}. Connect, read and write timeouts
 * come from {@code spring.mail.properties.mail.smtp.*}.
 */
@Component
public class SmtpVerificationMailSender implements VerificationMailSender {

    private static final Logger log = LoggerFactory.getLogger(SmtpVerificationMailSender.class);
    private static final DateTimeFormatter EXPIRY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'");

    private final JavaMailSender mailSender;
    private final String fromAddress;

    public SmtpVerificationMailSender(JavaMailSender mailSender, @Value("${app.mail.from}") String fromAddress) {
        this.mailSender = mailSender;
        this.fromAddress = fromAddress;
    }

    @Override
    public void send(VerificationMail mail) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(fromAddress);
        message.setTo(mail.toAddress());
        message.setSubject("Please confirm the company phone numbers you hold");
        message.setText(body(mail));
        mailSender.send(message);
        log.debug("verification mail sent to={}", mail.toAddress());
    }

    static String body(VerificationMail mail) {
        return """
                Hello %s,

                Please review the company phone numbers currently registered to you and confirm or report each one:

                %s

                The link stays valid until %s. You can reopen it to change your answers before then.
                """.formatted(mail.employeeName(), mail.verificationLink(), EXPIRY_FORMAT.format(mail.expiresAt()));
    }
}
