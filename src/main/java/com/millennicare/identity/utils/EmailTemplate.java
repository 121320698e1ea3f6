package com.millennicare.identity.utils;

import com.millennicare.identity.config.AsyncConfig;
import com.millennicare.identity.config.AuthProperties;
import com.millennicare.identity.config.EmailProperties;
import com.millennicare.identity.service.EmailSender;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Plain-text transactional mail over {@link JavaMailSender}, sent on the mail executor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmailTemplate implements EmailSender {

    private final JavaMailSender mailSender;
    private final EmailProperties emailProperties;
    private final AuthProperties authProperties;

    @Async(AsyncConfig.MAIL_EXECUTOR)
    @Override
    public void sendVerificationEmail(String to, String code, String verificationLink) {
        long minutes = authProperties.verificationCodeTtl().toMinutes();
        send(to, "Verify your Millennicare email",
                "Your verification code is: " + code + "\n\n"
                        + "Or confirm your email with this link:\n" + verificationLink + "\n\n"
                        + "The code expires in " + minutes + " minutes.");
    }

    @Async(AsyncConfig.MAIL_EXECUTOR)
    @Override
    public void sendPasswordResetEmail(String to, String resetLink) {
        long minutes = authProperties.verificationCodeTtl().toMinutes();
        send(to, "Reset your Millennicare password",
                "We received a request to reset your password.\n\n"
                        + "Choose a new password here:\n" + resetLink + "\n\n"
                        + "The link expires in " + minutes + " minutes. If you did not ask for this, ignore this email.");
    }

    private void send(String to, String subject, String text) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(emailProperties.from());
        message.setTo(to);
        message.setSubject(subject);
        message.setText(text);
        try {
            mailSender.send(message);
            log.debug("Sent '{}' mail", subject);
        } catch (MailException e) {
            log.error("Failed to send '{}' mail: {}", subject, e.getMessage());
        }
    }
}
