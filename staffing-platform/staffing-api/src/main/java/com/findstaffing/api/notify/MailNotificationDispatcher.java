package com.findstaffing.api.notify;

import com.findstaffing.api.config.StaffingProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Sends multipart (plain text + HTML) mail through Spring's {@link JavaMailSender}.
 */
@Component
public class MailNotificationDispatcher implements NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(MailNotificationDispatcher.class);

    private final JavaMailSender mailSender;
    private final StaffingProperties properties;

    public MailNotificationDispatcher(JavaMailSender mailSender, StaffingProperties properties) {
        this.mailSender = mailSender;
        this.properties = properties;
    }

    @Override
    public String send(EmailMessage message) {
        if (!properties.getMail().isEnabled()) {
            throw new NotificationException("Mail delivery is disabled", null);
        }
        try {
            MimeMessage mime = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mime, true, StandardCharsets.UTF_8.name());
            helper.setFrom(properties.getMail().getFrom());
            helper.setTo(message.to());
            helper.setSubject(message.subject());
            helper.setText(message.text() == null ? "" : message.text(), message.html() == null ? "" : message.html());

            mailSender.send(mime);

            String messageId = mime.getMessageID();
            log.info("Email '{}' sent, message id {}", message.subject(), messageId);
            return messageId;
        } catch (MessagingException | MailException e) {
            throw new NotificationException("Failed to send email: " + e.getMessage(), e);
        }
    }
}
