package io.remindrunr.channel;

import io.remindrunr.config.NotificationProperties;
import io.remindrunr.dispatch.DeliveryException;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Sends reminders as plaintext + HTML e-mail.
 * The mail sender is optional: without SMTP configuration every send fails cleanly.
 */
@Component
public class EmailChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(EmailChannel.class);
    static final String NAME = "email";

    private final NotificationProperties.Email config;
    private final JavaMailSender mailSender;

    @Autowired
    public EmailChannel(NotificationProperties properties,
                        @Autowired(required = false) JavaMailSender mailSender) {
        this.config = properties.email();
        this.mailSender = mailSender;
        if (mailSender == null) {
            log.warn("SMTP configuration not found. Email notifications will fail until spring.mail.host is set");
        }
    }

    @Override
    public void send(Notification notification) {
        if (mailSender == null) {
            throw new DeliveryException("Email transport not configured");
        }
        if (!StringUtils.hasText(config.to())) {
            throw new DeliveryException("EMAIL_TO not configured");
        }

        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");
            if (StringUtils.hasText(config.from())) {
                helper.setFrom(config.from());
            }
            helper.setTo(config.to());
            helper.setSubject(NotificationTemplates.subject(notification));
            helper.setText(NotificationTemplates.plainText(notification), NotificationTemplates.html(notification));
            mailSender.send(message);
        } catch (MessagingException | MailException e) {
            throw new DeliveryException("Email error: " + e.getMessage(), e);
        }
        log.info("Email sent to {}: {}", config.to(), notification.title());
    }

    @Override
    public String getName() {
        return NAME;
    }
}
