package org.example.stackanalysis.service.impl;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import org.example.stackanalysis.model.ReportEmail;
import org.example.stackanalysis.service.ReportMailer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Date;

@Service
@RequiredArgsConstructor
public class ReportMailerImpl implements ReportMailer {

    private static final Logger logger = LoggerFactory.getLogger(ReportMailerImpl.class);

    private final JavaMailSender mailSender;

    /** Should be a real mailbox so that users can reply. */
    @Value("${analysis.mail.from:}")
    private String fromEmail;

    @Override
    public void sendReport(ReportEmail email, String recipient) {
        if (fromEmail == null || fromEmail.isBlank()) {
            logger.warn("analysis.mail.from is not configured, results for {} not sent", recipient);
            return;
        }

        MimeMessage message = mailSender.createMimeMessage();
        try {
            MimeMessageHelper helper = new MimeMessageHelper(message, true, StandardCharsets.UTF_8.name());
            helper.setFrom(fromEmail);
            helper.setTo(recipient);
            helper.setSentDate(new Date());
            helper.setSubject(email.getSubject());
            helper.setText(email.getBody());
            String csv = email.getAttachmentText();
            if (csv != null && !csv.isEmpty()) {
                helper.addAttachment(email.getAttachmentName(),
                        new ByteArrayResource(csv.getBytes(StandardCharsets.UTF_8)), "text/csv");
            }
        } catch (MessagingException e) {
            throw new MailPreparationException("Cannot build results message for " + recipient, e);
        }
        mailSender.send(message);
        logger.info("Results e-mailed to {}", recipient);
    }
}
