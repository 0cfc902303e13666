package lab.commentsearch.search.notification;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lab.commentsearch.search.config.CommentSearchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

@Component
public class MailNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(MailNotifier.class);
    private final JavaMailSender mailSender;
    private final CommentSearchProperties properties;

    public MailNotifier(JavaMailSender mailSender, CommentSearchProperties properties) {
        this.mailSender = mailSender;
        this.properties = properties;
    }

    @Override
    public boolean send(String email, String subject, String body) {
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, false, "UTF-8");
            if (properties.getMailFrom() != null && !properties.getMailFrom().isBlank()) {
                helper.setFrom(properties.getMailFrom());
            }
            helper.setTo(email);
            helper.setSubject(subject);
            helper.setText(body, true);
            mailSender.send(message);
            log.info("Report mail sent to={}", email);
            return true;
        } catch (MessagingException | MailException ex) {
            log.warn("Report mail not sent to={} message={}", email, ex.getMessage());
            return false;
        }
    }
}
