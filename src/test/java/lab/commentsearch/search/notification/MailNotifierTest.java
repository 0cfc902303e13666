package lab.commentsearch.search.notification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import jakarta.mail.Message;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import java.util.Properties;
import lab.commentsearch.search.config.CommentSearchProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;

class MailNotifierTest {

    private final JavaMailSender mailSender = mock(JavaMailSender.class);
    private MailNotifier notifier;
    private MimeMessage message;

    @BeforeEach
    void setUp() {
        message = new MimeMessage(Session.getInstance(new Properties()));
        when(mailSender.createMimeMessage()).thenReturn(message);
        CommentSearchProperties properties = new CommentSearchProperties();
        properties.setMailFrom("search@example.com");
        notifier = new MailNotifier(mailSender, properties);
    }

    @Test
    void sendsHtmlMailToRecipient() throws Exception {
        assertTrue(notifier.send("a@b.com", "Results", "<p>hi</p>"));

        verify(mailSender).send(message);
        assertEquals("a@b.com", message.getRecipients(Message.RecipientType.TO)[0].toString());
        assertEquals("search@example.com", message.getFrom()[0].toString());
        assertEquals("Results", message.getSubject());
    }

    @Test
    void transportFailureReturnsFalse() {
        doThrow(new MailSendException("connection refused")).when(mailSender).send(any(MimeMessage.class));

        assertFalse(notifier.send("a@b.com", "Results", "<p>hi</p>"));
    }
}
