package io.github.yok.cdflib.util;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import jakarta.mail.Address;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.stream.Collectors;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.WordUtils;

/**
 * Plain-text mail with a single recipient.
 *
 * <p>
 * The body gets the signature appended after a line break and is wrapped at
 * {@value #WRAP_COLUMN} columns. Subject, body, sender and recipient must be set before sending.
 * </p>
 *
 * <pre>
 * MailMessage mail = new MailMessage(settings.toSession());
 * mail.setFrom("noreply@example.com", "Example");
 * mail.setTo("bob@example.com");
 * mail.setSubject("Welcome");
 * mail.setBody("Your account is ready.");
 * mail.send();
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Getter
public class MailMessage {

    /**
     * Signature used until {@link #setSignature(String)} is called.
     */
    public static final String DEFAULT_SIGNATURE = "-- \n"
            + "This e-mail has been automatically generated. Any direct reply may not be delivered.";

    /**
     * Column at which body lines are wrapped.
     */
    public static final int WRAP_COLUMN = 70;

    @Getter(AccessLevel.NONE)
    private final Session session;
    @Getter(AccessLevel.NONE)
    private final MailTransport transport;

    private String subject;
    private String body;
    private InternetAddress to;
    private InternetAddress from;
    private InternetAddress replyTo;
    // Sender header, where bounces are reported
    private InternetAddress bounce;
    private String signature = DEFAULT_SIGNATURE;

    public MailMessage(Session session) {
        this(session, MailTransport.SMTP);
    }

    /**
     * Creates a message sent through a custom transport.
     *
     * @param session mail session
     * @param transport sender of the composed message
     */
    public MailMessage(Session session, MailTransport transport) {
        this.session = Preconditions.checkNotNull(session, "session must not be null");
        this.transport = Preconditions.checkNotNull(transport, "transport must not be null");
    }

    public void setSubject(String subject) {
        this.subject = StringUtils.trim(subject);
    }

    public void setBody(String body) {
        this.body = StringUtils.trim(body);
    }

    public void setTo(String address) {
        setTo(address, null);
    }

    public void setTo(String address, String name) {
        this.to = toAddress(address, name);
    }

    public void setFrom(String address) {
        setFrom(address, null);
    }

    public void setFrom(String address, String name) {
        this.from = toAddress(address, name);
    }

    public void setReplyTo(String address) {
        setReplyTo(address, null);
    }

    /**
     * Sets the {@code Reply-To} address.
     *
     * @param address mail address
     * @param name display name; {@code null} for none
     * @throws IllegalArgumentException if the address is blank or malformed
     */
    public void setReplyTo(String address, String name) {
        this.replyTo = toAddress(address, name);
    }

    public void setBounce(String address) {
        this.bounce = toAddress(address, null);
    }

    /**
     * Replaces the signature.
     *
     * @param signature signature text; {@code null} for none
     */
    public void setSignature(String signature) {
        this.signature = StringUtils.trim(signature);
    }

    /**
     * Builds the MIME message without sending it.
     *
     * @return composed message
     * @throws MailMessageException if a required part is missing or the message cannot be built
     */
    public MimeMessage toMimeMessage() throws MailMessageException {
        if (StringUtils.isAnyEmpty(subject, body) || to == null || from == null) {
            throw new MailMessageException(
                    "Mail message requires a subject, body, sender and recipient");
        }
        try {
            MimeMessage message = new MimeMessage(session);
            message.setFrom(from);
            if (replyTo != null) {
                message.setReplyTo(new Address[] {replyTo});
            }
            if (bounce != null) {
                message.setSender(bounce);
            }
            message.setRecipient(Message.RecipientType.TO, to);
            message.setSubject(subject, StandardCharsets.UTF_8.name());
            message.setText(composeBody(), StandardCharsets.UTF_8.name());
            message.setSentDate(new Date());
            return message;
        } catch (MessagingException e) {
            throw new MailMessageException("Cannot compose mail message", e);
        }
    }

    /**
     * Composes and sends the message.
     *
     * @throws MailMessageException if a required part is missing or the server rejects the message
     */
    public void send() throws MailMessageException {
        MimeMessage message = toMimeMessage();
        try {
            transport.send(message);
        } catch (MessagingException e) {
            throw new MailMessageException("Cannot send mail message", e);
        }
        log.debug("Mail sent. to={}, subject={}", to, subject);
    }

    String composeBody() {
        String text = body.replace("\r\n", "\n");
        if (signature != null) {
            text = text + "\n" + signature.replace("\r\n", "\n");
        }
        // long words are kept whole
        return Splitter.on('\n').splitToStream(text)
                .map(line -> WordUtils.wrap(line, WRAP_COLUMN, "\n", false))
                .collect(Collectors.joining("\n"));
    }

    private static InternetAddress toAddress(String address, String name) {
        Preconditions.checkArgument(StringUtils.isNotBlank(address),
                "Mail address must not be blank");
        try {
            InternetAddress parsed = new InternetAddress(address.trim(), true);
            if (name != null) {
                parsed.setPersonal(name, StandardCharsets.UTF_8.name());
            }
            return parsed;
        } catch (AddressException | UnsupportedEncodingException e) {
            throw new IllegalArgumentException("Invalid mail address: " + address, e);
        }
    }
}
