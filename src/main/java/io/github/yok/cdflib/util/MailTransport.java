package io.github.yok.cdflib.util;

import jakarta.mail.MessagingException;
import jakarta.mail.Transport;
import jakarta.mail.internet.MimeMessage;

/**
 * Hands a composed message to the mail server.
 */
@FunctionalInterface
public interface MailTransport {

    /**
     * Sends through the transport configured on the message's session.
     */
    MailTransport SMTP = Transport::send;

    void send(MimeMessage message) throws MessagingException;
}
