package io.github.yok.cdflib.util;

/**
 * Raised when a mail message is incomplete or cannot be sent.
 *
 * @author Yasuharu.Okawauchi
 */
public class MailMessageException extends Exception {

    private static final long serialVersionUID = 1L;

    public MailMessageException(String message) {
        super(message);
    }

    public MailMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
