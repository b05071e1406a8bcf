package io.github.yok.cdflib.config;

import jakarta.mail.Authenticator;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import java.util.Properties;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * SMTP server used to send mail.
 *
 * <pre>
 * cdf:
 *   mail:
 *     host: smtp.example.com
 *     port: 587
 *     username: mailer
 *     password: secret
 *     start-tls: true
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "cdf.mail")
@Data
public class MailSettings {

    // SMTP host name or address
    private String host = "localhost";
    // SMTP port
    private int port = 25;
    // Login user; blank disables authentication
    private String username;
    // Login password
    private String password;
    // Upgrade the connection with STARTTLS
    private boolean startTls;
    // Connect and read timeout in milliseconds; 0 leaves the provider default
    private int timeoutMillis;

    /**
     * Creates a mail session for these settings.
     *
     * @return session sending through the configured server
     * @throws IllegalArgumentException if the host is blank or the port is out of range
     */
    public Session toSession() {
        if (StringUtils.isBlank(host)) {
            throw new IllegalArgumentException("Missing SMTP host");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid SMTP port: " + port);
        }
        Properties props = new Properties();
        props.setProperty("mail.transport.protocol", "smtp");
        props.setProperty("mail.smtp.host", host);
        props.setProperty("mail.smtp.port", Integer.toString(port));
        props.setProperty("mail.smtp.starttls.enable", Boolean.toString(startTls));
        if (timeoutMillis > 0) {
            props.setProperty("mail.smtp.connectiontimeout", Integer.toString(timeoutMillis));
            props.setProperty("mail.smtp.timeout", Integer.toString(timeoutMillis));
        }
        if (StringUtils.isBlank(username)) {
            return Session.getInstance(props);
        }
        props.setProperty("mail.smtp.auth", "true");
        String user = username;
        String pass = password == null ? "" : password;
        return Session.getInstance(props, new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(user, pass);
            }
        });
    }

    @Override
    public String toString() {
        // password is never rendered
        return String.format("MailSettings(%s@%s:%d)", username, host, port);
    }
}
