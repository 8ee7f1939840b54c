package com.mike.reportpopulator.service.mail;

import com.mike.reportpopulator.config.ImapProperties;
import com.mike.reportpopulator.dto.InboundEmail;
import com.mike.reportpopulator.exception.MailSourceException;
import jakarta.mail.Address;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.search.ComparisonTerm;
import jakarta.mail.search.ReceivedDateTerm;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Properties;

@Component
@RequiredArgsConstructor
@Slf4j
public class ImapMailSource implements MailSource {

    private static final String BLOCK_ELEMENTS = "br, p, div, tr, li, h1, h2, h3, h4, h5, h6";

    private final ImapProperties props;

    @Override
    public List<InboundEmail> fetchReceivedAfter(LocalDateTime since) {
        Session session = Session.getInstance(sessionProperties());
        List<InboundEmail> result = new ArrayList<>();

        try (Store store = session.getStore(props.protocol())) {
            store.connect(props.host(), props.port() == null ? -1 : props.port(), props.username(), props.password());

            Folder folder = store.getFolder(props.folder());
            folder.open(Folder.READ_ONLY);
            try {
                // IMAP compares dates only, so the exact cut-off is applied again below.
                Message[] messages = since == null
                        ? folder.getMessages()
                        : folder.search(new ReceivedDateTerm(ComparisonTerm.GE, toDate(since)));

                for (Message message : messages) {
                    InboundEmail email = toInboundEmail(message);
                    if (since != null && email.receivedAt() != null && !email.receivedAt().isAfter(since)) continue;
                    result.add(email);
                }
            } finally {
                folder.close(false);
            }
        } catch (MessagingException | IOException e) {
            throw new MailSourceException("Cannot read folder " + props.folder() + " on " + props.host(), e);
        }

        result.sort(Comparator.comparing(InboundEmail::receivedAt, Comparator.nullsLast(Comparator.naturalOrder())));
        log.info("ImapMailSource: fetched {} messages from {} since {}", result.size(), props.folder(), since);
        return result;
    }

    // Without these Jakarta Mail waits forever on a stalled server.
    Properties sessionProperties() {
        String prefix = "mail." + props.protocol() + ".";
        Properties session = new Properties();
        session.setProperty(prefix + "connectiontimeout", String.valueOf(props.connectionTimeout().toMillis()));
        session.setProperty(prefix + "timeout", String.valueOf(props.timeout().toMillis()));
        return session;
    }

    InboundEmail toInboundEmail(Message message) throws MessagingException, IOException {
        LocalDateTime receivedAt = toLocalDateTime(
                message.getReceivedDate() != null ? message.getReceivedDate() : message.getSentDate());
        String sender = sender(message.getFrom());
        String subject = message.getSubject();

        String messageId = message instanceof MimeMessage mime ? mime.getMessageID() : null;
        if (messageId == null) {
            messageId = sender + "|" + receivedAt + "|" + subject;
        }

        return new InboundEmail(messageId, subject, sender, receivedAt, extractBody(message));
    }

    /**
     * Plain text when the message has it, otherwise the HTML part rendered as text
     * with one line per block element.
     */
    String extractBody(Part part) throws MessagingException, IOException {
        String plain = findContent(part, "text/plain");
        if (plain != null) return plain;

        String html = findContent(part, "text/html");
        return html == null ? "" : htmlToText(html);
    }

    private String findContent(Part part, String mimeType) throws MessagingException, IOException {
        if (Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition())) return null;

        if (part.isMimeType(mimeType)) {
            return String.valueOf(part.getContent());
        }
        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            for (int i = 0; i < multipart.getCount(); i++) {
                String found = findContent(multipart.getBodyPart(i), mimeType);
                if (found != null) return found;
            }
        }
        return null;
    }

    private String htmlToText(String html) {
        Document doc = Jsoup.parse(html);
        for (Element block : doc.select(BLOCK_ELEMENTS)) {
            block.after(new TextNode("\n"));
        }
        return doc.body().wholeText().strip();
    }

    private String sender(Address[] from) {
        if (from == null || from.length == 0) return null;
        if (from[0] instanceof InternetAddress address) return address.getAddress();
        return from[0].toString();
    }

    private static Date toDate(LocalDateTime value) {
        return Date.from(value.atZone(ZoneId.systemDefault()).toInstant());
    }

    private static LocalDateTime toLocalDateTime(Date value) {
        return value == null ? null : LocalDateTime.ofInstant(value.toInstant(), ZoneId.systemDefault());
    }
}
