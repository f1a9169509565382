package com.hermes.threads;

import com.hermes.shared.model.ChatMessage;
import com.hermes.shared.model.EmailMessage;
import com.hermes.shared.model.SmsMessage;
import com.hermes.shared.model.ThreadMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.stream.Stream;

/**
 * Derives the 8-character thread id that groups the messages of one conversation.
 * Deterministic for any message that carries correlation metadata; a fresh random
 * id otherwise, so uncorrelated messages still get a session.
 */
public class ThreadIdResolver {

    private static final Logger log = LoggerFactory.getLogger(ThreadIdResolver.class);

    static final int THREAD_ID_LENGTH = 8;
    private static final String FALLBACK_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    private final SecureRandom random = new SecureRandom();

    public String extractThreadId(ThreadMessage message) {
        switch (message.channel()) {
            case EMAIL:
                return fromEmail((EmailMessage) message);
            case SMS:
                return fromSms((SmsMessage) message);
            case CHAT:
                return fromChat((ChatMessage) message);
            default:
                return newThreadId();
        }
    }

    private String fromEmail(EmailMessage email) {
        // first References entry is the conversation root
        if (!email.references().isEmpty() && present(email.references().get(0))) {
            log.debug("Using References root {}", email.references().get(0));
            return hash(email.references().get(0));
        }
        if (present(email.inReplyTo())) {
            log.debug("Using In-Reply-To {}", email.inReplyTo());
            return hash(email.inReplyTo());
        }
        if (present(email.messageId())) {
            log.debug("Starting thread from Message-ID {}", email.messageId());
            return hash(email.messageId());
        }
        return newThreadId();
    }

    private String fromSms(SmsMessage sms) {
        if (present(sms.conversationId())) {
            return hash(sms.conversationId());
        }
        var participants = Stream.of(sms.from(), sms.to())
                .filter(ThreadIdResolver::present)
                .map(String::trim)
                .sorted()
                .toList();
        if (participants.isEmpty()) {
            return newThreadId();
        }
        return hash("sms:" + String.join(":", participants));
    }

    private String fromChat(ChatMessage chat) {
        if (present(chat.threadId())) {
            return hash(chat.threadId());
        }
        if (present(chat.messageId())) {
            return hash(chat.messageId());
        }
        return newThreadId();
    }

    static String hash(String correlationId) {
        var clean = stripAngleBrackets(correlationId.trim());
        var digest = sha256(clean.getBytes(StandardCharsets.UTF_8));
        var id = Base64.getUrlEncoder().withoutPadding().encodeToString(digest).substring(0, THREAD_ID_LENGTH);
        log.debug("Hashed {} to {}", clean, id);
        return id;
    }

    static String stripAngleBrackets(String id) {
        var start = id.startsWith("<") ? 1 : 0;
        var end = id.endsWith(">") && id.length() > start ? id.length() - 1 : id.length();
        return id.substring(start, end);
    }

    String newThreadId() {
        var sb = new StringBuilder(THREAD_ID_LENGTH);
        for (int i = 0; i < THREAD_ID_LENGTH; i++) {
            sb.append(FALLBACK_ALPHABET.charAt(random.nextInt(FALLBACK_ALPHABET.length())));
        }
        log.debug("No correlation metadata, generated thread {}", sb);
        return sb.toString();
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
