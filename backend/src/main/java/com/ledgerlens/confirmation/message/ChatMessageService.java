package com.ledgerlens.confirmation.message;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Delivers assistant messages to users: through the user's realtime channel when one is registered, otherwise
 * into a per-user mailbox drained on the user's next request. A channel that throws is dropped and the message
 * goes to the mailbox.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChatMessageService {

    static final long CONFIRMATION_TIMEOUT_MS = 24L * 60 * 60 * 1000;

    private final Map<String, RealtimeChannel> realtimeChannels = new ConcurrentHashMap<>();
    private final Map<String, Queue<ChatMessage>> mailboxes = new ConcurrentHashMap<>();
    private final Clock clock;

    /** Last registration wins. */
    public void registerRealtimeChannel(String userId, RealtimeChannel channel) {
        RealtimeChannel previous = realtimeChannels.put(userId, channel);
        log.info("Realtime channel registered for user {}{}", userId, previous != null ? " (replaced)" : "");
    }

    /** Removes the channel only if it is still the registered one, so a stale stream cannot evict a newer one. */
    public void unregisterRealtimeChannel(String userId, RealtimeChannel channel) {
        if (realtimeChannels.remove(userId, channel)) {
            log.info("Realtime channel unregistered for user {}", userId);
        }
    }

    public boolean hasRealtimeChannel(String userId) {
        return realtimeChannels.containsKey(userId);
    }

    public void sendMessage(String userId, ChatMessageType type, String content, Map<String, Object> metadata) {
        ChatMessage message = new ChatMessage(UUID.randomUUID().toString(), userId, type, ChatMessage.ASSISTANT_ROLE,
                content, Instant.now(clock), metadata);
        RealtimeChannel channel = realtimeChannels.get(userId);
        if (channel != null) {
            try {
                channel.deliver(message);
                log.debug("Message {} ({}) delivered live to user {}", message.id(), type, userId);
                return;
            } catch (Exception e) {
                log.warn("Realtime delivery to user {} failed ({}); falling back to mailbox", userId, e.getMessage());
                realtimeChannels.remove(userId, channel);
            }
        }
        mailboxes.computeIfAbsent(userId, k -> new ConcurrentLinkedQueue<>()).add(message);
        log.debug("Message {} ({}) stored in mailbox of user {}", message.id(), type, userId);
    }

    public void sendConfirmationRequest(String userId, String content, String processingLogId,
                                        Map<String, Object> transactionData) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("processingLogId", processingLogId);
        metadata.put("transactionData", transactionData);
        metadata.put("requiresConfirmation", true);
        metadata.put("confirmationTimeout", CONFIRMATION_TIMEOUT_MS);
        sendMessage(userId, ChatMessageType.CONFIRMATION_REQUEST, content, metadata);
    }

    public void sendFileUploadConfirmation(String userId, String fileName) {
        sendMessage(userId, ChatMessageType.FILE_UPLOAD_SUCCESS,
                "✅ **Archivo subido exitosamente**\n\n📄 He recibido tu documento: `" + fileName
                        + "`\n\n🔍 Analizando contenido... Te notificaré cuando termine el análisis.",
                Map.of("fileName", fileName));
    }

    public void sendTransactionConfirmationResult(String userId, boolean confirmed, String content) {
        sendMessage(userId, ChatMessageType.TRANSACTION_CONFIRMED, content, Map.of("confirmed", confirmed));
    }

    public void sendErrorMessage(String userId, String error) {
        sendMessage(userId, ChatMessageType.ERROR,
                "❌ **Error de procesamiento**\n\n" + error + "\n\nPor favor, intenta subir el documento nuevamente.",
                Map.of());
    }

    /** Drains the mailbox; messages come back in delivery order. */
    public List<ChatMessage> getPendingMessages(String userId) {
        Queue<ChatMessage> mailbox = mailboxes.get(userId);
        List<ChatMessage> drained = new ArrayList<>();
        if (mailbox == null) {
            return drained;
        }
        ChatMessage next;
        while ((next = mailbox.poll()) != null) {
            drained.add(next);
        }
        if (!drained.isEmpty()) {
            log.debug("Drained {} pending message(s) for user {}", drained.size(), userId);
        }
        return drained;
    }

    public boolean hasPendingMessages(String userId) {
        Queue<ChatMessage> mailbox = mailboxes.get(userId);
        return mailbox != null && !mailbox.isEmpty();
    }
}
