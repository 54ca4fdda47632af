package com.ledgerlens.api.controller;

import com.ledgerlens.api.dto.UserReplyRequest;
import com.ledgerlens.api.dto.UserReplyResponse;
import com.ledgerlens.confirmation.ConfirmationService;
import com.ledgerlens.confirmation.message.ChatMessage;
import com.ledgerlens.confirmation.message.ChatMessageService;
import com.ledgerlens.confirmation.message.RealtimeChannel;
import com.ledgerlens.query.ProcessingLogView;
import com.ledgerlens.query.ProcessingQueryService;
import com.ledgerlens.query.TransactionView;
import com.ledgerlens.queue.QueueService;
import com.ledgerlens.queue.job.ConfirmationResponseJob;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Per-user chat surface: mailbox drain, live SSE stream, yes/no replies, stored transactions.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class UserChatController {

    private final ChatMessageService chatMessageService;
    private final ConfirmationService confirmationService;
    private final QueueService queueService;
    private final ProcessingQueryService processingQueryService;
    private final Clock clock;

    @GetMapping("/{userId}/messages")
    public List<ChatMessage> drainMessages(@PathVariable String userId) {
        return chatMessageService.getPendingMessages(userId);
    }

    /**
     * Live channel. Mailbox backlog is sent first; the channel is unregistered when the client goes away.
     */
    @GetMapping(path = "/{userId}/messages/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ChatMessage>> streamMessages(@PathVariable String userId) {
        Sinks.Many<ChatMessage> sink = Sinks.many().unicast().onBackpressureBuffer();
        RealtimeChannel channel = message -> {
            Sinks.EmitResult result;
            synchronized (sink) {
                result = sink.tryEmitNext(message);
            }
            if (result.isFailure()) {
                throw new IllegalStateException("Stream for user " + userId + " not accepting messages: " + result);
            }
        };
        chatMessageService.registerRealtimeChannel(userId, channel);
        List<ChatMessage> backlog = chatMessageService.getPendingMessages(userId);
        return Flux.fromIterable(backlog)
                .concatWith(sink.asFlux())
                .map(m -> ServerSentEvent.builder(m).id(m.id()).event(m.type().wireName()).build())
                .doFinally(signal -> {
                    log.debug("Stream for user {} ended ({})", userId, signal);
                    chatMessageService.unregisterRealtimeChannel(userId, channel);
                });
    }

    /**
     * A yes/no reply is queued for the confirmation worker (202). Anything else is not handled here (200).
     */
    @PostMapping("/{userId}/messages")
    public ResponseEntity<UserReplyResponse> reply(@PathVariable String userId,
                                                   @Valid @RequestBody UserReplyRequest request) {
        boolean targeted = request.processingLogId() != null && !request.processingLogId().isBlank();
        if (!targeted && !confirmationService.hasPendingConfirmation(userId)) {
            return ResponseEntity.ok(UserReplyResponse.notAConfirmation());
        }
        Optional<Boolean> answer = confirmationService.parseConfirmation(request.message());
        if (answer.isEmpty()) {
            return ResponseEntity.ok(UserReplyResponse.notAConfirmation());
        }
        String jobId = queueService.addConfirmationResponseJob(ConfirmationResponseJob.create(userId, answer.get(),
                request.message(), targeted ? request.processingLogId().trim() : null, Instant.now(clock)));
        return ResponseEntity.accepted().body(new UserReplyResponse(true, answer.get(), jobId));
    }

    @GetMapping("/{userId}/transactions")
    public List<TransactionView> transactions(@PathVariable String userId,
                                              @RequestParam(required = false) Integer limit) {
        return processingQueryService.recentTransactions(userId, limit);
    }

    @GetMapping("/{userId}/pending-confirmations")
    public List<ProcessingLogView> pendingConfirmations(@PathVariable String userId) {
        return processingQueryService.awaitingConfirmation(userId);
    }
}
