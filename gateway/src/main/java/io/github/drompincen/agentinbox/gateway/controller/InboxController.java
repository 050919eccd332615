package io.github.drompincen.agentinbox.gateway.controller;

import io.github.drompincen.agentinbox.protocol.api.CreateThreadRequest;
import io.github.drompincen.agentinbox.protocol.api.MessageDto;
import io.github.drompincen.agentinbox.protocol.api.MessageRole;
import io.github.drompincen.agentinbox.protocol.api.SendMessageRequest;
import io.github.drompincen.agentinbox.protocol.api.ThreadDto;
import io.github.drompincen.agentinbox.protocol.api.UpdateThreadStatusRequest;
import io.github.drompincen.agentinbox.runtime.inbox.InboxService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/inbox/threads")
public class InboxController {

    static final String USER_HEADER = "X-User-Id";
    static final String DEFAULT_USER = "local-user";

    private final InboxService inboxService;

    public InboxController(InboxService inboxService) {
        this.inboxService = inboxService;
    }

    @GetMapping
    public List<ThreadDto> list(@RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
                                @RequestParam(defaultValue = "false") boolean includeArchived) {
        return inboxService.listThreads(userId, includeArchived);
    }

    @PostMapping
    public ResponseEntity<ThreadDto> create(@RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
                                            @RequestBody CreateThreadRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(inboxService.createThread(userId, request));
    }

    @GetMapping("/{threadId}")
    public ThreadDto get(@PathVariable String threadId) {
        return inboxService.getThread(threadId);
    }

    @DeleteMapping("/{threadId}")
    public ResponseEntity<Void> delete(@PathVariable String threadId,
                                       @RequestParam(defaultValue = "false") boolean permanent) {
        inboxService.deleteThread(threadId, permanent);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{threadId}/messages")
    public List<MessageDto> messages(@PathVariable String threadId) {
        return inboxService.listMessages(threadId);
    }

    /** Accepted once the message is stored; the agent's reply streams over the WebSocket. */
    @PostMapping("/{threadId}/messages")
    public ResponseEntity<MessageDto> send(@RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
                                           @PathVariable String threadId,
                                           @RequestBody SendMessageRequest request) {
        MessageDto stored = inboxService.postUserMessage(threadId, userId, request.content(), parseRole(request.role()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(stored);
    }

    @PostMapping("/{threadId}/read")
    public ThreadDto markRead(@PathVariable String threadId) {
        return inboxService.markRead(threadId);
    }

    @PostMapping("/{threadId}/unread")
    public ThreadDto markUnread(@PathVariable String threadId) {
        return inboxService.markUnread(threadId);
    }

    @PatchMapping("/{threadId}/status")
    public ThreadDto updateStatus(@PathVariable String threadId, @RequestBody UpdateThreadStatusRequest request) {
        if (request.status() == null) {
            throw new IllegalArgumentException("status is required");
        }
        return inboxService.updateStatus(threadId, request.status());
    }

    static MessageRole parseRole(String role) {
        if (role == null || role.isBlank()) return MessageRole.USER;
        try {
            return MessageRole.valueOf(role.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown role: " + role);
        }
    }
}
