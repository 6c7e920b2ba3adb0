package com.example.triangle.controller;

import com.example.triangle.domain.Channel;
import com.example.triangle.domain.ChatMessage;
import com.example.triangle.domain.MessageQuery;
import com.example.triangle.domain.MessageType;
import com.example.triangle.domain.ReadPosition;
import com.example.triangle.dto.EditMessageRequest;
import com.example.triangle.dto.MarkReadRequest;
import com.example.triangle.dto.SendMessageRequest;
import com.example.triangle.dto.SystemMessageRequest;
import com.example.triangle.dto.UnreadCountResponse;
import com.example.triangle.service.ChatService;
import com.example.triangle.service.exception.ValidationException;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/channels")
public class ChannelController {

    private final ChatService chatService;

    public ChannelController(ChatService chatService) {
        this.chatService = chatService;
    }

    @GetMapping
    public ResponseEntity<List<Channel>> listChannels(@RequestParam(required = false) String participant) {
        List<Channel> channels = StringUtils.hasText(participant)
                ? chatService.listChannelsFor(participant)
                : chatService.listChannels();
        return ResponseEntity.ok(channels);
    }

    @GetMapping("/{channel}")
    public ResponseEntity<Channel> getChannel(@PathVariable String channel) {
        return ResponseEntity.ok(chatService.getChannel(channel));
    }

    @GetMapping("/{channel}/messages")
    public ResponseEntity<List<ChatMessage>> getMessages(
            @PathVariable String channel,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant before,
            @RequestParam(required = false) Integer limit,
            @RequestParam(defaultValue = "false") boolean includeDeleted) {
        MessageQuery query = MessageQuery.builder()
                .since(since)
                .before(before)
                .limit(limit)
                .includeDeleted(includeDeleted)
                .build();
        return ResponseEntity.ok(chatService.getMessages(channel, query));
    }

    @PostMapping("/{channel}/messages")
    public ResponseEntity<ChatMessage> postMessage(
            @PathVariable String channel,
            @Valid @RequestBody SendMessageRequest request) {
        MessageType type = StringUtils.hasText(request.getType())
                ? MessageType.fromValue(request.getType())
                        .orElseThrow(() -> new ValidationException("type", "unsupported message type: " + request.getType()))
                : MessageType.TEXT;
        ChatMessage message = chatService.sendMessage(
                channel, request.getSender(), request.getContent(), type, request.getMetadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(message);
    }

    @PostMapping("/{channel}/system")
    public ResponseEntity<ChatMessage> postSystemMessage(
            @PathVariable String channel,
            @RequestBody SystemMessageRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(chatService.broadcastSystem(channel, request.getContent()));
    }

    @PatchMapping("/{channel}/messages/{messageId}")
    public ResponseEntity<ChatMessage> editMessage(
            @PathVariable String channel,
            @PathVariable String messageId,
            @RequestBody EditMessageRequest request) {
        return ResponseEntity.ok(chatService.editMessage(channel, messageId, request.getContent()));
    }

    @DeleteMapping("/{channel}/messages/{messageId}")
    public ResponseEntity<ChatMessage> deleteMessage(@PathVariable String channel, @PathVariable String messageId) {
        return ResponseEntity.ok(chatService.deleteMessage(channel, messageId));
    }

    @GetMapping("/{channel}/unread")
    public ResponseEntity<List<ChatMessage>> getUnread(
            @PathVariable String channel,
            @RequestParam String participant) {
        return ResponseEntity.ok(chatService.getUnread(channel, participant));
    }

    @GetMapping("/{channel}/unread/count")
    public ResponseEntity<UnreadCountResponse> unreadCount(
            @PathVariable String channel,
            @RequestParam String participant) {
        return ResponseEntity.ok(UnreadCountResponse.builder()
                .channel(channel)
                .participant(participant)
                .unread(chatService.unreadCount(channel, participant))
                .build());
    }

    @PostMapping("/{channel}/read")
    public ResponseEntity<ReadPosition> markRead(
            @PathVariable String channel,
            @Valid @RequestBody MarkReadRequest request) {
        return ResponseEntity.ok(chatService.markRead(channel, request.getParticipant(), request.getMessageId()));
    }

    @GetMapping("/read-positions")
    public ResponseEntity<Map<String, Instant>> readPositions(@RequestParam String participant) {
        return ResponseEntity.ok(chatService.getReadPositions(participant));
    }
}
