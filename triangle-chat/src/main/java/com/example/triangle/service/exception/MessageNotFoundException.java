package com.example.triangle.service.exception;

public class MessageNotFoundException extends ServiceException {

    private final String messageId;

    public MessageNotFoundException(String messageId) {
        super(ChatErrorCode.MESSAGE_NOT_FOUND, "Message not found: " + messageId);
        this.messageId = messageId;
    }

    private MessageNotFoundException(String messageId, String channelName) {
        super(ChatErrorCode.MESSAGE_CHANNEL_MISMATCH,
                "Message %s does not belong to channel %s".formatted(messageId, channelName));
        this.messageId = messageId;
    }

    /**
     * The message exists but belongs to a different channel than the one addressed.
     */
    public static MessageNotFoundException notInChannel(String messageId, String channelName) {
        return new MessageNotFoundException(messageId, channelName);
    }

    public String getMessageId() {
        return messageId;
    }
}
