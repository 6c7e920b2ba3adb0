package com.example.triangle.service.exception;

public class SenderNotInChannelException extends ServiceException {

    private final String sender;
    private final String channelName;

    public SenderNotInChannelException(String sender, String channelName) {
        super(ChatErrorCode.SENDER_NOT_IN_CHANNEL,
                "Sender %s is not a participant of channel %s".formatted(sender, channelName));
        this.sender = sender;
        this.channelName = channelName;
    }

    public String getSender() {
        return sender;
    }

    public String getChannelName() {
        return channelName;
    }
}
