package com.example.triangle.service.exception;

public class ChannelNotFoundException extends ServiceException {

    private final String channelName;

    public ChannelNotFoundException(String channelName) {
        super(ChatErrorCode.CHANNEL_NOT_FOUND, "Channel not found: " + channelName);
        this.channelName = channelName;
    }

    public String getChannelName() {
        return channelName;
    }
}
