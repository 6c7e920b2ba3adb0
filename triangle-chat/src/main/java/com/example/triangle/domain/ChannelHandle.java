package com.example.triangle.domain;

/**
 * A caller's way of naming a channel before it is canonicalized.
 */
public interface ChannelHandle {

    static ChannelHandle group() {
        return Group.INSTANCE;
    }

    static ChannelHandle direct(String first, String second) {
        return new Direct(first, second);
    }

    static ChannelHandle raw(String name) {
        return new Raw(name);
    }

    /** The channel shared by every participant. */
    enum Group implements ChannelHandle {
        INSTANCE
    }

    /** A direct-message channel; argument order does not matter. */
    record Direct(String first, String second) implements ChannelHandle {
    }

    /** A name used verbatim. */
    record Raw(String name) implements ChannelHandle {
    }
}
