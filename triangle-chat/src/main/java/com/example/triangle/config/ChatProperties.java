package com.example.triangle.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "chat")
public class ChatProperties {

    /**
     * Closed set of participant identifiers. One group channel and one direct channel per pair are seeded from it.
     */
    @NotEmpty
    private List<String> participants = new ArrayList<>(List.of("key", "splntrb", "stream"));

    @NestedConfigurationProperty
    private final Messages messages = new Messages();

    @NestedConfigurationProperty
    private final Broadcast broadcast = new Broadcast();

    @NestedConfigurationProperty
    private final Kafka kafka = new Kafka();

    @NestedConfigurationProperty
    private final Redis redis = new Redis();

    @NestedConfigurationProperty
    private final SocketIo socketio = new SocketIo();

    public List<String> getParticipants() {
        return participants;
    }

    public void setParticipants(List<String> participants) {
        this.participants = participants;
    }

    public Messages getMessages() {
        return messages;
    }

    public Broadcast getBroadcast() {
        return broadcast;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Redis getRedis() {
        return redis;
    }

    public SocketIo getSocketio() {
        return socketio;
    }

    @Validated
    public static class Messages {

        /**
         * Longest accepted message content, in characters.
         */
        @Min(1)
        private int maxContentLength = 50_000;

        /**
         * Number of messages returned by a history query that does not set a limit.
         */
        @Min(1)
        private int defaultPageSize = 50;

        public int getMaxContentLength() {
            return maxContentLength;
        }

        public void setMaxContentLength(int maxContentLength) {
            this.maxContentLength = maxContentLength;
        }

        public int getDefaultPageSize() {
            return defaultPageSize;
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
        }
    }

    public enum RelayMode {
        NONE,
        REDIS
    }

    @Validated
    public static class Broadcast {

        /**
         * Events buffered per polling subscriber before the oldest ones are dropped.
         */
        @Min(1)
        private int bufferSize = 256;

        /**
         * Transport that mirrors publishes to other instances. {@code NONE} keeps fan-out local to this instance.
         */
        private RelayMode relay = RelayMode.NONE;

        /**
         * Redis topic used when {@link #relay} is {@code REDIS}.
         */
        private String relayTopic = "triangle-chat:broadcast";

        public int getBufferSize() {
            return bufferSize;
        }

        public void setBufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
        }

        public RelayMode getRelay() {
            return relay;
        }

        public void setRelay(RelayMode relay) {
            this.relay = relay;
        }

        public String getRelayTopic() {
            return relayTopic;
        }

        public void setRelayTopic(String relayTopic) {
            this.relayTopic = relayTopic;
        }
    }

    @Validated
    public static class Kafka {

        /**
         * Mirror message events to Kafka for downstream consumers.
         */
        private boolean enabled = false;

        /**
         * Kafka topic to publish chat message events.
         */
        private String messageTopic = "chat.messages";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getMessageTopic() {
            return messageTopic;
        }

        public void setMessageTopic(String messageTopic) {
            this.messageTopic = messageTopic;
        }
    }

    @Validated
    public static class Redis {

        private String address = "redis://localhost:6379";

        private String password;

        private int database = 0;

        public String getAddress() {
            return address;
        }

        public void setAddress(String address) {
            this.address = address;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public int getDatabase() {
            return database;
        }

        public void setDatabase(int database) {
            this.database = database;
        }
    }

    @Validated
    public static class SocketIo {

        private boolean enabled = false;

        private String host = "0.0.0.0";

        private int port = 9094;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }
    }
}
