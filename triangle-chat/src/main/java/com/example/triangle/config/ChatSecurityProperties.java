package com.example.triangle.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "chat.security")
public class ChatSecurityProperties {

    @NestedConfigurationProperty
    private final WriteLimit writeLimit = new WriteLimit();

    public WriteLimit getWriteLimit() {
        return writeLimit;
    }

    /**
     * Budget of state-changing REST calls (sending, editing, deleting, marking read) per client.
     */
    @Validated
    public static class WriteLimit {

        private boolean enabled = true;

        /**
         * Writes a client may burst before it has to wait for the window to refill.
         */
        @Min(1)
        private long burst = 120;

        /**
         * Time in which a drained budget refills completely.
         */
        @NotNull
        private Duration window = Duration.ofMinutes(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getBurst() {
            return burst;
        }

        public void setBurst(long burst) {
            this.burst = burst;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }
}
