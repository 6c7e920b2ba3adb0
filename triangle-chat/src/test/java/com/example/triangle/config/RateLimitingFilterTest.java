package com.example.triangle.config;

import com.example.triangle.domain.ParticipantRoster;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RateLimitingFilterTest {

    private static final ParticipantRoster ROSTER = ParticipantRoster.of("alice", "bob", "carol");

    private static RateLimitingFilter filter(long burst) {
        ChatSecurityProperties properties = new ChatSecurityProperties();
        properties.getWriteLimit().setBurst(burst);
        properties.getWriteLimit().setWindow(Duration.ofMinutes(1));
        return new RateLimitingFilter(properties, ROSTER);
    }

    private static MockHttpServletResponse send(
            RateLimitingFilter filter, String method, String address, String participant) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest(method, "/api/channels/group/messages");
        request.setRemoteAddr(address);
        if (participant != null) {
            request.addHeader(RateLimitingFilter.PARTICIPANT_HEADER, participant);
        }
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());
        return response;
    }

    @Test
    void rejectsWritesOverBudget() throws Exception {
        RateLimitingFilter filter = filter(2);

        MockHttpServletResponse first = send(filter, "POST", "10.0.0.1", "alice");
        assertEquals(200, first.getStatus());
        assertEquals("1", first.getHeader("X-RateLimit-Remaining"));
        assertEquals(200, send(filter, "POST", "10.0.0.1", "alice").getStatus());

        MockHttpServletResponse limited = send(filter, "POST", "10.0.0.1", "alice");
        assertEquals(429, limited.getStatus());
        long retryAfter = Long.parseLong(limited.getHeader("Retry-After"));
        assertTrue(retryAfter >= 1 && retryAfter <= 60);
        assertTrue(limited.getContentAsString().contains("too_many_requests"));
    }

    @Test
    void rotatingUnknownParticipantHeadersShareTheAddressBudget() throws Exception {
        RateLimitingFilter filter = filter(1);

        int accepted = 0;
        for (int i = 0; i < 50; i++) {
            if (send(filter, "POST", "10.0.0.1", "anyone" + i).getStatus() == 200) {
                accepted++;
            }
        }
        assertEquals(1, accepted);
        assertEquals(429, send(filter, "POST", "10.0.0.1", null).getStatus());
    }

    @Test
    void rosterParticipantsBehindOneAddressHaveSeparateBudgets() throws Exception {
        RateLimitingFilter filter = filter(1);

        assertEquals(200, send(filter, "POST", "10.0.0.1", "alice").getStatus());
        assertEquals(200, send(filter, "POST", "10.0.0.1", "bob").getStatus());
        assertEquals(429, send(filter, "POST", "10.0.0.1", "alice").getStatus());
    }

    @Test
    void addressesHaveSeparateBudgets() throws Exception {
        RateLimitingFilter filter = filter(1);

        assertEquals(200, send(filter, "POST", "10.0.0.1", null).getStatus());
        assertEquals(200, send(filter, "POST", "10.0.0.2", null).getStatus());
        assertEquals(429, send(filter, "POST", "10.0.0.1", null).getStatus());
    }

    @Test
    void readsAreNeverLimited() throws Exception {
        RateLimitingFilter filter = filter(1);

        for (int i = 0; i < 5; i++) {
            assertEquals(200, send(filter, "GET", "10.0.0.1", "alice").getStatus());
        }
    }

    @Test
    void disabledLimiterPassesEverything() throws Exception {
        ChatSecurityProperties properties = new ChatSecurityProperties();
        properties.getWriteLimit().setBurst(1);
        properties.getWriteLimit().setEnabled(false);
        RateLimitingFilter filter = new RateLimitingFilter(properties, ROSTER);

        for (int i = 0; i < 3; i++) {
            assertEquals(200, send(filter, "POST", "10.0.0.1", null).getStatus());
        }
    }
}
