package com.example.triangle.service;

import com.example.triangle.domain.Channel;
import com.example.triangle.domain.ChannelHandle;
import com.example.triangle.domain.ChannelType;
import com.example.triangle.domain.ParticipantRoster;
import com.example.triangle.service.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChannelNamingTest {

    private final ChannelNaming naming = new ChannelNaming(ParticipantRoster.of("key", "splntrb", "stream"));

    @Test
    void dmNameIsSymmetric() {
        assertEquals("dm:key-splntrb", ChannelNaming.dmChannelName("key", "splntrb"));
        assertEquals("dm:key-splntrb", ChannelNaming.dmChannelName("splntrb", "key"));
        assertEquals(ChannelNaming.dmChannelName("stream", "splntrb"), ChannelNaming.dmChannelName("splntrb", "stream"));
    }

    @Test
    void dmNameNeedsTwoDistinctParticipants() {
        assertThrows(IllegalArgumentException.class, () -> ChannelNaming.dmChannelName("key", "key"));
        assertThrows(IllegalArgumentException.class, () -> ChannelNaming.dmChannelName("key", null));
    }

    @Test
    void shorthandsResolveInEitherOrder() {
        assertEquals("group", naming.resolve("group"));
        assertEquals("dm:key-stream", naming.resolve("dm_key_stream"));
        assertEquals("dm:key-stream", naming.resolve("dm_stream_key"));
        assertEquals("dm:splntrb-stream", naming.resolve("dm_stream_splntrb"));
    }

    @Test
    void unknownHandlesPassThroughAsRawNames() {
        assertEquals("dm:key-splntrb", naming.resolve("dm:key-splntrb"));
        assertEquals("random", naming.resolve("random"));
        assertEquals("dm_key_mallory", naming.resolve("dm_key_mallory"));
        assertInstanceOf(ChannelHandle.Raw.class, naming.parse("random"));
    }

    @Test
    void missingHandleIsAValidationError() {
        var ex = assertThrows(ValidationException.class, () -> naming.resolve(null));
        assertEquals("channel", ex.getField());
        assertThrows(ValidationException.class, () -> naming.resolve("  "));
    }

    @Test
    void canonicalNameOfTypedHandles() {
        assertEquals("group", naming.canonicalName(ChannelHandle.group()));
        assertEquals("dm:key-stream", naming.canonicalName(ChannelHandle.direct("stream", "key")));
        assertEquals("whatever", naming.canonicalName(ChannelHandle.raw("whatever")));
    }

    @Test
    void shorthandTableListsGroupAndBothPairOrders() {
        var shorthands = naming.shorthands();
        assertEquals(7, shorthands.size());
        assertEquals("dm:key-splntrb", shorthands.get("dm_splntrb_key"));
        assertEquals("group", shorthands.get("group"));
    }

    @Test
    void seedDefinitionsHaveOneGroupAndOneDmPerPair() {
        List<Channel> seeds = naming.seedDefinitions();
        assertEquals(4, seeds.size());

        Channel group = seeds.get(0);
        assertEquals("group", group.getName());
        assertEquals(ChannelType.GROUP, group.getType());
        assertEquals(List.of("key", "splntrb", "stream"), group.getParticipants());

        assertEquals(List.of("dm:key-splntrb", "dm:key-stream", "dm:splntrb-stream"),
                seeds.subList(1, 4).stream().map(Channel::getName).toList());
        seeds.subList(1, 4).forEach(channel -> {
            assertEquals(ChannelType.DM, channel.getType());
            assertEquals(2, channel.getParticipants().size());
            assertNotNull(channel.getDescription());
        });
    }
}
