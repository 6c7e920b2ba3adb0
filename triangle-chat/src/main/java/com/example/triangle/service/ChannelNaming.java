package com.example.triangle.service;

import com.example.triangle.domain.Channel;
import com.example.triangle.domain.ChannelHandle;
import com.example.triangle.domain.ChannelType;
import com.example.triangle.domain.ParticipantRoster;
import com.example.triangle.service.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Maps channel handles to canonical channel names.
 *
 * <p>The group channel is always called {@value #GROUP_CHANNEL}. A direct-message channel is called
 * {@code dm:<first>-<second>} with both participants in lexicographic order, so either argument order resolves to
 * the same channel. Shorthands such as {@code dm_alice_bob} are looked up in a table built from the roster; any
 * other string is taken as a raw channel name.
 */
@Component
public class ChannelNaming {

    public static final String GROUP_CHANNEL = "group";

    private static final String DM_PREFIX = "dm:";
    private static final String DM_SEPARATOR = "-";
    private static final String SHORTHAND_PREFIX = "dm_";
    private static final String SHORTHAND_SEPARATOR = "_";

    private final ParticipantRoster roster;
    private final Map<String, ChannelHandle> shorthands;

    public ChannelNaming(ParticipantRoster roster) {
        this.roster = roster;
        this.shorthands = buildShorthands(roster);
    }

    public String groupChannelName() {
        return GROUP_CHANNEL;
    }

    public static String dmChannelName(String first, String second) {
        if (first == null || second == null) {
            throw new IllegalArgumentException("Both participants are required for a direct channel");
        }
        if (first.equals(second)) {
            throw new IllegalArgumentException("A direct channel needs two distinct participants");
        }
        return first.compareTo(second) < 0
                ? DM_PREFIX + first + DM_SEPARATOR + second
                : DM_PREFIX + second + DM_SEPARATOR + first;
    }

    public ChannelHandle parse(String handle) {
        if (handle == null || handle.isBlank()) {
            throw new ValidationException("channel", "is required");
        }
        String trimmed = handle.trim();
        ChannelHandle shorthand = shorthands.get(trimmed);
        return shorthand != null ? shorthand : ChannelHandle.raw(trimmed);
    }

    public String canonicalName(ChannelHandle handle) {
        if (handle instanceof ChannelHandle.Group) {
            return groupChannelName();
        }
        if (handle instanceof ChannelHandle.Direct direct) {
            return dmChannelName(direct.first(), direct.second());
        }
        if (handle instanceof ChannelHandle.Raw raw) {
            return raw.name();
        }
        throw new IllegalArgumentException("Unsupported channel handle: " + handle);
    }

    public String resolve(String handle) {
        return canonicalName(parse(handle));
    }

    /**
     * Shorthand strings accepted by {@link #parse(String)}, keyed to their canonical names.
     */
    public Map<String, String> shorthands() {
        Map<String, String> view = new LinkedHashMap<>();
        shorthands.forEach((key, handle) -> view.put(key, canonicalName(handle)));
        return Collections.unmodifiableMap(view);
    }

    /**
     * The channels implied by the roster: one group channel and one direct channel per pair.
     */
    public List<Channel> seedDefinitions() {
        List<Channel> channels = new ArrayList<>();
        channels.add(Channel.builder()
                .name(groupChannelName())
                .type(ChannelType.GROUP)
                .participants(roster.participants())
                .description("Group chat: " + String.join(", ", roster.participants()))
                .build());
        for (List<String> pair : roster.pairs()) {
            channels.add(Channel.builder()
                    .name(dmChannelName(pair.get(0), pair.get(1)))
                    .type(ChannelType.DM)
                    .participants(pair)
                    .description("Direct messages: %s and %s".formatted(pair.get(0), pair.get(1)))
                    .build());
        }
        return channels;
    }

    private static Map<String, ChannelHandle> buildShorthands(ParticipantRoster roster) {
        Map<String, ChannelHandle> table = new LinkedHashMap<>();
        table.put(GROUP_CHANNEL, ChannelHandle.group());
        for (List<String> pair : roster.pairs()) {
            String first = pair.get(0);
            String second = pair.get(1);
            ChannelHandle handle = ChannelHandle.direct(first, second);
            table.put(SHORTHAND_PREFIX + first + SHORTHAND_SEPARATOR + second, handle);
            table.put(SHORTHAND_PREFIX + second + SHORTHAND_SEPARATOR + first, handle);
        }
        return Collections.unmodifiableMap(table);
    }
}
