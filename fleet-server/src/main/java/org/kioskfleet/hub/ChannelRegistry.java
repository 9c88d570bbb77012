package org.kioskfleet.hub;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Channel membership for live connections: channel name to connection set,
 * plus the reverse index used to drop a connection from everything it joined.
 *
 * Membership lives only as long as the connection. Empty channels are removed
 * under the map's per-key lock, so a concurrent join never adds to a set that
 * has just been discarded.
 */
@Component
public class ChannelRegistry {

    public static final String ADMIN_CHANNEL = "admin";
    public static final String DEVICES_CHANNEL = "devices";

    private final ConcurrentHashMap<String, Set<HubConnection>> channels = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> joinedChannels = new ConcurrentHashMap<>();

    public static String deviceChannel(String deviceId) {
        return "device:" + deviceId;
    }

    public void join(String channel, HubConnection connection) {
        channels.compute(channel, (name, members) -> {
            Set<HubConnection> set = members != null ? members : ConcurrentHashMap.newKeySet();
            set.add(connection);
            return set;
        });
        joinedChannels.compute(connection.id(), (id, joined) -> {
            Set<String> set = joined != null ? joined : ConcurrentHashMap.newKeySet();
            set.add(channel);
            return set;
        });
    }

    public void leave(String channel, HubConnection connection) {
        removeMember(channel, connection);
        joinedChannels.computeIfPresent(connection.id(), (id, joined) -> {
            joined.remove(channel);
            return joined.isEmpty() ? null : joined;
        });
    }

    /**
     * Removes the connection from every channel it joined.
     *
     * @return The channels it was a member of
     */
    public Set<String> leaveAll(HubConnection connection) {
        Set<String> joined = joinedChannels.remove(connection.id());
        if (joined == null) {
            return Set.of();
        }
        for (String channel : joined) {
            removeMember(channel, connection);
        }
        return Set.copyOf(joined);
    }

    /**
     * Snapshot of the channel's members. Safe to iterate while others join
     * and leave.
     */
    public Set<HubConnection> members(String channel) {
        Set<HubConnection> members = channels.get(channel);
        return members == null ? Set.of() : Set.copyOf(members);
    }

    public boolean hasMembers(String channel) {
        Set<HubConnection> members = channels.get(channel);
        return members != null && !members.isEmpty();
    }

    public Set<String> channelsOf(HubConnection connection) {
        Set<String> joined = joinedChannels.get(connection.id());
        return joined == null ? Set.of() : Collections.unmodifiableSet(joined);
    }

    public int connectionCount() {
        return joinedChannels.size();
    }

    private void removeMember(String channel, HubConnection connection) {
        channels.computeIfPresent(channel, (name, members) -> {
            members.remove(connection);
            return members.isEmpty() ? null : members;
        });
    }
}
