package com.example.socketrouter.shared.service.group;

import com.example.socketrouter.shared.dto.Envelope;
import com.example.socketrouter.shared.model.SocketConnection;

import java.util.List;
import java.util.Map;

/**
 * An ephemeral, addressable set of connections. Identity is derived from the
 * membership so equal memberships always produce the same id. Never persisted.
 */
public final class ConnectionGroup {

    /**
     * Sentinel for an empty membership: accepts every send and drops it. It has
     * no id so it can never be confused with a real group.
     */
    public static final ConnectionGroup EMPTY = new ConnectionGroup(null, List.of(), null);

    private final String id;
    private final List<SocketConnection> members;
    private final GroupAddressor addressor;

    ConnectionGroup(String id, List<SocketConnection> members, GroupAddressor addressor) {
        this.id = id;
        this.members = List.copyOf(members);
        this.addressor = addressor;
    }

    public String getId() {
        return id;
    }

    /**
     * @return addressable members only, bot handles are never part of a group
     */
    public List<SocketConnection> getMembers() {
        return members;
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return this == EMPTY || members.isEmpty();
    }

    /**
     * Stamps one {@code TIMESTAMP} for the whole call and delivers the same
     * serialized frame to every member.
     *
     * @return number of members the frame was delivered to
     */
    public int broadcast(Envelope envelope) {
        if (isEmpty()) {
            return 0;
        }
        return addressor.deliver(this, envelope);
    }

    public int broadcastAction(String actionType, Map<String, ?> payload) {
        if (isEmpty()) {
            return 0;
        }
        return broadcast(addressor.action(actionType, payload));
    }

    public int broadcastRaw(String text) {
        if (isEmpty()) {
            return 0;
        }
        return addressor.deliverRaw(this, text);
    }

    @Override
    public String toString() {
        return this == EMPTY ? "<ConnectionGroup EMPTY>" : "<ConnectionGroup " + id + " x" + members.size() + ">";
    }
}
