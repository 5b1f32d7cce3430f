package com.example.socketrouter.shared.service.registry;

import com.example.socketrouter.shared.exception.ConnectionLimitExceededException;
import com.example.socketrouter.shared.model.SocketConnection;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Record of every currently known connection, keyed by transport handle.
 * Every mutation is atomic per handle.
 */
public interface ConnectionRegistry {

    /**
     * Creates the record for {@code refresh.handle} or refreshes the existing one,
     * always leaving it {@code active} with {@code lastPing = refresh.timestamp}.
     *
     * @throws ConnectionLimitExceededException when creating would exceed the per-user limit
     */
    SocketConnection upsert(ConnectionRefresh refresh);

    Optional<SocketConnection> find(String handle);

    Optional<SocketConnection> remove(String handle);

    List<SocketConnection> findAll(ConnectionScope scope);

    /**
     * Flips every active connection in scope to pending.
     *
     * @return exactly the records that this call flipped
     */
    List<SocketConnection> markInactive(ConnectionScope scope);

    /**
     * Deletes pending connections in scope whose last ping is before {@code threshold}.
     *
     * @return the deleted records
     */
    List<SocketConnection> removeInactiveBefore(ConnectionScope scope, Instant threshold);

    int size();

    long countUsers();
}
