package com.phillippitts.commandrouter.service.channel;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Table of live connections.
 *
 * <p>Connection handlers only add or remove their own entry. The periodic stale sweep runs under
 * a lock so two sweeps never race over the same entries.
 */
@Component
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final Map<String, ClientSession> sessions = new ConcurrentHashMap<>();
    private final Lock sweepLock = new ReentrantLock();

    void register(ClientSession session) {
        sessions.put(session.connectionId(), session);
        LOG.info("Connection registered: active={}", sessions.size());
    }

    Optional<ClientSession> remove(String connectionId) {
        ClientSession removed = sessions.remove(connectionId);
        if (removed != null) {
            LOG.info("Connection removed: active={}", sessions.size());
        }
        return Optional.ofNullable(removed);
    }

    public Optional<ClientSession> find(String connectionId) {
        return Optional.ofNullable(sessions.get(connectionId));
    }

    public Collection<ClientSession> all() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }

    /**
     * Removes sessions whose last heartbeat is older than {@code staleAfter}.
     *
     * @return the removed sessions, for the caller to close
     */
    List<ClientSession> sweepStale(Instant now, Duration staleAfter) {
        List<ClientSession> stale = new ArrayList<>();
        sweepLock.lock();
        try {
            for (ClientSession session : sessions.values()) {
                if (Duration.between(session.lastHeartbeat(), now).compareTo(staleAfter) > 0) {
                    // remove(key, value) leaves a reconnected session with the same id alone
                    if (sessions.remove(session.connectionId(), session)) {
                        stale.add(session);
                    }
                }
            }
        } finally {
            sweepLock.unlock();
        }
        if (!stale.isEmpty()) {
            LOG.info("Swept {} stale connection(s): active={}", stale.size(), sessions.size());
        }
        return stale;
    }
}
