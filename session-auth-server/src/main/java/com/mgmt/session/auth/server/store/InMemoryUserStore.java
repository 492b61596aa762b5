package com.mgmt.session.auth.server.store;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import lombok.NoArgsConstructor;

@NoArgsConstructor
public class InMemoryUserStore implements UserStore {

    private final Map<Integer, UserRecord> users = new ConcurrentHashMap<>();

    public InMemoryUserStore(Iterable<UserRecord> initial) {
        initial.forEach(this::save);
    }

    @Override
    public Optional<UserRecord> findById(int id) {
        return Optional.ofNullable(users.get(id));
    }

    public void save(UserRecord user) {
        users.put(user.id(), user);
    }

    /**
     * Marks every token issued to the user before {@code epochSecond} as stale.
     */
    public void invalidateTokens(int id, long epochSecond) {
        users.computeIfPresent(id, (key, user) -> user.withTokenIssueAt(epochSecond));
    }
}
