package com.mgmt.session.auth.server.store;

import java.util.Optional;

public interface UserStore {

    Optional<UserRecord> findById(int id);
}
