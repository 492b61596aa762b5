package com.mgmt.session.auth.server;

import java.time.Clock;

import com.mgmt.session.auth.server.key.RandomSecretGenerator;
import com.mgmt.session.auth.server.key.SecretGenerator;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class SessionTokenConfig {

    private String sessionDuration = "8h";
    private int secretSize = ScopedSecrets.DEFAULT_SECRET_SIZE;
    private Clock clock = Clock.systemUTC();
    private SecretGenerator secretGenerator = new RandomSecretGenerator();

}
