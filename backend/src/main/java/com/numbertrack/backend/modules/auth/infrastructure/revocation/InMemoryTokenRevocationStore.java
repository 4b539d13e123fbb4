package com.numbertrack.backend.modules.auth.infrastructure.revocation;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.numbertrack.backend.modules.auth.application.TokenRevocationStore;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local store for single-node and test runs. Entries are dropped once the token has expired.
 */
@Component
@ConditionalOnProperty(value = "app.auth.revocation-store", havingValue = "memory", matchIfMissing = true)
public class InMemoryTokenRevocationStore implements TokenRevocationStore {

    private final Map<String, OffsetDateTime> revoked = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTokenRevocationStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void revoke(String tokenId, OffsetDateTime expiresAt) {
        purgeExpired();
        revoked.put(tokenId, expiresAt);
    }

    @Override
    public boolean isRevoked(String tokenId) {
        OffsetDateTime expiresAt = revoked.get(tokenId);
        if (expiresAt == null) {
            return false;
        }
        if (expiresAt.isBefore(OffsetDateTime.now(clock))) {
            revoked.remove(tokenId);
            return false;
        }
        return true;
    }

    private void purgeExpired() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        revoked.entrySet().removeIf(entry -> entry.getValue().isBefore(now));
    }
}
