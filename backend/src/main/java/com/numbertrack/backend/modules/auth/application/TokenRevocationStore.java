package com.numbertrack.backend.modules.auth.application;

import java.time.OffsetDateTime;

/**
 * Remembers access-token ids invalidated by logout until the token would have expired anyway.
 */
public interface TokenRevocationStore {

    void revoke(String tokenId, OffsetDateTime expiresAt);

    boolean isRevoked(String tokenId);
}
