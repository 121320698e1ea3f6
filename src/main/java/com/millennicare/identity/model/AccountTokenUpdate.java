package com.millennicare.identity.model;

import com.millennicare.identity.entity.Account;
import lombok.Builder;

import java.time.Instant;

/**
 * Partial update of the provider tokens held by a federated {@link Account}.
 */
@Builder
public record AccountTokenUpdate(
        FieldPatch<String> accessToken,
        FieldPatch<String> refreshToken,
        FieldPatch<String> idToken,
        FieldPatch<Instant> accessTokenExpiresAt,
        FieldPatch<String> scope
) {

    public AccountTokenUpdate {
        accessToken = FieldPatch.orUnset(accessToken);
        refreshToken = FieldPatch.orUnset(refreshToken);
        idToken = FieldPatch.orUnset(idToken);
        accessTokenExpiresAt = FieldPatch.orUnset(accessTokenExpiresAt);
        scope = FieldPatch.orUnset(scope);
    }

    public void applyTo(Account account) {
        accessToken.ifSet(account::setAccessToken);
        refreshToken.ifSet(account::setRefreshToken);
        idToken.ifSet(account::setIdToken);
        accessTokenExpiresAt.ifSet(account::setAccessTokenExpiresAt);
        scope.ifSet(account::setScope);
    }
}
