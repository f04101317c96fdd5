package tech.funid.platform.authentication.oauth.mapper;

import tech.funid.platform.authentication.oauth.AuthorizationCode;
import tech.funid.platform.authentication.oauth.entity.AuthorizationCodeEntity;

/**
 * Mapper for converting between AuthorizationCode domain model and JPA entity.
 */
public final class AuthorizationCodeMapper {

    private AuthorizationCodeMapper() {
    }

    public static AuthorizationCode toDomain(AuthorizationCodeEntity entity) {
        if (entity == null) {
            return null;
        }

        AuthorizationCode domain = new AuthorizationCode();
        domain.id = entity.id;
        domain.code = entity.code;
        domain.clientId = entity.clientId;
        domain.userId = entity.userId;
        domain.redirectUri = entity.redirectUri;
        domain.scope = entity.scope;
        domain.codeChallenge = entity.codeChallenge;
        domain.codeChallengeMethod = entity.codeChallengeMethod;
        domain.state = entity.state;
        domain.nonce = entity.nonce;
        domain.createdAt = entity.createdAt;
        domain.expiresAt = entity.expiresAt;
        domain.used = entity.used;
        return domain;
    }

    public static AuthorizationCodeEntity toEntity(AuthorizationCode domain) {
        if (domain == null) {
            return null;
        }

        AuthorizationCodeEntity entity = new AuthorizationCodeEntity();
        entity.id = domain.id;
        entity.code = domain.code;
        entity.clientId = domain.clientId;
        entity.userId = domain.userId;
        entity.redirectUri = domain.redirectUri;
        entity.scope = domain.scope;
        entity.codeChallenge = domain.codeChallenge;
        entity.codeChallengeMethod = domain.codeChallengeMethod;
        entity.state = domain.state;
        entity.nonce = domain.nonce;
        entity.createdAt = domain.createdAt;
        entity.expiresAt = domain.expiresAt;
        entity.used = domain.used;
        return entity;
    }
}
