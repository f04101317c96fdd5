package tech.funid.platform.authentication.oauth.mapper;

import tech.funid.platform.authentication.oauth.RefreshToken;
import tech.funid.platform.authentication.oauth.entity.RefreshTokenEntity;

/**
 * Mapper for converting between RefreshToken domain model and JPA entity.
 */
public final class RefreshTokenMapper {

    private RefreshTokenMapper() {
    }

    public static RefreshToken toDomain(RefreshTokenEntity entity) {
        if (entity == null) {
            return null;
        }

        RefreshToken domain = new RefreshToken();
        domain.tokenHash = entity.tokenHash;
        domain.userId = entity.userId;
        domain.clientId = entity.clientId;
        domain.scope = entity.scope;
        domain.tokenFamily = entity.tokenFamily;
        domain.revoked = entity.revoked;
        domain.revokedAt = entity.revokedAt;
        domain.replacedBy = entity.replacedBy;
        domain.createdAt = entity.createdAt;
        domain.expiresAt = entity.expiresAt;
        return domain;
    }

    public static RefreshTokenEntity toEntity(RefreshToken domain) {
        if (domain == null) {
            return null;
        }

        RefreshTokenEntity entity = new RefreshTokenEntity();
        entity.tokenHash = domain.tokenHash;
        entity.userId = domain.userId;
        entity.clientId = domain.clientId;
        entity.scope = domain.scope;
        entity.tokenFamily = domain.tokenFamily;
        entity.revoked = domain.revoked;
        entity.revokedAt = domain.revokedAt;
        entity.replacedBy = domain.replacedBy;
        entity.createdAt = domain.createdAt;
        entity.expiresAt = domain.expiresAt;
        return entity;
    }
}
