package tech.funid.platform.authentication.oauth.mapper;

import tech.funid.platform.authentication.oauth.OAuthClient;
import tech.funid.platform.authentication.oauth.entity.OAuthClientEntity;

import java.util.ArrayList;

/**
 * Mapper for converting between OAuthClient domain model and JPA entity.
 */
public final class OAuthClientMapper {

    private OAuthClientMapper() {
    }

    public static OAuthClient toDomain(OAuthClientEntity entity) {
        if (entity == null) {
            return null;
        }

        OAuthClient domain = new OAuthClient();
        domain.id = entity.id;
        domain.clientId = entity.clientId;
        domain.clientName = entity.clientName;
        domain.clientType = entity.clientType;
        domain.clientSecretHash = entity.clientSecretHash;
        domain.redirectUris = entity.redirectUris != null ? new ArrayList<>(entity.redirectUris) : new ArrayList<>();
        domain.allowedScopes = entity.allowedScopes != null ? new ArrayList<>(entity.allowedScopes) : new ArrayList<>();
        domain.logoUri = entity.logoUri;
        domain.active = entity.active;
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        return domain;
    }

    public static OAuthClientEntity toEntity(OAuthClient domain) {
        if (domain == null) {
            return null;
        }

        OAuthClientEntity entity = new OAuthClientEntity();
        entity.id = domain.id;
        entity.clientId = domain.clientId;
        entity.clientName = domain.clientName;
        entity.clientType = domain.clientType;
        entity.clientSecretHash = domain.clientSecretHash;
        entity.redirectUris = domain.redirectUris != null ? new ArrayList<>(domain.redirectUris) : new ArrayList<>();
        entity.allowedScopes = domain.allowedScopes != null ? new ArrayList<>(domain.allowedScopes) : new ArrayList<>();
        entity.logoUri = domain.logoUri;
        entity.active = domain.active;
        entity.createdAt = domain.createdAt;
        entity.updatedAt = domain.updatedAt;
        return entity;
    }
}
