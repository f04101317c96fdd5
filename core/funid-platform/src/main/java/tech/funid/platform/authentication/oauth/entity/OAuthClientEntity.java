package tech.funid.platform.authentication.oauth.entity;

import jakarta.persistence.*;
import tech.funid.platform.authentication.oauth.OAuthClient.ClientType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA Entity for OAuth clients.
 */
@Entity
@Table(name = "oauth_clients")
public class OAuthClientEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "client_id", nullable = false, unique = true, length = 100)
    public String clientId;

    @Column(name = "client_name", nullable = false, length = 200)
    public String clientName;

    @Enumerated(EnumType.STRING)
    @Column(name = "client_type", nullable = false, length = 20)
    public ClientType clientType;

    @Column(name = "client_secret_hash", length = 500)
    public String clientSecretHash;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "oauth_client_redirect_uris", joinColumns = @JoinColumn(name = "oauth_client_id"))
    @Column(name = "redirect_uri", length = 500)
    public List<String> redirectUris = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "oauth_client_scopes", joinColumns = @JoinColumn(name = "oauth_client_id"))
    @Column(name = "scope", length = 50)
    public List<String> allowedScopes = new ArrayList<>();

    @Column(name = "logo_uri", length = 500)
    public String logoUri;

    @Column(name = "active", nullable = false)
    public boolean active = true;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public OAuthClientEntity() {
    }
}
