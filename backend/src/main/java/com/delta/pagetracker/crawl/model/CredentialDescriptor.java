package com.delta.pagetracker.crawl.model;

import com.delta.pagetracker.crawl.auth.AuthKind;

import java.time.Instant;

public record CredentialDescriptor(
    long id,
    String tenantId,
    String name,
    String domain,
    AuthKind authKind,
    String encryptedPayload,
    boolean active,
    Instant createdAt,
    Instant updatedAt
) {
    public CredentialView toView() {
        return new CredentialView(id, tenantId, name, domain, authKind.value(), active, createdAt, updatedAt);
    }

    @Override
    public String toString() {
        return "CredentialDescriptor[id=" + id
            + ", tenantId=" + tenantId
            + ", name=" + name
            + ", domain=" + domain
            + ", authKind=" + authKind
            + ", encryptedPayload=<redacted>, active=" + active + "]";
    }
}
