package com.delta.pagetracker.crawl.model;

import com.fasterxml.jackson.databind.JsonNode;

public record CredentialRequest(
    Long id,
    String tenantId,
    String name,
    String domain,
    String authKind,
    JsonNode payload,
    Boolean active
) {
    @Override
    public String toString() {
        return "CredentialRequest[id=" + id + ", tenantId=" + tenantId + ", name=" + name
            + ", domain=" + domain + ", authKind=" + authKind + ", payload=<redacted>, active=" + active + "]";
    }
}
