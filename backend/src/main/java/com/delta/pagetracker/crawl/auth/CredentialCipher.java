package com.delta.pagetracker.crawl.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.security.crypto.encrypt.TextEncryptor;
import org.springframework.stereotype.Component;

@Component
public class CredentialCipher {
    private final TextEncryptor encryptor;
    private final ObjectMapper objectMapper;

    public CredentialCipher(TextEncryptor credentialEncryptor, ObjectMapper objectMapper) {
        this.encryptor = credentialEncryptor;
        this.objectMapper = objectMapper;
    }

    public String encrypt(AuthConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("credential payload is required");
        }
        try {
            return encryptor.encrypt(objectMapper.writeValueAsString(config));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize " + config.kind().value() + " credential", e);
        }
    }

    public AuthConfig decrypt(String ciphertext, AuthKind kind) {
        if (ciphertext == null || ciphertext.isBlank()) {
            throw new AuthenticationException("Stored credential has no payload");
        }
        String json;
        try {
            json = encryptor.decrypt(ciphertext);
        } catch (RuntimeException e) {
            throw new AuthenticationException("Unable to decrypt stored " + kind.value() + " credential", null, e);
        }
        try {
            return objectMapper.readValue(json, payloadType(kind));
        } catch (JsonProcessingException e) {
            throw new AuthenticationException("Stored " + kind.value() + " credential payload is malformed");
        }
    }

    public AuthConfig readPayload(JsonNode payload, AuthKind kind) {
        if (payload == null || payload.isNull() || !payload.isObject()) {
            throw new IllegalArgumentException("credential payload must be a JSON object");
        }
        try {
            return objectMapper.treeToValue(payload, payloadType(kind));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("credential payload does not match auth kind " + kind.value());
        }
    }

    private static Class<? extends AuthConfig> payloadType(AuthKind kind) {
        return switch (kind) {
            case BASIC -> AuthConfig.Basic.class;
            case HEADER -> AuthConfig.Header.class;
            case COOKIE -> AuthConfig.Cookie.class;
            case FORM -> AuthConfig.Form.class;
            case SSO -> AuthConfig.Sso.class;
        };
    }
}
