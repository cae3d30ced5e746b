package com.delta.pagetracker.crawl.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.encrypt.Encryptors;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialCipherTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CredentialCipher cipher =
        new CredentialCipher(Encryptors.delux("test-encryption-key", "0123456789abcdef"), objectMapper);

    @Test
    void ciphertextHidesSecretsAndDecryptsToSameVariant() {
        AuthConfig cookie = new AuthConfig.Cookie(List.of(new AuthConfig.CookieEntry("sid", "abc", "wiki.company.com", "/")));

        String ciphertext = cipher.encrypt(cookie);

        assertThat(ciphertext).doesNotContain("sid").doesNotContain("wiki");
        assertThat(cipher.decrypt(ciphertext, AuthKind.COOKIE)).isEqualTo(cookie);
    }

    @Test
    void headerAndFormVariantsRoundTrip() {
        AuthConfig header = new AuthConfig.Header(Map.of("Authorization", "Bearer t0ken"));
        AuthConfig form = new AuthConfig.Form("alice", "pw", "#login", null, null, null, "https://example.com/login");

        assertThat(cipher.decrypt(cipher.encrypt(header), AuthKind.HEADER)).isEqualTo(header);
        assertThat(cipher.decrypt(cipher.encrypt(form), AuthKind.FORM)).isEqualTo(form);
    }

    @Test
    void tamperedCiphertextIsAnAuthenticationFailure() {
        String ciphertext = cipher.encrypt(new AuthConfig.Basic("alice", "pw"));
        String tampered = ciphertext.substring(0, ciphertext.length() - 4) + "0000";

        assertThatThrownBy(() -> cipher.decrypt(tampered, AuthKind.BASIC))
            .isInstanceOf(AuthenticationException.class)
            .hasMessage("Unable to decrypt stored basic credential");
    }

    @Test
    void readPayloadBindsOperatorJson() throws Exception {
        JsonNode payload = objectMapper.readTree("{\"username\":\"alice\",\"password\":\"pw\"}");

        assertThat(cipher.readPayload(payload, AuthKind.BASIC)).isEqualTo(new AuthConfig.Basic("alice", "pw"));
        assertThatThrownBy(() -> cipher.readPayload(objectMapper.readTree("[1,2]"), AuthKind.BASIC))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toStringNeverShowsSecrets() {
        assertThat(new AuthConfig.Basic("alice", "pw").toString()).doesNotContain("pw");
        assertThat(new AuthConfig.Sso("okta", "secret-token").toString()).doesNotContain("secret-token");
    }
}
