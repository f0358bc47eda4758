package uk.gegc.gosuraksha.shared.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.Authentication;
import org.springframework.test.util.ReflectionTestUtils;

import javax.crypto.SecretKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JwtTokenService")
class JwtTokenServiceTest {

    private static final String SECRET = "dGVzdC1qd3Qtc2VjcmV0LWtleS1mb3ItZ29zdXJha3NoYS10ZXN0cy0xMjM0NTY3OA==";
    private static final String OTHER_SECRET = "b3RoZXItand0LXNlY3JldC1rZXktZm9yLWdvc3VyYWtzaGEtdGVzdHMtODc2NTQzMjE=";

    private JwtTokenService service;

    @BeforeEach
    void setUp() {
        service = new JwtTokenService();
        ReflectionTestUtils.setField(service, "base64secret", SECRET);
        service.init();
    }

    private static String token(String secret, String subject, Instant expiresAt) {
        SecretKey key = Keys.hmacShaKeyFor(Decoders.BASE64.decode(secret));
        return Jwts.builder()
                .subject(subject)
                .issuedAt(Date.from(expiresAt.minus(Duration.ofHours(1))))
                .expiration(Date.from(expiresAt))
                .signWith(key)
                .compact();
    }

    @Test
    @DisplayName("valid token authenticates its account id")
    void validToken() {
        UUID accountId = UUID.randomUUID();
        String token = token(SECRET, accountId.toString(), Instant.now().plus(Duration.ofMinutes(5)));

        assertThat(service.validateToken(token)).isTrue();
        Authentication authentication = service.getAuthentication(token);
        assertThat(authentication.getName()).isEqualTo(accountId.toString());
        assertThat(authentication.getAuthorities()).extracting("authority").containsExactly("ROLE_USER");
    }

    @Test
    @DisplayName("expired token is rejected")
    void expired() {
        String token = token(SECRET, UUID.randomUUID().toString(), Instant.now().minus(Duration.ofMinutes(5)));

        assertThat(service.validateToken(token)).isFalse();
    }

    @Test
    @DisplayName("token signed with another key is rejected")
    void wrongKey() {
        String token = token(OTHER_SECRET, UUID.randomUUID().toString(), Instant.now().plus(Duration.ofMinutes(5)));

        assertThat(service.validateToken(token)).isFalse();
    }

    @Test
    @DisplayName("subject that is not an account id is rejected")
    void nonUuidSubject() {
        String token = token(SECRET, "alice", Instant.now().plus(Duration.ofMinutes(5)));

        assertThat(service.validateToken(token)).isFalse();
    }

    @Test
    @DisplayName("garbage is rejected")
    void garbage() {
        assertThat(service.validateToken("not.a.jwt")).isFalse();
    }
}
