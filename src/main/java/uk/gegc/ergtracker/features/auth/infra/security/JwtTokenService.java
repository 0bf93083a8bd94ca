package uk.gegc.ergtracker.features.auth.infra.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import uk.gegc.ergtracker.features.account.domain.model.Account;
import uk.gegc.ergtracker.features.account.domain.model.AccountRole;

import javax.crypto.SecretKey;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

@Component
@Getter
@Slf4j
public class JwtTokenService {

    private static final String EMAIL_CLAIM = "email";
    private static final String ROLE_CLAIM = "role";
    private static final String PASSWORD_CHANGED_AT_CLAIM = "pwdChangedAt";

    @Value("${jwt.secret}")
    private String base64secret;

    @Value("${jwt.expiration-ms:604800000}")
    private long accessTokenValidityInMs;

    private SecretKey key;

    @PostConstruct
    public void init() {
        byte[] keyBytes = Decoders.BASE64.decode(base64secret);
        this.key = Keys.hmacShaKeyFor(keyBytes);
    }

    public String generateAccessToken(Account account) {
        Date now = new Date();
        Date expiry = new Date(now.getTime() + accessTokenValidityInMs);

        return Jwts.builder()
                .subject(account.getId().toString())
                .issuedAt(now)
                .expiration(expiry)
                .claim(EMAIL_CLAIM, account.getEmail())
                .claim(ROLE_CLAIM, account.getRole().getWireValue())
                .claim(PASSWORD_CHANGED_AT_CLAIM, toEpochMillis(account.getPasswordChangedAt()))
                .signWith(key)
                .compact();
    }

    public boolean validateToken(String token) {
        try {
            Claims claims = getClaims(token);
            if (claims.getSubject() == null || claims.getSubject().isBlank()) {
                log.warn("JWT token missing subject");
                return false;
            }
            if (claims.get(ROLE_CLAIM, String.class) == null) {
                log.warn("JWT token missing role claim");
                return false;
            }
            return true;
        } catch (ExpiredJwtException ex) {
            log.debug("JWT token is expired: {}", ex.getMessage());
            return false;
        } catch (MalformedJwtException ex) {
            log.warn("Malformed JWT token received: {}", ex.getMessage());
            return false;
        } catch (SignatureException ex) {
            log.warn("Invalid JWT signature detected: {}", ex.getMessage());
            return false;
        } catch (IllegalArgumentException ex) {
            log.warn("Illegal argument passed to JWT parser: {}", ex.getMessage());
            return false;
        } catch (JwtException ex) {
            log.error("Unexpected JWT exception: {}", ex.getMessage());
            return false;
        }
    }

    /**
     * Builds the principal from a token that already passed {@link #validateToken(String)}.
     */
    public AccountPrincipal getPrincipal(String token) {
        Claims claims = getClaims(token);
        Long passwordChangedAt = claims.get(PASSWORD_CHANGED_AT_CLAIM, Long.class);
        return new AccountPrincipal(
                UUID.fromString(claims.getSubject()),
                claims.get(EMAIL_CLAIM, String.class),
                AccountRole.fromWire(claims.get(ROLE_CLAIM, String.class)),
                passwordChangedAt != null ? passwordChangedAt : 0L
        );
    }

    public Claims getClaims(String token) {
        return Jwts.parser()
                .verifyWith(key)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    public static long toEpochMillis(Instant instant) {
        return instant != null ? instant.toEpochMilli() : 0L;
    }
}
