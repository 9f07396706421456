package com.whisperecho.gate.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.AlgorithmMismatchException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.whisperecho.gate.codec.DecodeError;
import com.whisperecho.gate.codec.DecodeResult;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies bearer identity tokens.
 * <p>
 * Tokens are HMAC-SHA256 JWTs whose subject is the user id. Signature validity needs no store
 * round trip; whether the referenced user still exists is checked by the caller.
 */
public class BearerTokenManager {

  /**
   * Payload claim carrying the user id, kept alongside {@code sub} for older mobile clients.
   */
  public static final String USER_ID_CLAIM = "userId";

  private static final Logger log = LoggerFactory.getLogger(BearerTokenManager.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final String issuer;
  private final Duration ttl;
  private final int secretLength;

  /**
   * Creates a new BearerTokenManager.
   *
   * @param secret HMAC-SHA256 signing secret
   * @param issuer JWT issuer claim, required on verification
   * @param ttl    token time-to-live
   */
  public BearerTokenManager(byte[] secret, String issuer, Duration ttl) {
    if (secret == null || secret.length == 0) {
      throw new IllegalArgumentException("Signing secret must not be empty");
    }
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("Token TTL must be positive");
    }
    this.algorithm = Algorithm.HMAC256(secret);
    this.verifier = JWT.require(algorithm).withIssuer(issuer).build();
    this.issuer = issuer;
    this.ttl = ttl;
    this.secretLength = secret.length;
  }

  /**
   * Issues a token for a persisted user.
   *
   * @param userId the user id
   * @return the signed token
   */
  public IssuedToken issue(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("Missing required field: userId");
    }
    String jti = UUID.randomUUID().toString();
    Instant now = Instant.now();
    Instant expiresAt = now.plus(ttl);

    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(jti)
        .withSubject(userId)
        .withClaim(USER_ID_CLAIM, userId)
        .withIssuedAt(now)
        .withExpiresAt(expiresAt)
        .sign(algorithm);

    log.debug("Issued bearer token jti={}", jti);
    return new IssuedToken(token, jti, now, expiresAt);
  }

  /**
   * Verifies a token's signature, issuer and expiry. Tokens without an {@code exp} claim are
   * rejected.
   *
   * @param token compact JWT, may be null
   * @return the claims, or a typed {@link DecodeError}
   */
  public DecodeResult<BearerClaims> decode(String token) {
    if (token == null || token.isBlank()) {
      return DecodeResult.failure(DecodeError.malformed("empty bearer token"));
    }
    try {
      DecodedJWT decoded = verifier.verify(token);
      String subject = decoded.getSubject();
      if (subject == null || subject.isBlank()) {
        return DecodeResult.failure(DecodeError.malformed("missing subject"));
      }
      if (decoded.getExpiresAtAsInstant() == null) {
        return DecodeResult.failure(DecodeError.malformed("missing expiry"));
      }
      return DecodeResult.success(new BearerClaims(subject, decoded.getId(),
          decoded.getIssuedAtAsInstant(), decoded.getExpiresAtAsInstant()));
    } catch (TokenExpiredException e) {
      return DecodeResult.failure(DecodeError.expired(e.getMessage()));
    } catch (SignatureVerificationException | AlgorithmMismatchException e) {
      return DecodeResult.failure(DecodeError.signatureInvalid(e.getMessage()));
    } catch (JWTVerificationException e) {
      return DecodeResult.failure(DecodeError.malformed(e.getMessage()));
    }
  }

  public String issuer() {
    return issuer;
  }

  /**
   * Length in bytes of the configured signing secret, for health reporting.
   *
   * @return the secret length
   */
  public int secretLength() {
    return secretLength;
  }
}
