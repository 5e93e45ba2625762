package com.mobifone.broker.service.auth;

import com.mobifone.broker.common.Constants;
import com.mobifone.broker.dto.request.AuthenticationRequest;
import com.mobifone.broker.dto.response.AuthenticationResponse;
import com.mobifone.broker.entity.User;
import com.mobifone.broker.exception.AppException;
import com.mobifone.broker.exception.ErrorCode;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSObject;
import com.nimbusds.jose.Payload;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class AuthenticationService {
    AuthenticatorService authenticatorService;
    Clock clock;

    @NonFinal
    @Value("${jwt.signerKey}")
    protected String SIGNER_KEY;

    @NonFinal
    @Value("${jwt.valid-duration}")
    protected long VALID_DURATION;

    public AuthenticationResponse authenticate(AuthenticationRequest request) {
        Authenticator authenticator = authenticatorService.get(request.getAuthenticator());
        User user = authenticator.authenticate(request.getUsername(), request.getPassword())
                .orElseThrow(() -> {
                    log.info("Login refused for {} on {}", request.getUsername(), authenticator.getName());
                    return new AppException(ErrorCode.WRONG_PASSWORD);
                });

        return AuthenticationResponse.builder()
                .token(generateToken(user))
                .userId(user.getId())
                .username(user.getUsername())
                .authenticated(true)
                .build();
    }

    String generateToken(User user) {
        JWSHeader header = new JWSHeader(JWSAlgorithm.HS512);
        Instant now = clock.instant();

        JWTClaimsSet jwtClaimsSet = new JWTClaimsSet.Builder()
                .subject(user.getId())
                .issuer("mobifone.com")
                .issueTime(Date.from(now))
                .expirationTime(Date.from(now.plus(VALID_DURATION, ChronoUnit.SECONDS)))
                .jwtID(UUID.randomUUID().toString())
                .claim("username", user.getUsername())
                .claim("scope", buildScope(user))
                .build();

        JWSObject jwsObject = new JWSObject(header, new Payload(jwtClaimsSet.toJSONObject()));
        try {
            jwsObject.sign(new MACSigner(SIGNER_KEY.getBytes(StandardCharsets.UTF_8)));
            return jwsObject.serialize();
        } catch (JOSEException e) {
            log.error("Cannot create token", e);
            throw new AppException(ErrorCode.UNCATEGORIZED_EXCEPTION, e);
        }
    }

    private String buildScope(User user) {
        return Boolean.TRUE.equals(user.getStaff()) ? "ROLE_" + Constants.ROLE.ADMIN : "";
    }
}
