package com.quashbugs.prpulse.service;

import com.quashbugs.prpulse.dto.JwtResponseDTO;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.FileReader;
import java.io.IOException;
import java.security.PrivateKey;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * Mints the short-lived RS256 JWT a GitHub App presents when it asks for installation access tokens.
 */
@Service
public class JwtService {

    private static final long APP_JWT_TTL_SECONDS = 600;
    // github rejects tokens issued "in the future"; back-date to absorb clock drift
    private static final long CLOCK_DRIFT_SECONDS = 60;

    private final Clock clock;

    @Autowired
    public JwtService(Clock clock) {
        this.clock = clock;
    }

    public JwtResponseDTO generateAppJwt(String appId, String pemFilePath) throws IOException {
        int appIdInt;
        try {
            appIdInt = Integer.parseInt(appId);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("App ID must be a valid integer", e);
        }

        PrivateKey privateKey = readPrivateKey(pemFilePath);

        long now = clock.instant().getEpochSecond();
        Instant expiry = Instant.ofEpochSecond(now + APP_JWT_TTL_SECONDS);

        String jwt = Jwts.builder()
                .setIssuedAt(Date.from(Instant.ofEpochSecond(now - CLOCK_DRIFT_SECONDS)))
                .setExpiration(Date.from(expiry))
                .setIssuer(Integer.toString(appIdInt))
                .signWith(privateKey, SignatureAlgorithm.RS256)
                .compact();

        return new JwtResponseDTO(jwt, expiry);
    }

    private PrivateKey readPrivateKey(String pemFilePath) throws IOException {
        try (FileReader keyReader = new FileReader(pemFilePath);
             PEMParser pemParser = new PEMParser(keyReader)) {

            JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
            Object keyPair = pemParser.readObject();

            if (keyPair instanceof PEMKeyPair) {
                return converter.getPrivateKey(((PEMKeyPair) keyPair).getPrivateKeyInfo());
            }
            if (keyPair instanceof PrivateKeyInfo) {
                return converter.getPrivateKey((PrivateKeyInfo) keyPair);
            }
            throw new IOException("No private key found in " + pemFilePath);
        }
    }
}
