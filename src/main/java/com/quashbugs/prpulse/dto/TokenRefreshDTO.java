package com.quashbugs.prpulse.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenRefreshDTO {
    private String accessToken;
    private String refreshToken; // null when the provider did not rotate it
    private Instant expiresAt;
}
