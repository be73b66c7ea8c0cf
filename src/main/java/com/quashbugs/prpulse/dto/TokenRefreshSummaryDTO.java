package com.quashbugs.prpulse.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenRefreshSummaryDTO {
    private int gitProvidersRefreshed;
    private int messagingProvidersRefreshed;
    @Builder.Default
    private List<String> errors = new ArrayList<>();
}
