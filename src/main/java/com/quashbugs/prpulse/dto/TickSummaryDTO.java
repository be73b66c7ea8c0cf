package com.quashbugs.prpulse.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TickSummaryDTO {
    private boolean success;
    private int schedulesProcessed;
    private int schedulesFailed;
    private long executionTimeMs;
    private String error;
}
