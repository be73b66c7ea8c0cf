package com.quashbugs.prpulse.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "execution_logs")
public class ExecutionLog {
    @Id
    private String id;
    @Indexed
    private String scheduleId;
    private Instant executedAt;
    private ExecutionStatus status;
    private int pullRequestsFound;
    private int messagesSent;
    private int escalationsTriggered;
    private String errorMessage;
    private long executionTimeMs;
}
