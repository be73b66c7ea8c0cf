package com.quashbugs.prpulse.model;

public enum MessagingProviderType {
    SLACK,
    DISCORD,
    TEAMS
}
