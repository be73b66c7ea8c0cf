package com.quashbugs.prpulse.model;

public enum GitProviderType {
    GITHUB,
    GITLAB,
    BITBUCKET
}
