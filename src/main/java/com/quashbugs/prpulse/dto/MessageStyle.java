package com.quashbugs.prpulse.dto;

public enum MessageStyle {
    BLOCKS,
    PLAIN_TEXT
}
