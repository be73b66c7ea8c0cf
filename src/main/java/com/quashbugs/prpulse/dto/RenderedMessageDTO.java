package com.quashbugs.prpulse.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * A notification ready to hand to a chat provider. {@code blocks} is only populated for
 * {@link MessageStyle#BLOCKS}; {@code text} is always set and doubles as the fallback text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RenderedMessageDTO {
    private String text;
    private List<Map<String, Object>> blocks;
    private int pullRequestCount;
    private boolean empty;
    private boolean truncated;
}
