package com.quashbugs.prpulse.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PullRequestFilter {
    private List<String> repositories;
    private List<String> labels;
    private List<String> titleKeywords;
    private List<String> excludeAuthors;
    private Integer minAge; // days
    private Integer maxAge; // days
}
