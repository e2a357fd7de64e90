package com.z254.butterfly.scout.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SecurityFinding {

    private String ruleId;
    private String title;
    private Severity severity;
    private String file;

    /**
     * 1-based line, 0 for findings about a whole file.
     */
    private int line;

    private String recommendation;

    public String describe() {
        String location = line > 0 ? file + ":" + line : file;
        return severity + ": " + title + " (" + location + ")";
    }
}
