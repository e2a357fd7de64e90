package com.z254.butterfly.scout.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * HTTP route found in a route definition file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Endpoint {

    private String path;

    /**
     * HTTP method when the pattern names one, otherwise {@code ANY}.
     */
    private String method;

    private String framework;
    private String file;
    private int line;
}
