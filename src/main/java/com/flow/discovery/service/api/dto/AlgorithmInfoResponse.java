package com.flow.discovery.service.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * DTO describing a supported algorithm and its parameter defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlgorithmInfoResponse {

    private String name;

    private String displayName;

    private String description;

    private Map<String, Object> defaults;
}
