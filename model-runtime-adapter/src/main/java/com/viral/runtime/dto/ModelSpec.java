package com.viral.runtime.dto;

import java.util.Map;

/**
 * Registration payload for a new model in the runtime registry.
 */
public record ModelSpec(
        String name,
        String platform,
        String type,
        String version,
        Map<String, Object> architecture,
        Map<String, Object> metadata
) {}
