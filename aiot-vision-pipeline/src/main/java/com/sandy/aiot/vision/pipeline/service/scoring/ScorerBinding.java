package com.sandy.aiot.vision.pipeline.service.scoring;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Which scorer variant and model id an equipment type is scored with.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScorerBinding {
    private String modelId;
    private ScorerType type;

    public void validate() {
        if (modelId == null || modelId.isBlank()) throw new IllegalArgumentException("binding modelId is required");
        if (type == null) throw new IllegalArgumentException("binding " + modelId + ": type is required");
    }
}
