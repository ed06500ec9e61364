package com.apelier.aiengine.features.pipeline.infra;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Queue message asking for a gallery to be processed: {@code {"gallery_id": "...", "style_profile_id": "..."}}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProcessingRequestMessage(String galleryId, String styleProfileId) {
}
