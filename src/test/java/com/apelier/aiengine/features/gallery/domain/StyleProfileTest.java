package com.apelier.aiengine.features.gallery.domain;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StyleProfileTest {
    
    @Test
    void modelFilenameIsLastKeySegment() {
        StyleProfile profile = new StyleProfile("sp-1", "p-1", "models/p-1/abc123.pth", "ready");
        
        assertEquals(Optional.of("abc123.pth"), profile.modelFilename());
    }
    
    @Test
    void untrainedProfileHasNoModel() {
        assertTrue(new StyleProfile("sp-1", "p-1", null, "pending").modelFilename().isEmpty());
        assertTrue(new StyleProfile("sp-1", "p-1", " ", "pending").modelFilename().isEmpty());
    }
}
