package com.apelier.aiengine.features.gallery.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AiEditsTest {
    
    private final AiEditsConverter converter = new AiEditsConverter();
    
    @Test
    void unwrittenFieldsStayAbsent() {
        String json = converter.convertToDatabaseColumn(AiEdits.empty().withStyle(AiEdits.NEURAL_STYLE));
        
        assertEquals("{\"style_applied\":\"neural_lut\",\"has_preset\":true}", json);
    }
    
    @Test
    void eachPhaseReplacesOnlyItsOwnField() {
        AiEdits edits = AiEdits.empty()
            .withStyle(AiEdits.NEURAL_STYLE)
            .withFaceRetouch(new AiEdits.FaceRetouch(2, 0.7))
            .withSceneCleanup(new AiEdits.SceneCleanup(3, 1.5))
            .withComposition(AiEdits.Composition.noChanges())
            .withFaceRetouch(new AiEdits.FaceRetouch(1, 0.7));
        
        assertEquals(AiEdits.NEURAL_STYLE, edits.styleApplied());
        assertEquals(1, edits.faceRetouch().faces());
        assertEquals(3, edits.sceneCleanup().detections());
        assertFalse(edits.isHorizonCorrected());
    }
    
    @Test
    void storedShapeUsesSnakeCaseKeys() {
        AiEdits edits = AiEdits.empty()
            .withSceneCleanup(new AiEdits.SceneCleanup(3, 1.5))
            .withComposition(AiEdits.Composition.applied(2.5, List.of(10, 20, 300, 200)))
            .withRunStamp("2.0", false);
        
        String json = converter.convertToDatabaseColumn(edits);
        
        assertTrue(json.contains("\"scene_cleanup\":{\"detections\":3,\"coverage_pct\":1.5}"), json);
        assertTrue(json.contains("\"horizon_corrected\":true"), json);
        assertTrue(json.contains("\"horizon_angle\":2.5"), json);
        assertTrue(json.contains("\"crop_rect\":[10,20,300,200]"), json);
        assertTrue(json.contains("\"pipeline_version\":\"2.0\""), json);
        assertTrue(json.contains("\"has_preset\":false"), json);
        assertEquals(edits, converter.convertToEntityAttribute(json));
    }
    
    @Test
    void unchangedCompositionIsRecordedAsEvaluated() {
        String json = converter.convertToDatabaseColumn(AiEdits.empty().withComposition(AiEdits.Composition.noChanges()));
        
        assertEquals("{\"composition\":{\"evaluated\":true,\"changes\":false}}", json);
    }
    
    @Test
    void unknownKeysFromOtherWritersAreIgnored() {
        AiEdits edits = converter.convertToEntityAttribute("{\"style_applied\":\"neural_lut\",\"manual_tweak\":1}");
        
        assertTrue(edits.isStyled());
        assertNull(edits.faceRetouch());
    }
}
