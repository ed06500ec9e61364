package com.apelier.aiengine.features.gallery.domain;

import com.apelier.aiengine.features.analysis.domain.AnalysisResult;
import com.apelier.aiengine.features.analysis.domain.FaceBox;
import com.apelier.aiengine.features.analysis.domain.QualityScore;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.List;
import java.util.Map;
import java.util.Objects;

@Entity
@Table(name = "photos")
public class Photo {
    
    @Id
    private String id;
    
    @Column(name = "gallery_id", nullable = false)
    private String galleryId;
    
    @Column
    private String filename;
    
    @Column(name = "original_key", nullable = false)
    private String originalKey;
    
    @Column(name = "edited_key")
    private String editedKey;
    
    @Column(name = "web_key")
    private String webKey;
    
    @Column(name = "thumb_key")
    private String thumbKey;
    
    @Column
    private Integer width;
    
    @Column
    private Integer height;
    
    @Column(name = "scene_type")
    private String sceneType;
    
    @Column(name = "quality_score")
    private Double qualityScore;
    
    @Convert(converter = QualityDetailsConverter.class)
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "quality_details", columnDefinition = "jsonb")
    private QualityScore qualityDetails;
    
    @Convert(converter = FaceDataConverter.class)
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "face_data", columnDefinition = "jsonb")
    private List<DetectedFace> faceData;
    
    @Convert(converter = ExifDataConverter.class)
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "exif_data", columnDefinition = "jsonb")
    private Map<String, String> exifData;
    
    @Convert(converter = AiEditsConverter.class)
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "ai_edits", columnDefinition = "jsonb")
    private AiEdits aiEdits;
    
    @Column
    private String status;
    
    @Column(name = "edit_confidence")
    private Double editConfidence;
    
    @Column(name = "is_culled", nullable = false)
    private boolean culled;
    
    @Column(name = "sort_order")
    private Integer sortOrder;
    
    protected Photo() {
        // JPA constructor
    }
    
    public Photo(String id, String galleryId, String filename, String originalKey, int sortOrder) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Photo ID cannot be blank");
        }
        if (originalKey == null || originalKey.isBlank()) {
            throw new IllegalArgumentException("Original key cannot be blank");
        }
        this.id = id;
        this.galleryId = galleryId;
        this.filename = filename;
        this.originalKey = originalKey;
        this.sortOrder = sortOrder;
        this.status = GalleryStatus.PHOTO_UPLOADED;
    }
    
    public void applyAnalysis(AnalysisResult result) {
        this.sceneType = result.sceneType().value();
        this.qualityScore = result.qualityScore();
        this.qualityDetails = result.quality();
        this.faceData = result.faces().stream().map(DetectedFace::from).toList();
        this.exifData = result.exif();
        this.width = result.width();
        this.height = result.height();
    }
    
    public void markStyled(String editedKey) {
        this.editedKey = editedKey;
        this.aiEdits = edits().withStyle(AiEdits.NEURAL_STYLE);
    }
    
    public void recordFaceRetouch(String editedKey, int faces, double fidelity) {
        this.editedKey = editedKey;
        this.aiEdits = edits().withFaceRetouch(new AiEdits.FaceRetouch(faces, fidelity));
    }
    
    public void recordSceneCleanup(String editedKey, int detections, double coveragePct) {
        this.editedKey = editedKey;
        this.aiEdits = edits().withSceneCleanup(new AiEdits.SceneCleanup(detections, coveragePct));
    }
    
    /**
     * @param editedKey key of the re-encoded image, or null when composition left the image unchanged
     */
    public void recordComposition(String editedKey, AiEdits.Composition composition) {
        if (editedKey != null) {
            this.editedKey = editedKey;
        }
        this.aiEdits = edits().withComposition(composition);
    }
    
    public void markEdited(String editedKey, String webKey, String thumbKey, int width, int height,
                           double editConfidence, String pipelineVersion, boolean hasPreset) {
        this.editedKey = Objects.requireNonNull(editedKey, "editedKey");
        this.webKey = webKey;
        this.thumbKey = thumbKey;
        this.width = width;
        this.height = height;
        this.editConfidence = editConfidence;
        this.aiEdits = edits().withRunStamp(pipelineVersion, hasPreset);
        this.status = GalleryStatus.PHOTO_EDITED;
    }
    
    /**
     * Face boxes as stored, in original-image coordinates. Malformed entries are dropped.
     */
    public List<FaceBox> faceBoxes() {
        if (faceData == null) {
            return List.of();
        }
        return faceData.stream().map(DetectedFace::toBox).filter(Objects::nonNull).toList();
    }
    
    public AiEdits edits() {
        return aiEdits != null ? aiEdits : AiEdits.empty();
    }
    
    public void cull() {
        this.culled = true;
    }
    
    public String getId() { return id; }
    public String getGalleryId() { return galleryId; }
    public String getFilename() { return filename; }
    public String getOriginalKey() { return originalKey; }
    public String getEditedKey() { return editedKey; }
    public String getWebKey() { return webKey; }
    public String getThumbKey() { return thumbKey; }
    public Integer getWidth() { return width; }
    public Integer getHeight() { return height; }
    public String getSceneType() { return sceneType; }
    public Double getQualityScore() { return qualityScore; }
    public QualityScore getQualityDetails() { return qualityDetails; }
    public List<DetectedFace> getFaceData() { return faceData; }
    public Map<String, String> getExifData() { return exifData; }
    public AiEdits getAiEdits() { return aiEdits; }
    public String getStatus() { return status; }
    public Double getEditConfidence() { return editConfidence; }
    public boolean isCulled() { return culled; }
    public Integer getSortOrder() { return sortOrder; }
}
