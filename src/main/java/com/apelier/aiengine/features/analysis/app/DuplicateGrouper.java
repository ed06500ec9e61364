package com.apelier.aiengine.features.analysis.app;

import com.apelier.aiengine.common.config.AnalysisProperties;
import com.apelier.aiengine.features.analysis.domain.PhotoFingerprint;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Greedy single-pass grouping of near-identical photos (bursts, duplicates).
 * <p>
 * Each photo joins the first existing group whose leader's hash is closer than the threshold,
 * otherwise it leads a new group. There is no merge pass, so membership depends on input order.
 * Photos without a hash always form their own group.
 */
@Component
public class DuplicateGrouper {
    
    public static final int DEFAULT_THRESHOLD = 10;
    
    private final int threshold;
    
    @Autowired
    public DuplicateGrouper(AnalysisProperties analysisProperties) {
        this(analysisProperties.getDuplicateThreshold());
    }
    
    public DuplicateGrouper(int threshold) {
        this.threshold = threshold;
    }
    
    /**
     * @return leader photo id to member photo ids (leader first), in the order groups were opened
     */
    public Map<String, List<String>> group(List<PhotoFingerprint> photos) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        List<PhotoFingerprint> leaders = new ArrayList<>();
        
        for (PhotoFingerprint photo : photos) {
            if (!photo.isHashed()) {
                groups.put(photo.photoId(), new ArrayList<>(List.of(photo.photoId())));
                continue;
            }
            
            PhotoFingerprint leader = findLeader(leaders, photo);
            if (leader != null) {
                groups.get(leader.photoId()).add(photo.photoId());
            } else {
                groups.put(photo.photoId(), new ArrayList<>(List.of(photo.photoId())));
                leaders.add(photo);
            }
        }
        return groups;
    }
    
    private PhotoFingerprint findLeader(List<PhotoFingerprint> leaders, PhotoFingerprint photo) {
        for (PhotoFingerprint leader : leaders) {
            if (PerceptualHasher.hammingDistance(photo.perceptualHash(), leader.perceptualHash()) < threshold) {
                return leader;
            }
        }
        return null;
    }
}
