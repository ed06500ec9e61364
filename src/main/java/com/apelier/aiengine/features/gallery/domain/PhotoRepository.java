package com.apelier.aiengine.features.gallery.domain;

import java.util.List;
import java.util.Optional;

public interface PhotoRepository {
    Photo save(Photo photo);
    Optional<Photo> findById(String id);
    List<Photo> findByGalleryIdAndCulledFalseOrderBySortOrderAsc(String galleryId);
    long countByGalleryIdAndCulledFalse(String galleryId);
}
