package com.apelier.aiengine.features.gallery.infra;

import com.apelier.aiengine.features.gallery.domain.Photo;
import com.apelier.aiengine.features.gallery.domain.PhotoRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaPhotoRepository extends JpaRepository<Photo, String>, PhotoRepository {
    
    @Override
    List<Photo> findByGalleryIdAndCulledFalseOrderBySortOrderAsc(String galleryId);
    
    @Override
    long countByGalleryIdAndCulledFalse(String galleryId);
}
