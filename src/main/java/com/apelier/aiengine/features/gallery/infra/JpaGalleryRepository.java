package com.apelier.aiengine.features.gallery.infra;

import com.apelier.aiengine.features.gallery.domain.Gallery;
import com.apelier.aiengine.features.gallery.domain.GalleryRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaGalleryRepository extends JpaRepository<Gallery, String>, GalleryRepository {
}
