package com.apelier.aiengine.features.gallery.domain;

import java.util.Optional;

public interface GalleryRepository {
    Gallery save(Gallery gallery);
    Optional<Gallery> findById(String id);
}
