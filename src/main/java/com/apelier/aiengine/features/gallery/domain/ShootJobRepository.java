package com.apelier.aiengine.features.gallery.domain;

import java.util.Optional;

public interface ShootJobRepository {
    ShootJob save(ShootJob job);
    Optional<ShootJob> findById(String id);
}
