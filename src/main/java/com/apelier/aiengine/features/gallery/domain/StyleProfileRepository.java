package com.apelier.aiengine.features.gallery.domain;

import java.util.Optional;

public interface StyleProfileRepository {
    StyleProfile save(StyleProfile profile);
    Optional<StyleProfile> findById(String id);
}
