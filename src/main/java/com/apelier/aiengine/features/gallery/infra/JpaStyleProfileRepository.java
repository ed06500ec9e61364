package com.apelier.aiengine.features.gallery.infra;

import com.apelier.aiengine.features.gallery.domain.StyleProfile;
import com.apelier.aiengine.features.gallery.domain.StyleProfileRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaStyleProfileRepository extends JpaRepository<StyleProfile, String>, StyleProfileRepository {
}
