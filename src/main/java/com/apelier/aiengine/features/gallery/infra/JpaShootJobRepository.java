package com.apelier.aiengine.features.gallery.infra;

import com.apelier.aiengine.features.gallery.domain.ShootJob;
import com.apelier.aiengine.features.gallery.domain.ShootJobRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaShootJobRepository extends JpaRepository<ShootJob, String>, ShootJobRepository {
}
