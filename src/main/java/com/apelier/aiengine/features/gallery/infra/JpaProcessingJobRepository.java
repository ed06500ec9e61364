package com.apelier.aiengine.features.gallery.infra;

import com.apelier.aiengine.features.gallery.domain.ProcessingJob;
import com.apelier.aiengine.features.gallery.domain.ProcessingJobRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaProcessingJobRepository extends JpaRepository<ProcessingJob, String>, ProcessingJobRepository {
}
