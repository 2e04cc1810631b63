package com.agentcrew.orchestrator.repository;

import com.agentcrew.orchestrator.model.PipelineStage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PipelineStageRepository extends JpaRepository<PipelineStage, UUID> {

    // All stages for a unit, in execution order.
    List<PipelineStage> findByUnitIdOrderByPositionAsc(String unitId);
}
