package com.agentcrew.orchestrator.repository;

import com.agentcrew.orchestrator.model.WorkStatus;
import com.agentcrew.orchestrator.model.WorkUnit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WorkUnitRepository extends JpaRepository<WorkUnit, String> {

    List<WorkUnit> findByStatus(WorkStatus status);
}
