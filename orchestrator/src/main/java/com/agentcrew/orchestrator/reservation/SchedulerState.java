package com.agentcrew.orchestrator.reservation;

import com.agentcrew.orchestrator.model.RepositoryRef;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * All per-repository scheduling state, owned by one {@link ReservationManager}.
 * Repositories never share a lock, so work on different repositories never interacts.
 */
final class SchedulerState {

    private final Map<RepositoryRef, RepositoryState> repositories = new ConcurrentHashMap<>();

    // branch name -> repository holding it
    private final Map<String, RepositoryRef> branches = new ConcurrentHashMap<>();

    RepositoryState stateFor(RepositoryRef repository) {
        return repositories.computeIfAbsent(repository, RepositoryState::new);
    }

    Optional<RepositoryState> existing(RepositoryRef repository) {
        return Optional.ofNullable(repositories.get(repository));
    }

    List<RepositoryState> all() {
        return List.copyOf(repositories.values());
    }

    void indexBranch(String branchName, RepositoryRef repository) {
        branches.put(branchName, repository);
    }

    Optional<RepositoryRef> repositoryOf(String branchName) {
        return Optional.ofNullable(branches.get(branchName));
    }

    void forgetBranch(String branchName) {
        branches.remove(branchName);
    }
}
