package com.agentcrew.orchestrator.sourcehost;

import com.agentcrew.orchestrator.model.RepositoryRef;

/**
 * The git hosting service. Called after a code-mutating stage succeeds,
 * with the branch name the reservation manager generated.
 */
public interface SourceHost {

    void createBranch(RepositoryRef repo, String branchName);

    PullRequestRef createPullRequest(RepositoryRef repo, String branchName, String title, String body);
}
