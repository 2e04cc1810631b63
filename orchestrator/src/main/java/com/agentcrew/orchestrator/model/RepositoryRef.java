package com.agentcrew.orchestrator.model;

import java.util.Objects;

/** Identity of a hosted repository (owner + name). */
public record RepositoryRef(String owner, String name) {

    public RepositoryRef {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(name, "name");
    }

    public static RepositoryRef parse(String fullName) {
        int slash = fullName.indexOf('/');
        if (slash <= 0 || slash == fullName.length() - 1) {
            throw new IllegalArgumentException("Expected owner/name but got: " + fullName);
        }
        return new RepositoryRef(fullName.substring(0, slash), fullName.substring(slash + 1));
    }

    public String fullName() {
        return owner + "/" + name;
    }

    @Override
    public String toString() {
        return fullName();
    }
}
