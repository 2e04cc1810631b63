package com.agentcrew.orchestrator.conflict;

import com.agentcrew.orchestrator.model.WorkUnit;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Default predictor: keyword rules over the unit's title and description,
 * plus whatever files the submitter declared explicitly.
 */
@Component
public class KeywordScopePredictor implements AffectedScopePredictor {

    private record Rule(List<String> keywords, List<String> targets) {}

    private static final List<Rule> FILE_RULES = List.of(
            new Rule(List.of("auth", "login"),                          List.of("src/auth/", "src/middleware/auth.js")),
            new Rule(List.of("api", "endpoint", "route"),               List.of("src/routes/", "src/controllers/")),
            new Rule(List.of("ui", "component", "view", "frontend"),    List.of("src/components/", "src/views/")),
            new Rule(List.of("database", "model", "schema", "migration"), List.of("src/models/", "src/migrations/"))
    );

    private static final List<Rule> MODULE_RULES = List.of(
            new Rule(List.of("user", "profile"),          List.of("user-service")),
            new Rule(List.of("auth", "login"),            List.of("auth-service")),
            new Rule(List.of("payment", "billing"),       List.of("payment-service")),
            new Rule(List.of("notification", "email"),    List.of("notification-service")),
            new Rule(List.of("api", "endpoint"),          List.of("api-layer")),
            new Rule(List.of("database", "schema"),       List.of("data-layer"))
    );

    @Override
    public Set<String> predictAffectedFiles(WorkUnit unit) {
        Set<String> files = apply(FILE_RULES, unit);
        files.addAll(unit.getExplicitFiles());
        return files;
    }

    @Override
    public Set<String> predictAffectedModules(WorkUnit unit) {
        return apply(MODULE_RULES, unit);
    }

    private static Set<String> apply(List<Rule> rules, WorkUnit unit) {
        Set<String> tokens = Keywords.tokens(unit);
        Set<String> out = new LinkedHashSet<>();
        for (Rule rule : rules) {
            if (Keywords.mentions(tokens, rule.keywords())) {
                out.addAll(rule.targets());
            }
        }
        return out;
    }
}
