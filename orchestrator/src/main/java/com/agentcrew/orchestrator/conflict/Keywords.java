package com.agentcrew.orchestrator.conflict;

import com.agentcrew.orchestrator.model.Complexity;
import com.agentcrew.orchestrator.model.WorkUnit;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Text heuristics shared by the extractor, the resolution engine and overlap analysis.
 *
 * All matching works on lower-cased alphanumeric tokens of a unit's title and
 * description. A keyword matches a token exactly, or as a prefix when it is at
 * least four characters long ("auth" matches "authentication", "ui" does not match "build").
 */
public final class Keywords {

    private static final Pattern SEPARATORS = Pattern.compile("[^a-z0-9]+");
    private static final Pattern DIGITS     = Pattern.compile("\\d+");

    static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
            "from", "up", "about", "into", "through", "during", "before", "after", "above",
            "below", "between", "among", "task", "feature", "implement", "create", "update",
            "add", "remove", "fix", "improve");

    // Business areas that make two units "about the same thing".
    private static final List<String> FEATURE_AREAS =
            List.of("auth", "payment", "user", "profile", "dashboard", "api", "database");

    private Keywords() {}

    public static String text(WorkUnit unit) {
        String description = unit.getDescription() == null ? "" : unit.getDescription();
        return (unit.getTitle() + " " + description).toLowerCase();
    }

    public static Set<String> tokens(WorkUnit unit) {
        return Arrays.stream(SEPARATORS.split(text(unit)))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public static boolean mentions(Set<String> tokens, Collection<String> keywords) {
        for (String keyword : keywords) {
            for (String token : tokens) {
                if (token.equals(keyword) || (keyword.length() >= 4 && token.startsWith(keyword))) {
                    return true;
                }
            }
        }
        return false;
    }

    public static boolean mentions(Set<String> tokens, String... keywords) {
        return mentions(tokens, Arrays.asList(keywords));
    }

    /** Words that carry meaning: longer than two characters, not numbers, not stop-words. */
    public static Set<String> meaningfulKeywords(WorkUnit unit) {
        return tokens(unit).stream()
                .filter(t -> t.length() > 2)
                .filter(t -> !DIGITS.matcher(t).matches())
                .filter(t -> !STOP_WORDS.contains(t))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public static Set<String> sharedKeywords(WorkUnit a, WorkUnit b) {
        Set<String> shared = meaningfulKeywords(a);
        shared.retainAll(meaningfulKeywords(b));
        return shared;
    }

    /** Shared meaningful keywords over the union of both keyword sets; 0.0 when both are empty. */
    public static double similarity(WorkUnit a, WorkUnit b) {
        Set<String> first  = meaningfulKeywords(a);
        Set<String> second = meaningfulKeywords(b);
        Set<String> union = new LinkedHashSet<>(first);
        union.addAll(second);
        if (union.isEmpty()) {
            return 0.0;
        }
        first.retainAll(second);
        return (double) first.size() / union.size();
    }

    public static Set<String> featureAreas(WorkUnit unit) {
        Set<String> tokens = tokens(unit);
        return FEATURE_AREAS.stream()
                .filter(area -> mentions(tokens, area))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** Same feature area, both UI work, or both API work. */
    public static boolean sharesConceptualPattern(WorkUnit a, WorkUnit b) {
        Set<String> areas = featureAreas(a);
        areas.retainAll(featureAreas(b));
        if (!areas.isEmpty()) {
            return true;
        }
        Set<String> ta = tokens(a);
        Set<String> tb = tokens(b);
        if (mentions(ta, "ui", "component") && mentions(tb, "ui", "component")) {
            return true;
        }
        return mentions(ta, "api", "endpoint", "route") && mentions(tb, "api", "endpoint", "route");
    }

    /** The single layer a unit's text points at; empty when none or several match. */
    public static Optional<ArchitecturalLayer> layerOf(WorkUnit unit) {
        Set<String> tokens = tokens(unit);
        List<ArchitecturalLayer> matched = Arrays.stream(ArchitecturalLayer.values())
                .filter(layer -> mentions(tokens, layer.keywords()))
                .toList();
        return matched.size() == 1 ? Optional.of(matched.get(0)) : Optional.empty();
    }

    /** Capability tags a unit needs, matched against {@code AgentRole.capabilities()}. */
    public static Set<String> requirementTags(WorkUnit unit) {
        Set<String> tokens = tokens(unit);
        Set<String> tags = new LinkedHashSet<>();
        if (mentions(tokens, "requirement", "analysis")) {
            tags.addAll(List.of("requirements", "analysis"));
        }
        if (mentions(tokens, "plan", "coordinate")) {
            tags.addAll(List.of("planning", "coordination"));
        }
        if (mentions(tokens, "architect", "design")) {
            tags.addAll(List.of("architecture", "design"));
        }
        if (mentions(tokens, "complex") || unit.getComplexity().isAtLeast(Complexity.COMPLEX)) {
            tags.add("complex-features");
        }
        if (mentions(tokens, "ui", "component") || unit.getComplexity() == Complexity.SIMPLE) {
            tags.addAll(List.of("simple-features", "ui"));
        }
        if (mentions(tokens, "test", "quality")) {
            tags.addAll(List.of("testing", "validation", "quality-assurance"));
        }
        return tags;
    }
}
