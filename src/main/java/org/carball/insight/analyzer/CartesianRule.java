package org.carball.insight.analyzer;

import org.carball.insight.model.suggestion.SuggestionSeverity;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One row of the row-multiplication decision table. Rules are evaluated in order and the
 * first one whose condition holds decides the severity.
 */
public record CartesianRule(
        String name,
        Predicate<JoinProfile> condition,
        Function<JoinProfile, SuggestionSeverity> severity
) {

    /**
     * Join shape and observed metrics of one statement. {@code rows} is null when unknown.
     */
    public record JoinProfile(int joinCount, int leftJoinCount, Integer rows, double durationMs) {

        boolean rowsAbove(int limit) {
            return rows != null && rows > limit;
        }
    }

    public static final int MIN_JOINS = 2;

    private static final List<CartesianRule> DEFAULT_RULES = List.of(
            new CartesianRule("many-joins-many-rows",
                    p -> p.joinCount() >= 3 && p.rowsAbove(100),
                    p -> p.rowsAbove(1000) ? SuggestionSeverity.HIGH : SuggestionSeverity.MEDIUM),
            new CartesianRule("left-joins-with-rows",
                    p -> p.leftJoinCount() >= 2 && p.rowsAbove(50),
                    p -> SuggestionSeverity.MEDIUM),
            new CartesianRule("left-joins",
                    p -> p.leftJoinCount() >= 2,
                    p -> SuggestionSeverity.LOW),
            // Eager load of a collection plus a nested reference
            new CartesianRule("joins-with-left-join",
                    p -> p.joinCount() >= 2 && p.leftJoinCount() >= 1,
                    p -> SuggestionSeverity.LOW),
            new CartesianRule("slow-joins-with-rows",
                    p -> p.joinCount() >= 2 && p.durationMs() > 200 && p.rowsAbove(50),
                    p -> SuggestionSeverity.MEDIUM),
            new CartesianRule("joins-many-rows",
                    p -> p.joinCount() >= 2 && p.rowsAbove(500),
                    p -> SuggestionSeverity.MEDIUM),
            new CartesianRule("many-joins",
                    p -> p.joinCount() >= 3,
                    p -> SuggestionSeverity.LOW));

    public static List<CartesianRule> defaults() {
        return DEFAULT_RULES;
    }

    /**
     * Severity of the first matching rule, or empty when fewer than two joins are present or
     * no rule applies.
     */
    public static Optional<SuggestionSeverity> evaluate(List<CartesianRule> rules, JoinProfile profile) {
        if (profile.joinCount() < MIN_JOINS) {
            return Optional.empty();
        }
        for (CartesianRule rule : rules) {
            if (rule.condition().test(profile)) {
                return Optional.of(rule.severity().apply(profile));
            }
        }
        return Optional.empty();
    }
}
