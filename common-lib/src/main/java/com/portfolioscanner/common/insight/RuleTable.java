package com.portfolioscanner.common.insight;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Ordered list of {@link Rule} rows.
 *
 * <p>Two ways to read a table:
 * <ul>
 *   <li>{@link #evaluate}: rows top-down, first match wins, the {@code otherwise}
 *       row when nothing matches. Tables used this way are total.</li>
 *   <li>{@link #collect}: every matching row contributes its result, in row order.
 *       The {@code otherwise} row is not used.</li>
 * </ul>
 *
 * <p>Immutable; safe to share as a constant.
 */
public final class RuleTable<I, R> {

    private final String name;
    private final List<Rule<I, R>> rows;
    private final Rule<I, R> otherwise;

    private RuleTable(String name, List<Rule<I, R>> rows, Rule<I, R> otherwise) {
        this.name = name;
        this.rows = List.copyOf(rows);
        this.otherwise = otherwise;
    }

    public static <I, R> Builder<I, R> named(String name) {
        return new Builder<>(name);
    }

    public R evaluate(I input) {
        return matchingRule(input).result();
    }

    /** The row that decides {@code input}; the {@code otherwise} row when no other matches. */
    public Rule<I, R> matchingRule(I input) {
        for (Rule<I, R> row : rows) {
            if (row.matches(input)) return row;
        }
        if (otherwise == null) {
            throw new IllegalStateException("rule table '" + name + "' has no matching row and no fallback");
        }
        return otherwise;
    }

    public List<R> collect(I input) {
        List<R> results = new ArrayList<>();
        for (Rule<I, R> row : rows) {
            if (row.matches(input)) results.add(row.result());
        }
        return results;
    }

    public String name()           { return name; }
    public List<Rule<I, R>> rows() { return rows; }

    public static final class Builder<I, R> {
        private final String name;
        private final List<Rule<I, R>> rows = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder<I, R> when(String ruleName, Predicate<I> condition, R result) {
            rows.add(new Rule<>(ruleName, Objects.requireNonNull(condition), result));
            return this;
        }

        public RuleTable<I, R> otherwise(String ruleName, R result) {
            return new RuleTable<>(name, rows, new Rule<>(ruleName, input -> true, result));
        }

        /** Builds a table without a fallback row, for {@link RuleTable#collect} use. */
        public RuleTable<I, R> build() {
            return new RuleTable<>(name, rows, null);
        }
    }
}
