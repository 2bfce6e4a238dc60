package com.portfolioscanner.common.insight;

import java.util.function.Predicate;

/**
 * One row of a {@link RuleTable}: a named condition and the result it yields.
 */
public record Rule<I, R>(String name, Predicate<I> condition, R result) {

    public boolean matches(I input) {
        return condition.test(input);
    }
}
