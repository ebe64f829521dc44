package com.lipid.advisor.evaluator;

import com.lipid.advisor.model.RiskAssessment;
import com.lipid.advisor.model.RiskProfile;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One rung of the risk ladder: a predicate over the profile and the assessment it produces
 */
public final class RiskRule {
    private final String name;
    private final Predicate<RiskProfile> condition;
    private final Function<RiskProfile, RiskAssessment> outcome;

    public RiskRule(String name, Predicate<RiskProfile> condition,
                    Function<RiskProfile, RiskAssessment> outcome) {
        this.name = Objects.requireNonNull(name, "name");
        this.condition = Objects.requireNonNull(condition, "condition");
        this.outcome = Objects.requireNonNull(outcome, "outcome");
    }

    public String getName() {
        return name;
    }

    public boolean matches(RiskProfile profile) {
        return condition.test(profile);
    }

    public RiskAssessment apply(RiskProfile profile) {
        return outcome.apply(profile);
    }

    @Override
    public String toString() {
        return "RiskRule[" + name + "]";
    }
}
