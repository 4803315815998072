package io.surfworks.vectorforge.sample;

import java.util.Objects;
import java.util.Optional;

/**
 * A declared boolean condition. Hard constraints gate acceptance; soft ones are
 * only recorded.
 *
 * @param node     identifier of the node holding the condition's truth value
 * @param strength whether the condition must hold for a draw to be accepted
 * @param label    optional user-facing name
 */
public record Constraint(String node, Strength strength, Optional<String> label) {

    public enum Strength {
        HARD,
        SOFT
    }

    public Constraint {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(strength, "strength");
        Objects.requireNonNull(label, "label");
    }

    public static Constraint hard(String node) {
        return new Constraint(node, Strength.HARD, Optional.empty());
    }

    public static Constraint soft(String node) {
        return new Constraint(node, Strength.SOFT, Optional.empty());
    }

    public Constraint withLabel(String name) {
        return new Constraint(node, strength, Optional.of(name));
    }

    public boolean isHard() {
        return strength == Strength.HARD;
    }

    public String displayName() {
        return label.orElse(node);
    }
}
