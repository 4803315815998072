package io.surfworks.vectorforge.sample;

import io.surfworks.vectorforge.value.ConcreteValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of running a program once under concrete values.
 *
 * @param bindings    free variables in the order they were drawn
 * @param nodes       concrete value of every node the evaluator computed, by identifier
 * @param constraints declared constraints, each naming the node holding its truth value
 * @param outputs     identifiers of the output nodes, in output order
 * @param definitions names of user-defined external functions the program declared
 */
public record Evaluation(
        List<Binding> bindings,
        Map<String, ConcreteValue> nodes,
        List<Constraint> constraints,
        List<String> outputs,
        List<String> definitions
) {

    public Evaluation {
        bindings = List.copyOf(bindings);
        nodes = Map.copyOf(nodes);
        constraints = List.copyOf(constraints);
        outputs = List.copyOf(outputs);
        definitions = List.copyOf(definitions);
    }

    public Optional<ConcreteValue> lookup(String node) {
        return Optional.ofNullable(nodes.get(node));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A drawn free variable.
     */
    public record Binding(String name, ConcreteValue value) {
        public Binding {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * Builder used by evaluators to assemble one draw.
     *
     * <p>{@link #input} records a free variable and makes its value available
     * as a node under the same name.
     */
    public static final class Builder {
        private final List<Binding> bindings = new ArrayList<>();
        private final Map<String, ConcreteValue> nodes = new LinkedHashMap<>();
        private final List<Constraint> constraints = new ArrayList<>();
        private final List<String> outputs = new ArrayList<>();
        private final List<String> definitions = new ArrayList<>();

        private Builder() {}

        public Builder input(String name, ConcreteValue value) {
            bindings.add(new Binding(name, value));
            nodes.put(name, value);
            return this;
        }

        public Builder node(String name, ConcreteValue value) {
            nodes.put(name, value);
            return this;
        }

        public Builder constrain(String node) {
            constraints.add(Constraint.hard(node));
            return this;
        }

        public Builder constrain(Constraint constraint) {
            constraints.add(constraint);
            return this;
        }

        public Builder output(String node) {
            outputs.add(node);
            return this;
        }

        public Builder define(String functionName) {
            definitions.add(functionName);
            return this;
        }

        public Evaluation build() {
            return new Evaluation(bindings, nodes, constraints, outputs, definitions);
        }
    }
}
