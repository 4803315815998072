package io.surfworks.vectorforge.vector;

import io.surfworks.vectorforge.value.ConcreteValue;
import io.surfworks.vectorforge.value.ValueKind;
import io.surfworks.vectorforge.value.ValueKinds;

import java.util.List;

/**
 * One accepted sample: the input values drawn and the outputs they produced.
 */
public record TestVector(List<ConcreteValue> inputs, List<ConcreteValue> outputs) {

    public TestVector {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
    }

    public List<ValueKind> inputKinds() {
        return ValueKinds.kindsOf(inputs);
    }

    public List<ValueKind> outputKinds() {
        return ValueKinds.kindsOf(outputs);
    }

    /**
     * True if both sides carry the same kind sequence as {@code other}.
     */
    public boolean sameKindsAs(TestVector other) {
        return inputKinds().equals(other.inputKinds()) && outputKinds().equals(other.outputKinds());
    }
}
