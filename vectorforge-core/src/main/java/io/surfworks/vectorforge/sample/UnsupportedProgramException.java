package io.surfworks.vectorforge.sample;

import java.util.List;

/**
 * Thrown when a program declares external function definitions, which cannot
 * be evaluated concretely.
 */
public class UnsupportedProgramException extends SamplingException {

    private final List<String> definitions;

    public UnsupportedProgramException(List<String> definitions) {
        super("Cannot generate tests in the presence of external function definitions: "
                + String.join(", ", definitions));
        this.definitions = List.copyOf(definitions);
    }

    public List<String> getDefinitions() {
        return definitions;
    }
}
