package io.surfworks.vectorforge.sample;

/**
 * Thrown when an output or constraint refers to a node the evaluator did not
 * bind. This is a bug in the evaluator, not in the caller's program.
 */
public class MissingBindingException extends SamplingException {

    private final String node;

    public MissingBindingException(String node, String usage) {
        super("No concrete binding for " + usage + " node '" + node + "'");
        this.node = node;
    }

    public String getNode() {
        return node;
    }
}
