package io.surfworks.vectorforge.render;

import io.surfworks.vectorforge.value.ConcreteValue;
import io.surfworks.vectorforge.value.Dialect;
import io.surfworks.vectorforge.value.ValueKind;

/**
 * Thrown when a value's kind has no encoding in the target dialect.
 */
public class UnsupportedKindException extends RenderException {

    private final ValueKind kind;
    private final Dialect dialect;

    public UnsupportedKindException(ConcreteValue value, Dialect dialect) {
        super(String.format("Unsupported kind %s in %s output: %s",
                value.kind().describe(), dialect.cliName(), value));
        this.kind = value.kind();
        this.dialect = dialect;
    }

    public ValueKind getKind() {
        return kind;
    }

    public Dialect getDialect() {
        return dialect;
    }
}
