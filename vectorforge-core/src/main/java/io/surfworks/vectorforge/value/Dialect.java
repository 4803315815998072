package io.surfworks.vectorforge.value;

/**
 * Output text formats a test vector set can be rendered into.
 */
public enum Dialect {

    /** Haskell module holding a typed list of input/output tuples. */
    FUNCTIONAL("functional"),

    /** C program with a struct array and a printing driver. */
    STRUCT_ARRAY("c"),

    /** Forte/Verilog style bit-literal tuples. */
    BIT_VECTOR("forte");

    private final String cliName;

    Dialect(String cliName) {
        this.cliName = cliName;
    }

    public String cliName() {
        return cliName;
    }

    /**
     * Looks up a dialect by its command-line name or enum constant name, ignoring case.
     */
    public static Dialect fromName(String name) {
        for (Dialect dialect : values()) {
            if (dialect.cliName.equalsIgnoreCase(name) || dialect.name().equalsIgnoreCase(name)) {
                return dialect;
            }
        }
        throw new IllegalArgumentException("Unknown dialect: " + name);
    }
}
