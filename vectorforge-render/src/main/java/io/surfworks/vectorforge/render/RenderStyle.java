package io.surfworks.vectorforge.render;

import io.surfworks.vectorforge.value.Dialect;

import java.util.Objects;

/**
 * A dialect together with the options it needs.
 */
public sealed interface RenderStyle permits
        RenderStyle.Functional, RenderStyle.StructArray, RenderStyle.BitVector {

    String name();

    Dialect dialect();

    /**
     * Haskell module with the given value name.
     */
    record Functional(String name) implements RenderStyle {
        public Functional {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public Dialect dialect() {
            return Dialect.FUNCTIONAL;
        }
    }

    /**
     * C array of structs with the given name.
     */
    record StructArray(String name) implements RenderStyle {
        public StructArray {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public Dialect dialect() {
            return Dialect.STRUCT_ARRAY;
        }
    }

    /**
     * Forte/Verilog bit-literal tuples.
     */
    record BitVector(String name, Endianness endianness, SplitSpec splits) implements RenderStyle {
        public BitVector {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(endianness, "endianness");
            Objects.requireNonNull(splits, "splits");
        }

        @Override
        public Dialect dialect() {
            return Dialect.BIT_VECTOR;
        }
    }
}
