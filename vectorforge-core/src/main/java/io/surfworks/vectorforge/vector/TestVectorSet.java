package io.surfworks.vectorforge.vector;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Ordered, immutable collection of test vectors. Vector {@code i} is the
 * {@code i}-th accepted sample.
 */
public final class TestVectorSet implements Iterable<TestVector> {

    private static final TestVectorSet EMPTY = new TestVectorSet(List.of());

    private final List<TestVector> vectors;

    private TestVectorSet(List<TestVector> vectors) {
        this.vectors = vectors;
    }

    public static TestVectorSet of(List<TestVector> vectors) {
        return vectors.isEmpty() ? EMPTY : new TestVectorSet(List.copyOf(vectors));
    }

    public static TestVectorSet of(TestVector... vectors) {
        return of(List.of(vectors));
    }

    public static TestVectorSet empty() {
        return EMPTY;
    }

    /**
     * The raw vectors, for callers that need output none of the renderers produce.
     */
    public List<TestVector> vectors() {
        return vectors;
    }

    public TestVector get(int index) {
        return vectors.get(index);
    }

    public Optional<TestVector> first() {
        return vectors.isEmpty() ? Optional.empty() : Optional.of(vectors.get(0));
    }

    public int size() {
        return vectors.size();
    }

    public boolean isEmpty() {
        return vectors.isEmpty();
    }

    @Override
    public Iterator<TestVector> iterator() {
        return vectors.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TestVectorSet that)) return false;
        return vectors.equals(that.vectors);
    }

    @Override
    public int hashCode() {
        return vectors.hashCode();
    }

    @Override
    public String toString() {
        return "TestVectorSet[" + vectors.size() + " vectors]";
    }
}
