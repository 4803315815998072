package io.surfworks.vectorforge.render;

import io.surfworks.vectorforge.vector.TestVectorSet;

import java.util.logging.Logger;

/**
 * Entry point that renders a test vector set in the dialect a {@link RenderStyle} selects.
 */
public final class TestVectorRenderers {

    private static final Logger LOG = Logger.getLogger(TestVectorRenderers.class.getName());

    private TestVectorRenderers() {}

    public static String render(RenderStyle style, TestVectorSet set) throws RenderException {
        LOG.fine("Rendering " + set.size() + " vectors as " + style.dialect().cliName());
        if (style instanceof RenderStyle.Functional f) {
            return FunctionalModuleRenderer.render(f.name(), set);
        }
        if (style instanceof RenderStyle.StructArray s) {
            return StructArrayRenderer.render(s.name(), set);
        }
        if (style instanceof RenderStyle.BitVector b) {
            return BitVectorRenderer.render(b.name(), b.endianness(), b.splits(), set);
        }
        throw new IllegalArgumentException("Unknown render style: " + style);
    }
}
