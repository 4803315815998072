package io.surfworks.vectorforge.render;

import io.surfworks.vectorforge.value.ConcreteValue;
import io.surfworks.vectorforge.value.ValueKind;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BitBlasterTest {

    @Test
    void booleansAreOneBit() throws UnsupportedKindException {
        assertEquals("1", BitBlaster.blast(ConcreteValue.bool(true)));
        assertEquals("0", BitBlaster.blast(ConcreteValue.bool(false)));
    }

    @Test
    void integersAreMostSignificantBitFirst() throws UnsupportedKindException {
        assertEquals("0001001000110100", BitBlaster.blast(ConcreteValue.word(16, 0x1234)));
        assertEquals("1010", BitBlaster.blast(ConcreteValue.word(4, 10)));
    }

    @Test
    void signedIntegersUseTwosComplement() throws UnsupportedKindException {
        assertEquals("11111111", BitBlaster.blast(ConcreteValue.signed(8, -1)));
        assertEquals("10000000", BitBlaster.blast(ConcreteValue.signed(8, -128)));
        assertEquals("01111111", BitBlaster.blast(ConcreteValue.signed(8, 127)));
    }

    @Test
    void listsConcatenateInOrder() throws UnsupportedKindException {
        assertEquals("11010", BitBlaster.blast(List.of(ConcreteValue.bool(true), ConcreteValue.word(4, 10))));
        assertEquals("", BitBlaster.blast(List.of()));
    }

    @Test
    void readingBackRecoversRandomValues() throws UnsupportedKindException {
        Random random = new Random(7);
        for (int width : new int[] {1, 3, 8, 13, 32, 64}) {
            for (boolean signed : new boolean[] {false, true}) {
                ValueKind.BoundedKind kind = new ValueKind.BoundedKind(signed, width);
                for (int i = 0; i < 20; i++) {
                    ConcreteValue value = ConcreteValue.fromBits(kind, new BigInteger(width, random));
                    String bits = BitBlaster.blast(value);
                    assertEquals(width, bits.length());
                    assertEquals(value, BitBlaster.read(bits, kind));
                }
            }
        }
    }

    @Test
    void readRejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> BitBlaster.read("101", ValueKind.word(4)));
    }

    @Test
    void unsupportedKindsAreRejected() {
        assertThrows(UnsupportedKindException.class, () -> BitBlaster.blast(ConcreteValue.ofFloat(1.0f)));
        assertThrows(UnsupportedKindException.class,
                () -> BitBlaster.blast(ConcreteValue.integer(BigInteger.ONE)));
    }
}
