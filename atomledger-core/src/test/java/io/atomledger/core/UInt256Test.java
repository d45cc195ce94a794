package io.atomledger.core;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UInt256Test {

    @Test
    void arithmeticStaysInRange() {
        assertThat(UInt256.of(7).add(UInt256.of(5))).isEqualTo(UInt256.of(12));
        assertThat(UInt256.of(7).subtract(UInt256.of(7)).isZero()).isTrue();
        assertThatThrownBy(() -> UInt256.ZERO.subtract(UInt256.ONE)).isInstanceOf(ArithmeticException.class);
        assertThatThrownBy(() -> UInt256.MAX.add(UInt256.ONE)).isInstanceOf(ArithmeticException.class);
    }

    @Test
    void decimalAndBytesRoundTrip() {
        UInt256 value = UInt256.parse("1000000000000000000000000");
        assertThat(value.toString()).isEqualTo("1000000000000000000000000");
        assertThat(value.toByteArray()).hasSize(UInt256.BYTES);
        assertThat(UInt256.fromBytes(value.toByteArray())).isEqualTo(value);
        assertThat(UInt256.MAX.toBigInteger()).isEqualTo(BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE));
    }

    @Test
    void ordersNumerically() {
        assertThat(UInt256.of(2)).isLessThan(UInt256.of(10));
        assertThat(UInt256.MAX).isGreaterThan(UInt256.ONE);
    }
}
