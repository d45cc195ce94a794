package io.atomledger.core;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EUIDTest {

    @Test
    void bytesAreFixedWidthBigEndian() {
        byte[] bytes = EUID.of(258).toByteArray();
        assertThat(bytes).hasSize(EUID.BYTES);
        assertThat(bytes[14]).isEqualTo((byte) 1);
        assertThat(bytes[15]).isEqualTo((byte) 2);
    }

    @Test
    void hexRoundTrips() {
        EUID id = EUID.of(new BigInteger("0123456789abcdef0123456789abcdef", 16));
        assertThat(id.toHex()).isEqualTo("0123456789abcdef0123456789abcdef");
        assertThat(EUID.parse(id.toHex())).isEqualTo(id);
        assertThat(EUID.fromBytes(id.toByteArray())).isEqualTo(id);
    }

    @Test
    void largestValueFitsAndNextDoesNot() {
        BigInteger max = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);
        assertThat(EUID.of(max).toHex()).isEqualTo("ffffffffffffffffffffffffffffffff");
        assertThatThrownBy(() -> EUID.of(max.add(BigInteger.ONE)))
                .isInstanceOf(LedgerException.MalformedIdentifier.class);
        assertThatThrownBy(() -> EUID.of(-1))
                .isInstanceOf(LedgerException.MalformedIdentifier.class);
    }

    @Test
    void rejectsMalformedText() {
        assertThatThrownBy(() -> EUID.parse("abc")).isInstanceOf(LedgerException.MalformedIdentifier.class);
        assertThatThrownBy(() -> EUID.parse("zz23456789abcdef0123456789abcdef"))
                .isInstanceOf(LedgerException.MalformedIdentifier.class);
        assertThatThrownBy(() -> EUID.fromBytes(new byte[15]))
                .isInstanceOf(LedgerException.MalformedIdentifier.class);
    }

    @Test
    void comparesUnsigned() {
        EUID high = EUID.parse("80000000000000000000000000000000");
        EUID low = EUID.of(1);
        assertThat(high).isGreaterThan(low);
    }

    @Test
    void fromHashKeepsLeadingBytes() {
        byte[] hash = new byte[32];
        hash[0] = 0x7f;
        hash[16] = 0x55;
        EUID id = EUID.fromHash(hash);
        assertThat(id.toByteArray()[0]).isEqualTo((byte) 0x7f);
        assertThat(id.toHex()).isEqualTo("7f000000000000000000000000000000");
    }
}
