package com.agl.grammar.codec;

import static org.junit.jupiter.api.Assertions.*;

import com.agl.grammar.core.GrammarDecodeException;
import java.util.Random;
import org.junit.jupiter.api.Test;

final class ObfuscationCodecTest {

    @Test
    void shiftsEachPositionByPowerOfBase() {
        // 2^i mod 3 alternates 1, 2, 1, 2
        assertEquals("\"#BCBC", ObfuscationCodec.encode("AAAA", 2, 3));
        assertEquals("AAAA", ObfuscationCodec.decode("\"#BCBC"));
    }

    @Test
    void wrapsWithinPrintableBand() {
        String encoded = ObfuscationCodec.encode("~", 2, 3);
        assertEquals(' ', encoded.charAt(2));
        assertEquals("~", ObfuscationCodec.decode(encoded));
    }

    @Test
    void leavesCharactersOutsideBandAlone() {
        String plain = "ä/M>1;é";
        String encoded = ObfuscationCodec.encode(plain, 5, 7);
        assertEquals('ä', encoded.charAt(2));
        assertEquals('é', encoded.charAt(encoded.length() - 1));
        assertEquals(plain, ObfuscationCodec.decode(encoded));
    }

    @Test
    void randomKeysRoundTrip() {
        ObfuscationCodec codec = new ObfuscationCodec(new Random(7));
        String plain = "M R S V X/M>1,R>2;S>2,*;X>0,*";
        for (int i = 0; i < 100; i++) {
            String encoded = codec.encode(plain);
            int base = encoded.charAt(0) - ObfuscationCodec.BAND_START;
            int modulus = encoded.charAt(1) - ObfuscationCodec.BAND_START;
            assertEquals(1, ObfuscationCodec.gcd(base, modulus));
            assertEquals(plain, ObfuscationCodec.decode(encoded));
        }
    }

    @Test
    void rejectsMalformedHeaders() {
        assertThrows(GrammarDecodeException.class, () -> ObfuscationCodec.decode(null));
        assertThrows(GrammarDecodeException.class, () -> ObfuscationCodec.decode("\""));
        // 4 and 6 share a factor
        assertThrows(GrammarDecodeException.class, () -> ObfuscationCodec.decode("$&abc"));
        // modulus 0
        assertThrows(GrammarDecodeException.class, () -> ObfuscationCodec.decode("# abc"));
        assertThrows(GrammarDecodeException.class, () -> ObfuscationCodec.decode("ÿ#abc"));
    }
}
