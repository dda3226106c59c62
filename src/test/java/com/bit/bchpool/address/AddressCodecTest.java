package com.bit.bchpool.address;

import com.bit.bchpool.config.NetworkType;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class AddressCodecTest {

    private static final String MAIN_P2KH = "bitcoincash:qr95sy3j9xwd2ap32xkykttr4cvcu7as4y0qverfuy";
    private static final String TEST_P2SH = "bchtest:pr6m7j9njldwwzlg9v7v53unlr4jkmx6eyvwc0uz5t";
    private static final String TEST_LEGACY = "mipcBbFg9gMiCh81Kj8tqqdgoZub1ZJRfn";
    private static final String TEST_CASH = "bchtest:qqjr7yu573z4faxw8ltgvjwpntwys08fysk07zmvce";

    @Test
    void decodeMainnetP2kh() {
        DecodedAddress decoded = AddressCodec.decode(MAIN_P2KH);
        assertEquals(NetworkType.MAINNET, decoded.getNetwork());
        assertEquals(AddressType.P2KH, decoded.getType());
        assertEquals("cb481232299cd5743151ac4b2d63ae198e7bb0a9", Hex.toHexString(decoded.getHash160()));
    }

    @Test
    void decodeTestnetP2sh() {
        DecodedAddress decoded = AddressCodec.decode(TEST_P2SH);
        assertEquals(NetworkType.TESTNET, decoded.getNetwork());
        assertEquals(AddressType.P2SH, decoded.getType());
        assertEquals("f5bf48b397dae70be82b3cca4793f8eb2b6cdac9", Hex.toHexString(decoded.getHash160()));
    }

    @Test
    void encodeKnownVectors() {
        assertEquals("bitcoincash:qqqqqqqqqqqqqqqqqqqqqqqqqqqqqqqqqqfnhks603",
                AddressCodec.encode(NetworkType.MAINNET, AddressType.P2KH, new byte[20]));

        byte[] counting = new byte[20];
        for (int i = 0; i < counting.length; i++) {
            counting[i] = (byte) i;
        }
        assertEquals("bchreg:pqqqzqsrqszsvpcgpy9qkrqdpc83qygjzv3cnse259",
                AddressCodec.encode(NetworkType.REGTEST, AddressType.P2SH, counting));
    }

    @Test
    void roundTripKeepsPayload() {
        byte[] hash = Hex.decode("76a04053bda0a88bda5177b86a15c3b29f559873");
        String encoded = AddressCodec.encode(NetworkType.TESTNET, AddressType.P2KH, hash);
        DecodedAddress decoded = AddressCodec.decode(encoded);
        assertArrayEquals(hash, decoded.getHash160());
        assertEquals(AddressType.P2KH, decoded.getType());
        assertEquals("bchtest", decoded.getPrefix());
    }

    @Test
    void decodeWithoutPrefixUsesDefaultNetwork() {
        String bare = MAIN_P2KH.substring("bitcoincash:".length());
        DecodedAddress decoded = AddressCodec.decode(bare, NetworkType.MAINNET);
        assertEquals(NetworkType.MAINNET, decoded.getNetwork());

        AddressFormatException e = assertThrows(AddressFormatException.class, () -> AddressCodec.decode(bare));
        assertEquals(AddressFormatException.Reason.UNKNOWN_PREFIX, e.getReason());
    }

    @Test
    void uppercaseAccepted() {
        DecodedAddress decoded = AddressCodec.decode(MAIN_P2KH.toUpperCase());
        assertEquals("cb481232299cd5743151ac4b2d63ae198e7bb0a9", Hex.toHexString(decoded.getHash160()));
    }

    @Test
    void rejectsAlteredChecksum() {
        String altered = MAIN_P2KH.substring(0, MAIN_P2KH.length() - 1) + "z";
        AddressFormatException e = assertThrows(AddressFormatException.class, () -> AddressCodec.decode(altered));
        assertEquals(AddressFormatException.Reason.BAD_CHECKSUM, e.getReason());
    }

    @Test
    void rejectsMixedCase() {
        String mixed = "bitcoincash:Qr95sy3j9xwd2ap32xkykttr4cvcu7as4y0qverfuy";
        AddressFormatException e = assertThrows(AddressFormatException.class, () -> AddressCodec.decode(mixed));
        assertEquals(AddressFormatException.Reason.MIXED_CASE, e.getReason());
    }

    @Test
    void rejectsUnknownPrefix() {
        AddressFormatException e = assertThrows(AddressFormatException.class,
                () -> AddressCodec.decode("bitcoin:qr95sy3j9xwd2ap32xkykttr4cvcu7as4y0qverfuy"));
        assertEquals(AddressFormatException.Reason.UNKNOWN_PREFIX, e.getReason());
    }

    @Test
    void rejectsBadCharacter() {
        // 'b' 不在 CashAddr 字符表中
        AddressFormatException e = assertThrows(AddressFormatException.class,
                () -> AddressCodec.decode("bitcoincash:qr95sy3j9xwd2ap32xkykttr4cvcu7as4y0qverfub"));
        assertEquals(AddressFormatException.Reason.BAD_CHARACTER, e.getReason());
    }

    @Test
    void legacyConversions() {
        assertEquals("1KXrWXciRDZUpQwQmuM1DbwsKDLYAYsVLR", AddressCodec.toLegacy(MAIN_P2KH));
        assertEquals(MAIN_P2KH, AddressCodec.fromLegacy("1KXrWXciRDZUpQwQmuM1DbwsKDLYAYsVLR", NetworkType.MAINNET));

        DecodedAddress legacy = AddressCodec.decodeLegacy(TEST_LEGACY, NetworkType.TESTNET);
        assertEquals(AddressType.P2KH, legacy.getType());
        assertEquals("243f1394f44554f4ce3fd68649c19adc483ce924", Hex.toHexString(legacy.getHash160()));
        assertEquals(TEST_CASH, AddressCodec.fromLegacy(TEST_LEGACY, NetworkType.TESTNET));
        assertEquals(TEST_LEGACY, AddressCodec.toLegacy(TEST_CASH));
    }

    @Test
    void normalizeAcceptsAnyFormat() {
        assertEquals(TEST_CASH, AddressCodec.normalize(TEST_LEGACY, NetworkType.TESTNET));
        assertEquals(TEST_CASH, AddressCodec.normalize(TEST_CASH.substring("bchtest:".length()), NetworkType.TESTNET));
        assertEquals("243f1394f44554f4ce3fd68649c19adc483ce924",
                Hex.toHexString(AddressCodec.extractHash160(TEST_CASH, NetworkType.TESTNET)));
        assertTrue(AddressCodec.isValid(TEST_CASH, NetworkType.TESTNET));
        assertFalse(AddressCodec.isValid("not-an-address", NetworkType.TESTNET));
    }
}
