package com.questrail.assetcodec.api;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class ResourceTypeIdTest
{
    @Test
    void equalityIgnoresMnemonic()
    {
        ResourceTypeId plain = ResourceTypeId.of(0x4E69E952);
        ResourceTypeId named = ResourceTypeId.of(0x4E69E952, "PRES");

        assertEquals(plain, named);
        assertEquals(plain.hashCode(), named.hashCode());
        assertEquals(Optional.of("PRES"), named.mnemonic());
    }

    @Test
    void parsesHexTextWithOrWithoutPrefix()
    {
        assertEquals(Optional.of(ResourceTypeId.of(0x4E69E952)), ResourceTypeId.parseHex("0x4E69E952"));
        assertEquals(Optional.of(ResourceTypeId.of(0xBC4A5044)), ResourceTypeId.parseHex("bc4a5044"));
        assertTrue(ResourceTypeId.parseHex("").isEmpty());
        assertTrue(ResourceTypeId.parseHex("123456789").isEmpty());
        assertTrue(ResourceTypeId.parseHex("PRES").isEmpty());
    }

    @Test
    void highBitValuesFormatUnsigned()
    {
        ResourceTypeId id = ResourceTypeId.of(0xF3A38370);
        assertEquals("0xF3A38370", id.toHex());
        assertEquals(0xF3A38370L, id.unsignedValue());
    }

    @Test
    void blankMnemonicIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> ResourceTypeId.of(1, " "));
    }
}
