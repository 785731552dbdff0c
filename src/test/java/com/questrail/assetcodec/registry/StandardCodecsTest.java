package com.questrail.assetcodec.registry;

import com.questrail.assetcodec.api.ResourceInstance;
import com.questrail.assetcodec.api.ResourceTypeId;
import com.questrail.assetcodec.config.ParseLimits;
import com.questrail.assetcodec.resources.blob.OpaqueBlobResource;
import com.questrail.assetcodec.resources.clip.ClipHeaderResource;
import com.questrail.assetcodec.resources.hashmap.HashMapResource;
import com.questrail.assetcodec.resources.ngmp.NgmpResource;
import com.questrail.assetcodec.resources.objkey.ObjKeyResource;
import com.questrail.assetcodec.resources.preset.PresetResource;
import com.questrail.assetcodec.resources.preset.UserCasPresetResource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class StandardCodecsTest
{
    @Test
    void registersEveryBuiltInFormat()
    {
        CodecRegistry registry = new CodecRegistry();
        List<CodecHandle> handles = StandardCodecs.registerAll(registry, ParseLimits.defaults());

        assertEquals(6, handles.size());
        Map<ResourceTypeId, Class<? extends ResourceInstance>> expected = Map.of(
                HashMapResource.TYPE_ID, HashMapResource.class,
                ObjKeyResource.TYPE_ID, ObjKeyResource.class,
                NgmpResource.TYPE_ID, NgmpResource.class,
                PresetResource.TYPE_ID, PresetResource.class,
                UserCasPresetResource.TYPE_ID, UserCasPresetResource.class,
                ClipHeaderResource.TYPE_ID, ClipHeaderResource.class);

        expected.forEach((id, type) -> {
            CodecDescriptor<?> d = registry.resolve(id).orElseThrow();
            assertEquals(type, d.codec().resourceClass());
            assertEquals(StandardCodecs.BUILT_IN_PRIORITY, d.priority());
        });
    }

    @Test
    void bindsKnownMnemonics()
    {
        CodecRegistry registry = new CodecRegistry();
        StandardCodecs.registerAll(registry, ParseLimits.defaults());

        assertEquals(PresetResource.class, registry.resolve("PRES").orElseThrow().codec().resourceClass());
        assertEquals(NgmpResource.class, registry.resolve("NGMP").orElseThrow().codec().resourceClass());
    }

    @Test
    void opaqueFallbackRanksBelowRealCodec()
    {
        CodecRegistry registry = new CodecRegistry();
        registry.register(StandardCodecs.opaqueFallback(HashMapResource.TYPE_ID, ParseLimits.defaults()));
        assertEquals(OpaqueBlobResource.class,
                registry.resolve(HashMapResource.TYPE_ID).orElseThrow().codec().resourceClass());

        StandardCodecs.registerAll(registry, ParseLimits.defaults());
        assertEquals(HashMapResource.class,
                registry.resolve(HashMapResource.TYPE_ID).orElseThrow().codec().resourceClass());
    }

    @Test
    void unknownTypeIdStaysUnresolved()
    {
        CodecRegistry registry = new CodecRegistry();
        StandardCodecs.registerAll(registry, ParseLimits.defaults());

        assertTrue(registry.resolve(ResourceTypeId.of(0xDEADBEEF)).isEmpty());
    }
}
