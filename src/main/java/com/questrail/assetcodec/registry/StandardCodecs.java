package com.questrail.assetcodec.registry;

import com.questrail.assetcodec.api.ResourceTypeId;
import com.questrail.assetcodec.config.ParseLimits;
import com.questrail.assetcodec.resources.blob.OpaqueBlobCodec;
import com.questrail.assetcodec.resources.blob.OpaqueBlobResource;
import com.questrail.assetcodec.resources.clip.ClipHeaderCodec;
import com.questrail.assetcodec.resources.clip.ClipHeaderResource;
import com.questrail.assetcodec.resources.hashmap.HashMapCodec;
import com.questrail.assetcodec.resources.hashmap.HashMapResource;
import com.questrail.assetcodec.resources.ngmp.NgmpCodec;
import com.questrail.assetcodec.resources.ngmp.NgmpResource;
import com.questrail.assetcodec.resources.objkey.ObjKeyCodec;
import com.questrail.assetcodec.resources.objkey.ObjKeyResource;
import com.questrail.assetcodec.resources.preset.PresetCodec;
import com.questrail.assetcodec.resources.preset.PresetResource;
import com.questrail.assetcodec.resources.preset.UserCasPresetCodec;
import com.questrail.assetcodec.resources.preset.UserCasPresetResource;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Explicit bootstrap for the codecs shipped with this library.
 *
 * <p>Built-in codecs are registered at {@link #BUILT_IN_PRIORITY}. A caller can
 * override any of them by registering its own codec at a higher priority, or
 * keep unknown revisions readable by registering an
 * {@link #opaqueFallback opaque fallback} below it.</p>
 */
public final class StandardCodecs
{
    public static final int BUILT_IN_PRIORITY = 100;
    public static final int FALLBACK_PRIORITY = Integer.MIN_VALUE;

    private StandardCodecs() {
    }

    /**
     * Registers every built-in codec and binds the known mnemonics.
     *
     * @return the handles of the new registrations, in registration order
     */
    public static List<CodecHandle> registerAll(CodecRegistry registry, ParseLimits limits) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(limits, "limits");

        List<CodecHandle> handles = new ArrayList<>();
        handles.add(registry.register(CodecDescriptor.builder(new HashMapCodec(limits))
                .withName("hashmap")
                .withTypeId(HashMapResource.TYPE_ID)
                .withPriority(BUILT_IN_PRIORITY)
                .build()));
        handles.add(registry.register(CodecDescriptor.builder(new ObjKeyCodec(limits))
                .withName("objkey")
                .withTypeId(ObjKeyResource.TYPE_ID)
                .withPriority(BUILT_IN_PRIORITY)
                .build()));
        handles.add(registry.register(CodecDescriptor.builder(new NgmpCodec(limits))
                .withName("ngmp")
                .withTypeId(NgmpResource.TYPE_ID)
                .withPriority(BUILT_IN_PRIORITY)
                .build()));
        handles.add(registry.register(CodecDescriptor.builder(new PresetCodec(limits))
                .withName("preset")
                .withTypeId(PresetResource.TYPE_ID)
                .withPriority(BUILT_IN_PRIORITY)
                .build()));
        handles.add(registry.register(CodecDescriptor.builder(new UserCasPresetCodec(limits))
                .withName("user-cas-preset")
                .withTypeId(UserCasPresetResource.TYPE_ID)
                .withPriority(BUILT_IN_PRIORITY)
                .build()));
        handles.add(registry.register(CodecDescriptor.builder(new ClipHeaderCodec(limits))
                .withName("clip-header")
                .withTypeId(ClipHeaderResource.TYPE_ID)
                .withPriority(BUILT_IN_PRIORITY)
                .build()));

        registry.registerAlias("PRES", PresetResource.TYPE_ID);
        registry.registerAlias("NGMP", NgmpResource.TYPE_ID);
        return handles;
    }

    /**
     * Builds a descriptor that keeps payloads of {@code typeId} as raw bytes.
     * It ranks below every other registration for the same id.
     */
    public static CodecDescriptor<OpaqueBlobResource> opaqueFallback(ResourceTypeId typeId, ParseLimits limits) {
        return CodecDescriptor.builder(new OpaqueBlobCodec(typeId, limits))
                .withName("opaque-" + typeId.toHex())
                .withTypeId(typeId)
                .withPriority(FALLBACK_PRIORITY)
                .build();
    }
}
