package com.questrail.assetcodec.registry;

import com.questrail.assetcodec.api.ResourceInstance;
import com.questrail.assetcodec.api.ResourceTypeId;
import com.questrail.assetcodec.codec.ResourceCodec;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * CodecDescriptor
 * -----------------------------------------------------------------------------
 * Immutable registration request: which type ids a codec claims and how
 * strongly.
 *
 * <p>When several enabled descriptors claim the same type id, the one with the
 * highest {@link #priority()} is chosen. The claimed set is copied on
 * construction and never changes afterwards.</p>
 */
public final class CodecDescriptor<R extends ResourceInstance>
{
    private final String name;
    private final Set<ResourceTypeId> typeIds;
    private final int priority;
    private final ResourceCodec<R> codec;

    private CodecDescriptor(Builder<R> b) {
        this.name = b.name != null ? b.name : b.codec.getClass().getSimpleName();
        this.typeIds = Set.copyOf(b.typeIds);
        this.priority = b.priority;
        this.codec = b.codec;
    }

    public static <R extends ResourceInstance> Builder<R> builder(ResourceCodec<R> codec) {
        return new Builder<>(codec);
    }

    public String name() {
        return name;
    }

    public Set<ResourceTypeId> typeIds() {
        return typeIds;
    }

    public boolean claims(ResourceTypeId typeId) {
        return typeIds.contains(typeId);
    }

    public int priority() {
        return priority;
    }

    public ResourceCodec<R> codec() {
        return codec;
    }

    @Override
    public String toString() {
        return "CodecDescriptor[" + name + ", priority=" + priority + ", typeIds=" + typeIds + "]";
    }

    public static final class Builder<R extends ResourceInstance> {
        private final ResourceCodec<R> codec;
        private final Set<ResourceTypeId> typeIds = new LinkedHashSet<>();
        private String name;
        private int priority;

        private Builder(ResourceCodec<R> codec) {
            this.codec = Objects.requireNonNull(codec, "codec");
        }

        public Builder<R> withName(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        public Builder<R> withTypeId(ResourceTypeId typeId) {
            this.typeIds.add(Objects.requireNonNull(typeId, "typeId"));
            return this;
        }

        public Builder<R> withTypeIds(Set<ResourceTypeId> typeIds) {
            for (ResourceTypeId id : typeIds) {
                withTypeId(id);
            }
            return this;
        }

        public Builder<R> withPriority(int priority) {
            this.priority = priority;
            return this;
        }

        /**
         * @throws IllegalStateException if no type id was claimed
         */
        public CodecDescriptor<R> build() {
            if (typeIds.isEmpty()) {
                throw new IllegalStateException("A codec descriptor must claim at least one type id");
            }
            return new CodecDescriptor<>(this);
        }
    }
}
