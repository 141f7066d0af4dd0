package com.ttennebkram.imagefilter.cache;

import com.ttennebkram.imagefilter.buffer.ContentHash;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.catalogue.FilterKind;
import com.ttennebkram.imagefilter.catalogue.FilterParams;

import java.util.Objects;

/**
 * Identifies one filter result: kind, canonical parameter string and the
 * content hash of the source buffer.
 */
public final class CacheKey {

    private final FilterKind kind;
    private final String params;
    private final ContentHash source;

    public CacheKey(FilterKind kind, String params, ContentHash source) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.params = Objects.requireNonNull(params, "params");
        this.source = Objects.requireNonNull(source, "source");
    }

    public static CacheKey of(FilterKind kind, FilterParams params, PixelBuffer source) {
        return new CacheKey(kind, params.canonicalString(), source.contentHash());
    }

    public FilterKind getKind() {
        return kind;
    }

    public String getParams() {
        return params;
    }

    public ContentHash getSource() {
        return source;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheKey other)) return false;
        return kind == other.kind && params.equals(other.params) && source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, params, source);
    }

    @Override
    public String toString() {
        return kind + "(" + params + ")@" + source.toHex().substring(0, 8);
    }
}
