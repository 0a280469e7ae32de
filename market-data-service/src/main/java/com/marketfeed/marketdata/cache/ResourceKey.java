package com.marketfeed.marketdata.cache;

import java.util.Locale;

/**
 * Identity of one cached value, e.g. {@code markets} or {@code volatility:BTC}.
 *
 * @param asset upper-case asset symbol for per-asset classes, {@code null} otherwise
 */
public record ResourceKey(ResourceClass resourceClass, String asset) {

    public ResourceKey {
        if (resourceClass == null) {
            throw new IllegalArgumentException("resourceClass is required");
        }
        if (resourceClass.perAsset()) {
            if (asset == null || asset.isBlank()) {
                throw new IllegalArgumentException(resourceClass.prefix() + " requires an asset");
            }
            asset = asset.trim().toUpperCase(Locale.ROOT);
        } else if (asset != null) {
            throw new IllegalArgumentException(resourceClass.prefix() + " is not keyed by asset");
        }
    }

    public static ResourceKey of(ResourceClass resourceClass) {
        return new ResourceKey(resourceClass, null);
    }

    public static ResourceKey forAsset(ResourceClass resourceClass, String asset) {
        return new ResourceKey(resourceClass, asset);
    }

    /** Key string as reported by the status endpoints. */
    public String id() {
        return asset == null ? resourceClass.prefix() : resourceClass.prefix() + ":" + asset;
    }

    @Override
    public String toString() {
        return id();
    }
}
