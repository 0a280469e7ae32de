package com.marketfeed.marketdata.cache;

/**
 * Kinds of upstream data held by {@link FreshValueCache}. Each class has its own TTL and its
 * own key space; per-asset classes are keyed {@code <prefix>:<ASSET>}.
 */
public enum ResourceClass {
    TOKENS("tokens", false),
    MARKETS("markets", false),
    POSITIONS("positions", false),
    POSITIONS_INFO("positions-info", false),
    VOLATILITY("volatility", true),
    LP_BOUNDS("lp-bounds", true),
    PREDICTIONS("predictions", true);

    private final String prefix;
    private final boolean perAsset;

    ResourceClass(String prefix, boolean perAsset) {
        this.prefix   = prefix;
        this.perAsset = perAsset;
    }

    public String prefix() {
        return prefix;
    }

    public boolean perAsset() {
        return perAsset;
    }

    /**
     * Resolves a class from its key prefix ({@code "lp-bounds"}) or enum name ({@code "LP_BOUNDS"}).
     *
     * @throws IllegalArgumentException when nothing matches
     */
    public static ResourceClass fromName(String name) {
        for (ResourceClass resourceClass : values()) {
            if (resourceClass.prefix.equalsIgnoreCase(name) || resourceClass.name().equalsIgnoreCase(name)) {
                return resourceClass;
            }
        }
        throw new IllegalArgumentException("Unknown resource class: " + name);
    }
}
