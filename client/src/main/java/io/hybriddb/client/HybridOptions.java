// file: client/src/main/java/io/hybriddb/client/HybridOptions.java
package io.hybriddb.client;

/**
 * Behaviour switches of hybrid queries. A null field means "inherit".
 * <p>
 * Layering: per-call over per-collection over global defaults over {@link #DEFAULTS}.
 *
 * @param interim               deliver the local result first, then the confirmed one
 * @param cacheFind             cache remote find results locally
 * @param cacheFindOne          cache remote findOne results locally
 * @param shortcut              findOne: skip the remote when a local match exists
 * @param useLocalOnRemoteError non-interim: answer from the local store when the remote fails
 * @param quickfind             use the shard-diff protocol for eligible finds
 */
public record HybridOptions(
        Boolean interim,
        Boolean cacheFind,
        Boolean cacheFindOne,
        Boolean shortcut,
        Boolean useLocalOnRemoteError,
        Boolean quickfind
) {
    public static final HybridOptions DEFAULTS = new HybridOptions(true, true, true, false, true, false);

    public static final HybridOptions INHERIT = new HybridOptions(null, null, null, null, null, null);

    /** @return this, with every field set in {@code over} replaced by the override. */
    public HybridOptions overlay(HybridOptions over) {
        if (over == null) return this;
        return new HybridOptions(
                pick(over.interim, interim),
                pick(over.cacheFind, cacheFind),
                pick(over.cacheFindOne, cacheFindOne),
                pick(over.shortcut, shortcut),
                pick(over.useLocalOnRemoteError, useLocalOnRemoteError),
                pick(over.quickfind, quickfind));
    }

    public HybridOptions withInterim(boolean v) {
        return new HybridOptions(v, cacheFind, cacheFindOne, shortcut, useLocalOnRemoteError, quickfind);
    }

    public HybridOptions withCacheFind(boolean v) {
        return new HybridOptions(interim, v, cacheFindOne, shortcut, useLocalOnRemoteError, quickfind);
    }

    public HybridOptions withCacheFindOne(boolean v) {
        return new HybridOptions(interim, cacheFind, v, shortcut, useLocalOnRemoteError, quickfind);
    }

    public HybridOptions withShortcut(boolean v) {
        return new HybridOptions(interim, cacheFind, cacheFindOne, v, useLocalOnRemoteError, quickfind);
    }

    public HybridOptions withUseLocalOnRemoteError(boolean v) {
        return new HybridOptions(interim, cacheFind, cacheFindOne, shortcut, v, quickfind);
    }

    public HybridOptions withQuickfind(boolean v) {
        return new HybridOptions(interim, cacheFind, cacheFindOne, shortcut, useLocalOnRemoteError, v);
    }

    // Accessors for resolved options; only meaningful after overlaying onto DEFAULTS.

    boolean isInterim() { return Boolean.TRUE.equals(interim); }
    boolean isCacheFind() { return Boolean.TRUE.equals(cacheFind); }
    boolean isCacheFindOne() { return Boolean.TRUE.equals(cacheFindOne); }
    boolean isShortcut() { return Boolean.TRUE.equals(shortcut); }
    boolean isUseLocalOnRemoteError() { return Boolean.TRUE.equals(useLocalOnRemoteError); }
    boolean isQuickfind() { return Boolean.TRUE.equals(quickfind); }

    private static Boolean pick(Boolean over, Boolean base) {
        return over != null ? over : base;
    }
}
