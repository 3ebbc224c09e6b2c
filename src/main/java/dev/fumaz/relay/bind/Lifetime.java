package dev.fumaz.relay.bind;

/**
 * Governs how instances of a capability are shared.
 */
public enum Lifetime {

    /**
     * One instance per container, created lazily on first resolution and released when the container closes.
     * Its dependencies are always resolved against the container root.
     */
    SINGLETON,

    /**
     * One instance per {@link dev.fumaz.relay.scope.Scope}, released when that scope closes.
     */
    SCOPED,

    /**
     * A new instance on every resolution, released by whichever scope (or the container root) requested it.
     */
    TRANSIENT

}
