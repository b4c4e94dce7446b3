package com.scriptorium.templatemodel;

/**
 * Capability of an entity that can produce a fully independent copy of itself.
 *
 * <p>Implementations copy scalar fields by value, copy every collection into a new container and
 * recursively {@link #deepClone()} every owned nested entity. After the call the source and the
 * copy share no mutable storage at any depth.
 *
 * <p>Named {@code deepClone} rather than {@code clone} so it does not collide with {@link
 * Object#clone()} and its {@link Cloneable} marker semantics.
 *
 * @param <T> the implementing type, returned by {@link #deepClone()}
 */
public interface Prototype<T extends Prototype<T>> {

    /** Returns a new instance whose whole object graph is independent of this one. */
    T deepClone();

    /**
     * Clones an optional owned reference, propagating absence instead of substituting a default.
     *
     * @return {@code null} when {@code source} is {@code null}, otherwise {@code source.deepClone()}
     */
    static <T extends Prototype<T>> T cloneOrNull(T source) {
        return source != null ? source.deepClone() : null;
    }
}
