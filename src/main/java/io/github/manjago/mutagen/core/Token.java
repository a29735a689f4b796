package io.github.manjago.mutagen.core;

/**
 * Element of a flattened token stream: an {@link Atom} or a structural {@link Marker}.
 */
public interface Token {
}
