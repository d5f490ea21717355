package org.ascenoria.content.merge;

/**
 * A key that occurred more than once inside a single source.
 *
 * @param key    The duplicated id or relation key.
 * @param source The source that defined it twice.
 */
public record DuplicateKey(String key, String source) {
}
