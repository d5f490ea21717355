package org.ascenoria.content.sources;

public enum SourceKind {
    /** The base pack; always present and always loaded first. */
    BASE,
    /** An overlay pack from the mods root. */
    MOD
}
