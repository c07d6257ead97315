package com.raditha.repairgraph.cfg;

/**
 * How statements are grouped into control-flow nodes.
 */
public enum BlockPolicy {
    /** One node per statement */
    STATEMENT,

    /** Maximal straight-line runs of plain statements coalesced into one node */
    BASIC_BLOCK;

    public static BlockPolicy fromString(String value) {
        for (BlockPolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(value.replace('-', '_'))) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown block policy: " + value);
    }
}
