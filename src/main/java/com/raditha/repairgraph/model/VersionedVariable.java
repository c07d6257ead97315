package com.raditha.repairgraph.model;

/**
 * A (base name, version) pair. Version 0 is the value that flows in from outside the analysed
 * body: a parameter, a field or a name of an enclosing scope.
 *
 * @param baseName variable name as written in source
 * @param version  0 for inputs, then 1, 2, ... for each definition or phi of the base name
 */
public record VersionedVariable(String baseName, int version) {

    public VersionedVariable {
        if (baseName == null || baseName.isEmpty()) {
            throw new IllegalArgumentException("baseName cannot be empty");
        }
        if (version < 0) {
            throw new IllegalArgumentException("version must be >= 0");
        }
    }

    public boolean isInput() {
        return version == 0;
    }

    @Override
    public String toString() {
        return baseName + "_" + version;
    }
}
