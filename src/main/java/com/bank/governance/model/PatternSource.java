package com.bank.governance.model;

/**
 * Where a detection pattern came from. Runtime additions survive file reloads.
 */
public enum PatternSource {
    BUILT_IN,
    FILE,
    RUNTIME
}
