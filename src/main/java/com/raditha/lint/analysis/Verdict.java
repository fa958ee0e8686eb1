package com.raditha.lint.analysis;

/**
 * Per-node signal produced while walking an ancestor chain.
 */
public enum Verdict {
    /** Undecided; remember this node as the best candidate so far and keep climbing */
    CONTINUE,

    /** Stop and whitelist this node */
    ACCEPT_HERE,

    /** Stop and fall back to the best candidate recorded before this node */
    REJECT_HERE
}
