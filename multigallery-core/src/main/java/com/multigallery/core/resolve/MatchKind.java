package com.multigallery.core.resolve;

/**
 * Which rule of the switch-chain resolution selected a binding.
 */
public enum MatchKind {
    /** A binding names the target site. */
    EXACT,
    /** No exact match; the chain's generic binding supplies a literal URL. */
    GENERIC,
    /** No exact or generic match; the innermost binding of a user chain is used. */
    INNERMOST
}
