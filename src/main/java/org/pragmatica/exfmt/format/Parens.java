package org.pragmatica.exfmt.format;

/**
 * When a call may be written without parentheses.
 */
public enum Parens {
    /** Skip them unless the call is one of many arguments. */
    SKIP_UNLESS_MANY_ARGS,
    /** Skip them when a do/end block is the only argument. */
    SKIP_IF_ONLY_DO_END,
    /** Skip them around the arguments in front of a do/end block. */
    SKIP_IF_DO_END,
    /** Always keep them. */
    REQUIRED
}
