package org.pragmatica.exfmt.format;

/**
 * Position of an expression relative to its parent, deciding whether calls there may drop their parentheses.
 */
public enum Context {
    /** Statement of a block. */
    BLOCK,
    /** Operand of an operator. */
    OPERAND,
    /** One of several arguments of a call with parentheses. */
    PARENS_ARG,
    /** One of several arguments of a call without parentheses. */
    NO_PARENS_ARG,
    /** Only argument of a call with parentheses. */
    PARENS_ONE_ARG,
    /** Only argument of a call without parentheses. */
    NO_PARENS_ONE_ARG;

    /**
     * Context of an operand: argument contexts turn into their many-arguments form,
     * block and operand contexts into {@code choice}.
     */
    public Context manyArgsOr(Context choice) {
        return switch (this) {
            case NO_PARENS_ONE_ARG, NO_PARENS_ARG -> NO_PARENS_ARG;
            case PARENS_ONE_ARG, PARENS_ARG -> PARENS_ARG;
            case OPERAND, BLOCK -> choice;
        };
    }

    public Context leftOperand() {
        return manyArgsOr(PARENS_ARG);
    }

    public Context rightOperand() {
        return manyArgsOr(OPERAND);
    }

    public boolean isNoParensArg() {
        return this == NO_PARENS_ARG || this == NO_PARENS_ONE_ARG;
    }
}
