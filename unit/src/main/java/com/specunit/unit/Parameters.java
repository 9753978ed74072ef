package com.specunit.unit;

/**
 * The shape of a method's parameter list: required positional parameters, optional ones,
 * and whether a trailing variadic parameter collects the rest.
 */
public record Parameters(int required, int optional, boolean rest) {

    public Parameters {
        if (required < 0 || optional < 0) {
            throw new IllegalArgumentException("Parameter counts must not be negative");
        }
    }

    public static Parameters none() {
        return new Parameters(0, 0, false);
    }

    public static Parameters required(int count) {
        return new Parameters(count, 0, false);
    }

    public static Parameters optional(int count) {
        return new Parameters(0, count, false);
    }

    public static Parameters variadic() {
        return new Parameters(0, 0, true);
    }

    public Parameters withRest() {
        return new Parameters(required, optional, true);
    }

    public boolean acceptsNoArguments() {
        return required == 0;
    }

    public boolean accepts(int argumentCount) {
        return argumentCount >= required && (rest || argumentCount <= required + optional);
    }
}
