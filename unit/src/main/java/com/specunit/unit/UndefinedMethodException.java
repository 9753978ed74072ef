package com.specunit.unit;

public class UndefinedMethodException extends RuntimeException {
    public UndefinedMethodException(String methodName, Object receiver) {
        super("undefined method '" + methodName + "' for " + receiver);
    }
}
