package com.specunit.unit;

public enum Visibility {
    PUBLIC,
    PROTECTED,
    PRIVATE
}
