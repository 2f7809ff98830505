package com.alang.ast;

/**
 * An expression that denotes an assignable place.
 */
public sealed interface Location extends Expression permits Id {
}
