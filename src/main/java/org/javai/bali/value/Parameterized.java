package org.javai.bali.value;

/**
 * A static value together with the value of its parameters, which is a list, a map or a range.
 */
public record Parameterized(Object value, Object parameters) {
}
