package org.javai.bali.value;

/**
 * An inclusive range between two static values.
 */
public record Range(Object first, Object last) {
}
