package com.prfactory.core.model;

/**
 * A clarifying question posted to the ticket before refinement.
 */
public record Question(String id, String text, String category, boolean required) {
}
