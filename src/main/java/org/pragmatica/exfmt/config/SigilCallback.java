package org.pragmatica.exfmt.config;

/**
 * User supplied formatter for the content of an upper-case sigil.
 * The result must be a {@link CharSequence} or an {@link Iterable} of text fragments.
 */
@FunctionalInterface
public interface SigilCallback {
    Object apply(String content, SigilMetadata metadata);
}
