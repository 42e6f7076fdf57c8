package org.pragmatica.exfmt.config;

import java.util.Optional;

/**
 * What a sigil callback knows about the sigil it formats.
 *
 * @param file             file being formatted, when configured
 * @param line             line of the sigil, when known
 * @param sigil            sigil name without the tilde, e.g. {@code SQL}
 * @param modifiers        modifier letters after the closing delimiter
 * @param openingDelimiter delimiter the sigil was written with
 */
public record SigilMetadata(Optional<String> file, Optional<Integer> line, String sigil, String modifiers, String openingDelimiter) {}
