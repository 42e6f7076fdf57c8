package org.pragmatica.exfmt.comment;

import org.pragmatica.exfmt.doc.Doc;

/**
 * One or more consecutive comments ready to be placed, with their surrounding newline counts.
 */
public record GatheredComment(int line, Doc doc, int previousEolCount, int nextEolCount) {}
