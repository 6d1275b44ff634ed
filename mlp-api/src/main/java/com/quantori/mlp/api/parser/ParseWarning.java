package com.quantori.mlp.api.parser;

/**
 * A problem the parser recovered from.
 *
 * @param type     kind of problem
 * @param position zero-based offset in the input, or the input length for problems found at the end
 * @param token    offending text
 */
public record ParseWarning(ParseWarningType type, int position, String token) {}
