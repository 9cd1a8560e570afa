package me.christianrobert.shellast.service;

/**
 * Why a script could not be turned into a command tree.
 */
public enum ParseFailureKind {

    /** Null, empty or whitespace-only input. Detected before parsing. */
    EMPTY_INPUT,

    /** Input larger than the configured maximum. Detected before parsing. */
    INPUT_TOO_LARGE,

    /** Input that cannot be handed to the parser, such as text with NUL characters. */
    INVALID_STRING,

    /** The parser rejected the script. */
    SYNTAX_ERROR,

    /** The parser accepted the script but its tree could not be converted. */
    CONVERSION_ERROR,

    /** No parser is available, or it failed unexpectedly. */
    PARSER_FAILURE
}
