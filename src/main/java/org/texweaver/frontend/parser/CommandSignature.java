package org.texweaver.frontend.parser;

/**
 * What the parser knows about a command or environment: how many brace groups
 * following it are its arguments.
 *
 * @param mandatoryArguments The number of {...} groups to capture as arguments.
 * @param templateArguments Whether the arguments are macro bodies that may contain
 *                          unbalanced \begin, \end or math delimiters.
 */
public record CommandSignature(int mandatoryArguments, boolean templateArguments) {

    /**
     * Creates a signature for an ordinary command.
     * @param mandatoryArguments The number of mandatory groups.
     * @return The signature.
     */
    public static CommandSignature of(int mandatoryArguments) {
        return new CommandSignature(mandatoryArguments, false);
    }
}
