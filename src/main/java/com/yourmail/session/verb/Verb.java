package com.yourmail.session.verb;

/**
 * Parsed command line.
 *
 * <p>The command is the first word, upper cased. The rest of the line, trimmed, is the argument text.
 */
public class Verb {

    private final String line;
    private final String command;
    private final String arguments;

    /**
     * Constructs a new Verb instance.
     *
     * @param line Raw line without line ending.
     */
    public Verb(String line) {
        this.line = line;
        String trimmed = line.trim();
        int space = trimmed.indexOf(' ');
        if (space < 0) {
            command = trimmed.toUpperCase();
            arguments = "";
        } else {
            command = trimmed.substring(0, space).toUpperCase();
            arguments = trimmed.substring(space + 1).trim();
        }
    }

    /**
     * Gets raw line.
     *
     * @return String.
     */
    public String getLine() {
        return line;
    }

    /**
     * Gets upper cased command.
     *
     * @return String.
     */
    public String getCommand() {
        return command;
    }

    /**
     * Gets argument text.
     *
     * @return String, empty if none.
     */
    public String getArguments() {
        return arguments;
    }

    /**
     * Gets arguments split on whitespace.
     *
     * @return String array, empty if none.
     */
    public String[] getParts() {
        return getParts(0);
    }

    /**
     * Gets arguments split on whitespace into at most the given number of parts.
     * <p>The last part keeps any further whitespace.
     *
     * @param limit Maximum parts, zero or less for no limit.
     * @return String array, empty if none.
     */
    public String[] getParts(int limit) {
        return arguments.isEmpty() ? new String[0] : arguments.split("\\s+", limit);
    }
}
