package com.apichain.dto.response;

import java.util.List;

/**
 * The outcome of a shell command: a headline plus optional detail lines.
 *
 * @param success whether the command did what was asked.
 * @param message the headline shown in green or red.
 * @param details further lines printed below the headline without colour.
 */
public record CommandResponse(boolean success, String message, List<String> details) {

    private static final String GREEN = "\u001B[32m";
    private static final String RED = "\u001B[31m";
    private static final String RESET = "\u001B[0m";

    public CommandResponse(boolean success, String message) {
        this(success, message, List.of());
    }

    public static CommandResponse ok(String message, List<String> details) {
        return new CommandResponse(true, message, details);
    }

    public static CommandResponse error(String message) {
        return new CommandResponse(false, message);
    }

    public String toAnsiString() {
        StringBuilder out = new StringBuilder((success ? GREEN : RED) + message + RESET);
        details.forEach(line -> out.append(System.lineSeparator()).append(line));
        return out.toString();
    }
}
