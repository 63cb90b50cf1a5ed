package com.yourmail.session;

import com.yourmail.session.command.BodyCommand;
import com.yourmail.session.command.CommandProcessor;
import com.yourmail.session.command.ConnectCommand;
import com.yourmail.session.command.HelpCommand;
import com.yourmail.session.command.ListCommand;
import com.yourmail.session.command.QuitCommand;
import com.yourmail.session.command.ReadCommand;
import com.yourmail.session.command.SendCommand;
import com.yourmail.session.command.SubjectCommand;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Session command registry.
 *
 * <p>Maps command names to processor factories. Listing order is the HELP order.
 */
public final class Commands {

    private static final Map<String, Supplier<CommandProcessor>> map = new LinkedHashMap<>();

    static {
        map.put("CONNECT", ConnectCommand::new);
        map.put("SEND", SendCommand::new);
        map.put("SUBJECT", SubjectCommand::new);
        map.put("BODY", BodyCommand::new);
        map.put("LIST", ListCommand::new);
        map.put("READ", ReadCommand::new);
        map.put("HELP", HelpCommand::new);
        map.put("QUIT", QuitCommand::new);
    }

    private Commands() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Gets a processor for a command.
     *
     * @param command Upper cased command name.
     * @return Optional of CommandProcessor.
     */
    public static Optional<CommandProcessor> getProcessor(String command) {
        Supplier<CommandProcessor> supplier = map.get(command);
        return supplier != null ? Optional.of(supplier.get()) : Optional.empty();
    }

    /**
     * Gets command names.
     *
     * @return Unmodifiable list.
     */
    public static List<String> getNames() {
        return Collections.unmodifiableList(new ArrayList<>(map.keySet()));
    }

    /**
     * Gets HELP lines.
     *
     * @return List of String.
     */
    public static List<String> getHelp() {
        List<String> help = new ArrayList<>();
        for (Supplier<CommandProcessor> supplier : map.values()) {
            help.add(supplier.get().getHelp());
        }
        return help;
    }
}
