package com.syntex.quranstore.cli;

import java.lang.reflect.Modifier;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import org.reflections.Reflections;
import org.reflections.scanners.Scanners;

import picocli.CommandLine;

/**
 * Registers every {@link CommandLine.Command} class found under a package as
 * a subcommand of the root command, in name order.
 */
public class CommandLoader {

    public static void registerCommands(CommandLine root, String basePackage) {
        Reflections reflections = new Reflections(basePackage, Scanners.TypesAnnotated);

        List<Class<?>> commands = reflections.getTypesAnnotatedWith(CommandLine.Command.class).stream()
                .filter(c -> !Modifier.isAbstract(c.getModifiers()))
                .sorted(Comparator.comparing(c -> c.getAnnotation(CommandLine.Command.class).name()))
                .collect(Collectors.toList());

        for (Class<?> cmdClass : commands) {
            CommandLine.Command annotation = cmdClass.getAnnotation(CommandLine.Command.class);
            try {
                Object instance = cmdClass.getDeclaredConstructor().newInstance();
                root.addSubcommand(annotation.name(), instance);
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Failed to load command " + cmdClass.getName(), e);
            }
        }
    }
}
