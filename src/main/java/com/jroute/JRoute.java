package com.jroute;

import com.jroute.compiler.ExpansionResult;
import com.jroute.compiler.RouteEngine;
import com.jroute.compiler.ValidationResult;
import com.jroute.kb.InMemoryKnowledgeBase;
import com.jroute.kb.KnowledgeBaseLoader;
import com.jroute.output.ResultFormatter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "jroute", mixinStandardHelpOptions = true, version = "1.0",
         description = "Expand an aviation route string into its ordered list of fixes")
public class JRoute implements Callable<Integer> {
    static final int EXIT_INVALID = 2;

    enum Format { text, json }

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", description = "The route, e.g. KORD MOBLE GERBS J146 MIP MIP4 KLGA")
    private List<String> route;

    @Option(names = {"-k", "--knowledge-base"}, description = "JSON knowledge base of fixes, airways and procedures")
    private File knowledgeBaseFile;

    @Option(names = "--validate", description = "Only parse and resolve; exit 0 when the route is valid")
    private boolean validateOnly = false;

    @Option(names = {"-f", "--format"}, description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private Format format = Format.text;

    @Option(names = {"-c", "--compact-output"}, description = "Compact JSON output without whitespace")
    private boolean compactOutput = false;

    @Option(names = {"-v", "--verbose"}, description = "Log each compilation stage to stderr")
    private boolean verbose = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JRoute()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (verbose) {
            // Must happen before the first logger is created
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        }

        try {
            RouteEngine engine = new RouteEngine(loadKnowledgeBase());
            String routeString = String.join(" ", route);
            ResultFormatter formatter = new ResultFormatter(!compactOutput);

            if (validateOnly) {
                ValidationResult result = engine.validate(routeString);
                if (format == Format.json) {
                    out.println(formatter.format(result));
                } else {
                    out.println(result.valid() ? "valid" : "invalid");
                    printErrors(err, result.errors());
                }
                return result.valid() ? 0 : EXIT_INVALID;
            }

            ExpansionResult result = engine.parseAndExpand(routeString);
            if (format == Format.json) {
                out.println(formatter.format(result));
            } else {
                out.println(result.expandedString());
                printErrors(err, result.errors());
            }
            return 0;
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } finally {
            out.flush();
            err.flush();
        }
    }

    private InMemoryKnowledgeBase loadKnowledgeBase() throws Exception {
        if (knowledgeBaseFile == null) {
            return InMemoryKnowledgeBase.empty();
        }
        try (InputStream input = new FileInputStream(knowledgeBaseFile)) {
            return new KnowledgeBaseLoader().load(input);
        }
    }

    private static void printErrors(PrintWriter err, Iterable<?> errors) {
        if (errors != null) {
            for (Object error : errors) {
                err.println("warning: " + error);
            }
        }
    }
}
