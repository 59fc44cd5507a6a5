package com.graphql.evolution;

import com.graphql.evolution.introspection.IntrospectionReader;
import com.graphql.evolution.reporting.CapturingReporter;
import com.graphql.evolution.reporting.ChainedReporter;
import com.graphql.evolution.reporting.PrintingReporter;
import com.graphql.evolution.sdl.SdlRenderer;
import graphql.GraphQLException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.File;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.Map;

public class Main {

    static final int NO_BREAKING_CHANGES = 0;
    static final int BREAKING_CHANGES = 1;
    static final int FAILED = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    /**
     * @param args the command line
     * @param out  where the report goes
     *
     * @return the process exit code
     */
    static int run(String[] args, PrintStream out) {
        Options options = commandLineOptions();
        CommandLine commandLine;
        try {
            commandLine = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            out.println(e.getMessage());
            PrintWriter writer = new PrintWriter(out);
            new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "graphql-schema-evolution", null, options,
                    HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, true);
            writer.flush();
            return FAILED;
        }
        try {
            return runDiff(commandLine, out);
        } catch (GraphQLException | IllegalArgumentException e) {
            out.println(e.getMessage());
            return FAILED;
        }
    }

    private static Options commandLineOptions() {
        Options options = new Options();
        options.addOption(Option
                .builder("newSchema")
                .required()
                .argName("file")
                .numberOfArgs(1)
                .desc("introspection json of the new schema")
                .build()
        );
        options.addOption(Option
                .builder("oldSchema")
                .required()
                .argName("file")
                .numberOfArgs(1)
                .desc("introspection json of the old schema")
                .build()
        );
        options.addOption(Option
                .builder("minSeverity")
                .argName("MINOR|MAJOR|CRITICAL")
                .numberOfArgs(1)
                .desc("the lowest severity to report, MINOR by default")
                .build()
        );
        options.addOption(Option
                .builder("typeChanges")
                .argName("SCALAR_CLASS|WRAPPER_AWARE")
                .numberOfArgs(1)
                .desc("how field type changes are judged, SCALAR_CLASS by default")
                .build()
        );
        options.addOption(Option
                .builder("sdl")
                .desc("print the new schema as SDL")
                .build()
        );
        return options;
    }

    private static int runDiff(CommandLine commandLine, PrintStream out) {

        String oldSchemaLocation = commandLine.getOptionValue("oldSchema");
        String newSchemaLocation = commandLine.getOptionValue("newSchema");

        SchemaDiff.Options diffOptions = SchemaDiff.Options.defaultOptions();
        if (commandLine.hasOption("minSeverity")) {
            diffOptions = diffOptions.minimumSeverity(ChangeSeverity.valueOf(commandLine.getOptionValue("minSeverity")));
        }
        if (commandLine.hasOption("typeChanges")) {
            diffOptions = diffOptions.typeChangeRule(TypeChangeRule.valueOf(commandLine.getOptionValue("typeChanges")));
        }

        out.println("Reading old schema at : " + oldSchemaLocation);
        out.println("Reading new schema at : " + newSchemaLocation);

        IntrospectionReader reader = new IntrospectionReader();
        Map<String, Object> oldSchema = reader.read(new File(oldSchemaLocation));
        Map<String, Object> newSchema = reader.read(new File(newSchemaLocation));

        DiffSet diffSet = DiffSet.diffSet(oldSchema, newSchema);

        if (commandLine.hasOption("sdl")) {
            out.println();
            out.println(new SdlRenderer().renderSchema(diffSet.getNew()));
            out.println();
        }

        CapturingReporter capturingReporter = new CapturingReporter();
        new SchemaDiff(diffOptions).diffSchema(diffSet, new ChainedReporter(capturingReporter, new PrintingReporter(out)));

        new CompatibilityScorer().migrationSuggestions(capturingReporter.getChanges())
                .forEach(suggestion -> out.println("suggestion : " + suggestion));

        return capturingReporter.getBreakageCount() > 0 ? BREAKING_CHANGES : NO_BREAKING_CHANGES;
    }
}
