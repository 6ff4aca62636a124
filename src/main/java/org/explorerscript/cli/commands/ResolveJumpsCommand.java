package org.explorerscript.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.explorerscript.cli.CommandLineInterface;
import org.explorerscript.decompiler.DecompilerOptions;
import org.explorerscript.decompiler.ResolvedRoutineSet;
import org.explorerscript.decompiler.RoutineSetResolver;
import org.explorerscript.decompiler.label.MalformedOperationException;
import org.explorerscript.decompiler.label.SsbForeignLabel;
import org.explorerscript.decompiler.label.SsbLabel;
import org.explorerscript.ssb.SsbOperation;
import org.explorerscript.ssb.io.RoutineDumpReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that replaces the jumps of a routine dump with jumps to labels and prints the result.
 */
@Command(
    name = "resolve-jumps",
    description = "Replace jump offsets in a JSON routine dump with labels and print the routines"
)
public class ResolveJumpsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ResolveJumpsCommand.class);

    @Parameters(
        index = "0",
        description = "JSON routine dump to read"
    )
    private Path dumpFile;

    @Option(
        names = {"--place-labels"},
        negatable = true,
        description = "Insert labels before their target operation (default: from configuration)"
    )
    private Boolean placeLabels;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final DecompilerOptions options;
        try {
            options = resolveOptions();
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Failed to load configuration: " + e.getMessage());
            return 1;
        }

        final ResolvedRoutineSet resolved;
        try {
            final List<List<SsbOperation>> routines = new RoutineDumpReader().read(dumpFile);
            resolved = new RoutineSetResolver(options).resolve(routines);
        } catch (IOException e) {
            err.println("Error reading " + dumpFile + ": " + e.getMessage());
            return 1;
        } catch (MalformedOperationException e) {
            err.println("Malformed operation in " + dumpFile + ": " + e.getMessage());
            return 1;
        }

        print(resolved, out);
        out.flush();

        log.info("Resolved {} routine(s) from {}: {} label(s)",
            resolved.routineCount(), dumpFile, resolved.labels().size());
        return 0;
    }

    private DecompilerOptions resolveOptions() {
        final DecompilerOptions configured = parent != null
            ? DecompilerOptions.fromConfig(parent.getConfig())
            : DecompilerOptions.defaults();
        if (placeLabels == null) {
            return configured;
        }
        return new DecompilerOptions(placeLabels, configured.collectForeignLabels());
    }

    private static void print(final ResolvedRoutineSet resolved, final PrintWriter out) {
        for (int r = 0; r < resolved.routineCount(); r++) {
            out.println("routine " + r + ":");
            for (SsbOperation op : resolved.routines().get(r)) {
                if (op instanceof SsbLabel label) {
                    out.println("  " + label + (label.isReferencedFromOtherRoutine() ? " (cross-routine)" : "") + ":");
                } else {
                    out.println("    " + op);
                }
            }
            for (SsbForeignLabel foreign : resolved.foreignLabels().get(r)) {
                out.println("  foreign: " + foreign);
            }
        }
    }
}
