package io.jtv.cli;

import io.jtv.cli.config.CliConfig;
import io.jtv.cli.config.ConfigLoadException;
import io.jtv.cli.config.ConfigLoader;
import io.jtv.core.ast.Program;
import io.jtv.core.engine.CheckReport;
import io.jtv.core.engine.ExecutionResult;
import io.jtv.core.engine.JtvEngine;
import io.jtv.core.error.JtvException;
import io.jtv.core.error.ProgramLoadException;
import io.jtv.core.eval.State;
import io.jtv.core.loader.ProgramLoader;
import io.jtv.core.number.NumericValue;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line front end.
 *
 * <pre>
 * jtv run   [--vars] [--trace] [--config FILE] PROGRAM
 * jtv check [--config FILE] PROGRAM
 * </pre>
 *
 * <p>Exit codes: {@value #EXIT_OK} success, {@value #EXIT_REJECTED} static rejection or unreadable
 * program, {@value #EXIT_RUNTIME_FAILURE} runtime failure, {@value #EXIT_USAGE} usage or
 * configuration error.
 */
public final class CliApp {

    private static final Logger LOG = LoggerFactory.getLogger(CliApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_REJECTED = 1;
    static final int EXIT_RUNTIME_FAILURE = 2;
    static final int EXIT_USAGE = 64;

    static final String USAGE = "usage: jtv run [--vars] [--trace] [--config FILE] PROGRAM\n"
            + "       jtv check [--config FILE] PROGRAM";

    private final PrintStream out;
    private final PrintStream err;
    private final Function<String, String> envLookup;

    public CliApp(PrintStream out, PrintStream err, Function<String, String> envLookup) {
        this.out = out;
        this.err = err;
        this.envLookup = envLookup;
    }

    /** Parsed command line. */
    record Invocation(String command, Path program, boolean dumpVars, boolean trace) {}

    /** Runs one command and returns the process exit code. */
    public int run(String[] args) {
        Invocation invocation;
        CliConfig config;
        try {
            invocation = parse(args);
            Optional<Path> configPath = ConfigLoader.resolveConfigPath(args);
            config = configPath.isPresent()
                    ? ConfigLoader.load(configPath.get(), envLookup)
                    : ConfigLoader.fromEnvironment(envLookup);
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        } catch (ConfigLoadException e) {
            err.println("error: " + e.getMessage());
            return EXIT_USAGE;
        }
        boolean trace = invocation.trace() || config.trace();
        LogbackConfigurator.configure(config, trace);

        Program program;
        try {
            program = new ProgramLoader().load(invocation.program());
        } catch (ProgramLoadException e) {
            LOG.debug("Program load failed: source={}", e.source(), e);
            err.println("error: " + e.urn() + ": " + e.detail() + " (" + e.source() + ")");
            return EXIT_REJECTED;
        }

        JtvEngine engine = new JtvEngine(config.toEngineOptions(), trace ? new TraceLogListener() : null);
        return "check".equals(invocation.command()) ? check(engine, program) : execute(engine, program, invocation);
    }

    private int check(JtvEngine engine, Program program) {
        CheckReport report = engine.check(program);
        if (report.isAccepted()) {
            out.println(program.id() + ": ok");
            return EXIT_OK;
        }
        printErrors(report.errors());
        return EXIT_REJECTED;
    }

    private int execute(JtvEngine engine, Program program, Invocation invocation) {
        ExecutionResult result = engine.run(program, State.empty(), out::println);
        switch (result.status()) {
            case REJECTED:
                printErrors(result.staticErrors());
                return EXIT_REJECTED;
            case FAILED:
                JtvException failure = result.failure().orElseThrow();
                err.println("error: " + failure.urn() + ": " + failure.detail());
                dumpVars(result, invocation);
                return EXIT_RUNTIME_FAILURE;
            default:
                result.returnValue().ifPresent(value -> out.println("=> " + value));
                dumpVars(result, invocation);
                return EXIT_OK;
        }
    }

    private void dumpVars(ExecutionResult result, Invocation invocation) {
        if (!invocation.dumpVars()) {
            return;
        }
        for (Map.Entry<String, NumericValue> entry : result.state().entrySet()) {
            out.println(entry.getKey() + " = " + entry.getValue());
        }
    }

    private void printErrors(List<? extends JtvException> errors) {
        for (JtvException error : errors) {
            err.println("error: " + error.urn() + ": " + error.detail());
        }
    }

    /**
     * @throws IllegalArgumentException for malformed command lines
     */
    static Invocation parse(String[] args) {
        if (args.length == 0) {
            throw new IllegalArgumentException("missing command");
        }
        String command = args[0];
        if (!"run".equals(command) && !"check".equals(command)) {
            throw new IllegalArgumentException("unknown command '" + command + "'");
        }
        Path program = null;
        boolean vars = false;
        boolean trace = false;
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg)) {
                i++; // value consumed by ConfigLoader.resolveConfigPath
            } else if ("--vars".equals(arg) && "run".equals(command)) {
                vars = true;
            } else if ("--trace".equals(arg) && "run".equals(command)) {
                trace = true;
            } else if (arg.startsWith("--")) {
                throw new IllegalArgumentException("unknown option '" + arg + "'");
            } else if (program == null) {
                program = Path.of(arg);
            } else {
                throw new IllegalArgumentException("unexpected argument '" + arg + "'");
            }
        }
        if (program == null) {
            throw new IllegalArgumentException("missing program file");
        }
        return new Invocation(command, program, vars, trace);
    }
}
