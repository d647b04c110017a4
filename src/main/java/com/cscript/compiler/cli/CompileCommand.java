package com.cscript.compiler.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cscript.compiler.CScriptCompiler;
import com.cscript.compiler.CompilationResult;
import com.cscript.compiler.build.toolchain.ProcessProgramRunner;
import com.cscript.compiler.build.toolchain.ProcessToolchain;
import com.cscript.compiler.cli.exception.OptionsValidationException;
import com.cscript.compiler.cli.model.CompileOptions;
import com.cscript.compiler.cli.model.ValidatedCompileOptions;
import com.cscript.compiler.cli.output.CompileResultsPrinter;
import com.cscript.compiler.cli.validation.CompileOptionsValidator;
import com.cscript.compiler.exception.TranslationException;
import com.cscript.compiler.model.Diagnostic;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * {@code cscriptc [options] FILE}: translates a C-Script unit and builds it.
 */
@Command(
        name = "cscriptc",
        mixinStandardHelpOptions = true,
        version = "cscriptc 1.0.0",
        description = "Translates a C-Script unit to C and builds it with the system C compiler."
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    @Mixin
    private CompileOptions options;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        CompileResultsPrinter printer = new CompileResultsPrinter(spec.commandLine().getOut(),
                spec.commandLine().getErr());
        if (options.isVerbose()) {
            enableDebugLogging();
        }

        ValidatedCompileOptions validated;
        try {
            validated = new CompileOptionsValidator().validate(options);
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e.getErrors());
            return EXIT_USAGE;
        }

        CScriptCompiler compiler = new CScriptCompiler(
                new ProcessToolchain(options.getCompiler()),
                new ProcessProgramRunner(),
                validated.getSettings(),
                options.isStrict());
        String unitName = validated.getSource().getFileName().toString();

        try {
            if (options.isShowC()) {
                String text = CScriptCompiler.readUnit(validated.getSource());
                printer.printSource(compiler.translate(unitName, text, validated.getBaseConfiguration()));
                return EXIT_OK;
            }

            CompilationResult result = compiler.compileFile(validated.getSource(), validated.getBaseConfiguration());
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return EXIT_FAILURE;
            }
            printer.printSuccess(result);
            return EXIT_OK;
        } catch (TranslationException e) {
            for (Diagnostic diagnostic : e.getDiagnostics()) {
                spec.commandLine().getErr().println(diagnostic.format(unitName));
            }
            spec.commandLine().getErr().flush();
            return EXIT_FAILURE;
        } catch (IOException e) {
            log.error("Cannot read {}: {}", validated.getSource(), e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static void enableDebugLogging() {
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }
}
