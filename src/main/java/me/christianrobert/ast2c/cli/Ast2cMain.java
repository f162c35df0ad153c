package me.christianrobert.ast2c.cli;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import me.christianrobert.ast2c.analysis.model.AnalysisResult;
import me.christianrobert.ast2c.analysis.service.FunctionAnalysisService;
import me.christianrobert.ast2c.generator.context.GenerationResult;
import me.christianrobert.ast2c.generator.service.CodeGenerationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Application entry point.
 *
 * <pre>
 * ast2c ast.json              print the C code regenerated from the tree
 * ast2c --analyze ast.json    print the function report
 * ast2c                       run as HTTP service (see /api/generation, /api/analysis)
 * </pre>
 *
 * <p>Exit codes: 0 success, 1 input could not be read or processed, 2 usage error.</p>
 */
@QuarkusMain
public class Ast2cMain implements QuarkusApplication {

    private static final Logger log = LoggerFactory.getLogger(Ast2cMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = "Usage: ast2c [--analyze] <ast.json>";

    @Inject
    CodeGenerationService codeGenerationService;

    @Inject
    FunctionAnalysisService functionAnalysisService;

    @Override
    public int run(String... args) {
        if (args.length == 0) {
            log.info("No input file given, running as HTTP service");
            Quarkus.waitForExit();
            return EXIT_OK;
        }
        return execute(args, System.out, System.err);
    }

    int execute(String[] args, PrintStream out, PrintStream err) {
        boolean analyze = false;
        String file = null;
        for (String arg : args) {
            if ("--analyze".equals(arg)) {
                analyze = true;
            } else if (arg.startsWith("-") || file != null) {
                err.println(USAGE);
                return EXIT_USAGE;
            } else {
                file = arg;
            }
        }
        if (file == null) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        Path path;
        try {
            path = Path.of(file);
        } catch (InvalidPathException e) {
            err.println("Error: Cannot read file " + file + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
        if (analyze) {
            AnalysisResult result = functionAnalysisService.analyze(path);
            if (!result.isSuccess()) {
                err.println("Error: " + result.getErrorMessage());
                return EXIT_FAILURE;
            }
            out.print(result.getText());
            return EXIT_OK;
        }

        GenerationResult result = codeGenerationService.generate(path);
        if (result.isFailure()) {
            err.println("Error: " + result.getErrorMessage());
            return EXIT_FAILURE;
        }
        out.println(result.getCode());
        return EXIT_OK;
    }
}
