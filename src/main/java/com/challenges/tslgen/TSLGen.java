package com.challenges.tslgen;

import com.challenges.tslgen.generator.FrameGenerator;
import com.challenges.tslgen.generator.GeneratorOptions;
import com.challenges.tslgen.generator.GeneratorResult;
import com.challenges.tslgen.model.Specification;
import com.challenges.tslgen.output.FrameFormatter;
import com.challenges.tslgen.output.OutputFormat;
import com.challenges.tslgen.parser.TslParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "tslgen", mixinStandardHelpOptions = true, version = "tslgen 1.0",
         description = "Generate test frames from a Test Specification Language file")
public class TSLGen implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(TSLGen.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "The TSL input file")
    private Path inputFile;

    @Option(names = {"-o", "--output"}, paramLabel = "FILE",
            description = "Output file for the frames (default: <input>.tsl)")
    private Path outputFile;

    @Option(names = {"-s", "--stdout"}, description = "Write frames to standard output instead of a file")
    private boolean stdout = false;

    @Option(names = {"-f", "--format"}, defaultValue = "text",
            description = "Frame listing format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private OutputFormat format = OutputFormat.TEXT;

    @Option(names = {"-C", "--color-output"}, description = "Colorize text output")
    private boolean colorOutput = false;

    @Option(names = {"-c", "--compact-output"}, description = "Compact JSON output without whitespace")
    private boolean compactOutput = false;

    @Option(names = "--summary-only", description = "Print frame counts without writing any frames")
    private boolean summaryOnly = false;

    @Option(names = "--max-steps", paramLabel = "N", defaultValue = "10000000",
            description = "Abort when the search visits more than N states; 0 for no limit (default: ${DEFAULT-VALUE})")
    private long maxSteps = GeneratorOptions.DEFAULT_MAX_STEPS;

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    public static CommandLine commandLine() {
        return new CommandLine(new TSLGen()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            // Parse the specification
            Specification specification = new TslParser().parse(inputFile);

            // Generate the frames
            FrameGenerator generator = new FrameGenerator(specification, new GeneratorOptions(maxSteps));
            GeneratorResult result = generator.generate();

            // Format and output the results
            FrameFormatter formatter = new FrameFormatter(!compactOutput, colorOutput && format == OutputFormat.TEXT);
            boolean framesOnStdout = stdout && !summaryOnly;
            // keep a JSON stream on stdout parseable
            PrintWriter summaryOut = framesOnStdout && format == OutputFormat.JSON ? err : out;
            summaryOut.print(formatter.formatSummary(result));
            summaryOut.flush();

            if (!summaryOnly) {
                String rendered = formatter.format(result, format);
                if (stdout) {
                    out.println();
                    out.print(rendered);
                } else {
                    Path target = outputFile != null ? outputFile : Path.of(inputFile + ".tsl");
                    Files.writeString(target, rendered, StandardCharsets.UTF_8);
                    out.println("Wrote " + result.totalFrames() + " test frames to " + target);
                }
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            log.debug("tslgen failed for {}", inputFile, e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
