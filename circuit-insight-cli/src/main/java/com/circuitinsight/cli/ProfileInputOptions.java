package com.circuitinsight.cli;

import com.circuitinsight.core.config.ConfigLoader;
import com.circuitinsight.core.config.InsightConfig;
import com.circuitinsight.core.profiler.ProfilerOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Input options shared by the commands that build a report: the circuit source plus one
 * profiler output file per cost domain.
 */
public class ProfileInputOptions {

    private static final Logger log = LoggerFactory.getLogger(ProfileInputOptions.class);

    @Parameters(index = "0", description = "Circuit source file (e.g. src/main.nr)")
    Path sourceFile;

    @Option(names = {"--acir"}, description = "Constrained (ACIR) opcode flamegraph")
    Path acirFile;

    @Option(names = {"--brillig"}, description = "Unconstrained (Brillig) opcode flamegraph")
    Path brilligFile;

    @Option(names = {"--gates"}, description = "Backend gate flamegraph")
    Path gatesFile;

    @Option(names = {"--file-name"}, description = "File name used in the profiler annotations (default: source file name)")
    String fileName;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: ${DEFAULT-VALUE})",
        defaultValue = ConfigLoader.DEFAULT_FILE_NAME
    )
    Path configFile;

    /**
     * Loads the configuration file, falling back to defaults.
     *
     * @return effective configuration
     */
    public InsightConfig loadConfig() {
        Path absoluteConfigPath = configFile.toAbsolutePath();
        log.debug("Loading configuration from: {}", absoluteConfigPath);
        return ConfigLoader.load(absoluteConfigPath);
    }

    /**
     * Reads the source and the given domain files.
     *
     * @return profiler output
     * @throws IOException if a file cannot be read
     */
    public ProfilerOutput read() throws IOException {
        return read(acirFile, brilligFile, gatesFile);
    }

    /**
     * Reads the source with replacement domain files.
     *
     * @param constrained constrained opcode file, may be null
     * @param unconstrained unconstrained opcode file, may be null
     * @param gates gate file, may be null
     * @return profiler output
     * @throws IOException if a file cannot be read
     */
    public ProfilerOutput read(Path constrained, Path unconstrained, Path gates) throws IOException {
        String source = Files.readString(sourceFile);
        return new ProfilerOutput(
            readOptional(constrained),
            readOptional(unconstrained),
            readOptional(gates),
            source,
            resolveFileName()
        );
    }

    /**
     * Reads the source file.
     *
     * @return source text
     * @throws IOException if the file cannot be read
     */
    public String readSource() throws IOException {
        return Files.readString(sourceFile);
    }

    public Path getSourceFile() {
        return sourceFile;
    }

    public Path getAcirFile() {
        return acirFile;
    }

    public Path getBrilligFile() {
        return brilligFile;
    }

    public Path getGatesFile() {
        return gatesFile;
    }

    String resolveFileName() {
        if (fileName != null && !fileName.isBlank()) {
            return fileName;
        }
        Path name = sourceFile.getFileName();
        return name == null ? null : name.toString();
    }

    private static String readOptional(Path file) throws IOException {
        if (file == null) {
            return null;
        }
        log.debug("Reading profiler output: {}", file);
        return Files.readString(file);
    }
}
