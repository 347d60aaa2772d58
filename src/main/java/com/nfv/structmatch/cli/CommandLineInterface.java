package com.nfv.structmatch.cli;

import com.nfv.structmatch.comparison.ContainsOptions;
import com.nfv.structmatch.comparison.StructuralComparator;
import com.nfv.structmatch.config.ConfigLoader;
import com.nfv.structmatch.merge.TreeMerger;
import com.nfv.structmatch.model.Match;
import com.nfv.structmatch.normalize.NormalizationException;
import com.nfv.structmatch.normalize.NormalizeOptions;
import com.nfv.structmatch.normalize.Normalizer;
import com.nfv.structmatch.yaml.DocumentLoader;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command Line Interface handler for StructMatch
 *
 * Usage:
 *   java -jar structmatch.jar [OPTIONS] contains|equivalent|merge|conflicts file1 file2
 *   java -jar structmatch.jar [OPTIONS] normalize file
 *
 * Examples:
 *   java -jar structmatch.jar contains actual.json expected.yaml
 *   java -jar structmatch.jar -z --time-delta PT1S equivalent left.json right.json
 */
@Slf4j
public class CommandLineInterface {

    public static final int EXIT_MATCH = 0;
    public static final int EXIT_MISMATCH = 1;
    public static final int EXIT_USAGE = 2;

    private static final List<String> COMMANDS =
            Arrays.asList("contains", "equivalent", "merge", "conflicts", "normalize");

    private final PrintStream out;
    private final PrintStream err;
    private final ConfigLoader configLoader;
    private final DocumentLoader documentLoader;
    private Options options;

    public CommandLineInterface() {
        this(System.out, System.err, new ConfigLoader());
    }

    public CommandLineInterface(PrintStream out, PrintStream err, ConfigLoader configLoader) {
        this.out = out;
        this.err = err;
        this.configLoader = configLoader;
        this.documentLoader = new DocumentLoader();
        initializeOptions();
    }

    private void initializeOptions() {
        options = new Options();

        options.addOption(Option.builder("h")
                .longOpt("help")
                .desc("Display help information")
                .build());

        options.addOption(Option.builder("s")
                .longOpt("string-contains")
                .desc("A string matches if it contains the expected string")
                .build());

        options.addOption(Option.builder("e")
                .longOpt("empty-values-match-any")
                .desc("Expected null, false, 0 and \"\" match any value of the same type")
                .build());

        options.addOption(Option.builder("p")
                .longOpt("parse-times")
                .desc("Compare RFC 3339 strings as points in time")
                .build());

        options.addOption(Option.builder("z")
                .longOpt("ignore-timezones")
                .desc("Times in different time zones match if they are the same instant")
                .build());

        options.addOption(Option.builder()
                .longOpt("time-delta")
                .hasArg()
                .argName("duration")
                .desc("Largest allowed difference between times, ISO-8601 (e.g., PT1S)")
                .build());

        options.addOption(Option.builder()
                .longOpt("truncate-times")
                .hasArg()
                .argName("duration")
                .desc("Truncate times to this unit before comparing (e.g., PT1M)")
                .build());

        options.addOption(Option.builder()
                .longOpt("round-times")
                .hasArg()
                .argName("duration")
                .desc("Round times to this unit before comparing (e.g., PT1M)")
                .build());

        options.addOption(Option.builder("i")
                .longOpt("ignore")
                .hasArg()
                .argName("path-pattern")
                .desc("Path to skip during comparison, may be repeated (e.g., metadata.uid, *.timestamp)")
                .build());

        options.addOption(Option.builder("f")
                .longOpt("config")
                .hasArg()
                .argName("config-file")
                .desc("Path to comparison config file (default: ./comparison-config.yaml)")
                .build());

        options.addOption(Option.builder("o")
                .longOpt("output-format")
                .hasArg()
                .argName("json|yaml")
                .desc("Output format of merge and normalize results (default: json)")
                .build());
    }

    /**
     * Run one command
     *
     * @return process exit code: 0 on match or success, 1 on mismatch or conflict, 2 on usage or input errors
     */
    public int execute(String[] args) {
        if (args.length == 0) {
            printHelp();
            return EXIT_USAGE;
        }

        CommandLine cmd;
        try {
            CommandLineParser parser = new DefaultParser();
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            err.println("Error: " + e.getMessage());
            err.println("Run with --help for usage");
            return EXIT_USAGE;
        }

        if (cmd.hasOption("h")) {
            printHelp();
            return EXIT_MATCH;
        }

        List<String> arguments = cmd.getArgList();
        if (arguments.isEmpty() || !COMMANDS.contains(arguments.get(0))) {
            err.println("Error: Unknown or missing command. Expected one of " + COMMANDS);
            return EXIT_USAGE;
        }
        String command = arguments.get(0);
        List<String> files = arguments.subList(1, arguments.size());
        int expectedFiles = "normalize".equals(command) ? 1 : 2;
        if (files.size() != expectedFiles) {
            err.printf("Error: '%s' requires %d file argument(s), got %d%n", command, expectedFiles, files.size());
            return EXIT_USAGE;
        }

        try {
            ContainsOptions containsOptions = buildOptions(cmd);
            String format = cmd.getOptionValue("o", "json");
            log.debug("Executing '{}' on {}", command, files);

            switch (command) {
                case "contains":
                    return compare(files, containsOptions, false);
                case "equivalent":
                    return compare(files, containsOptions, true);
                case "merge":
                    return merge(files, format);
                case "conflicts":
                    return conflicts(files);
                default:
                    return normalize(files.get(0), containsOptions, format);
            }
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            log.debug("Failed to read input", e);
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (NormalizationException e) {
            err.println("Error: cannot normalize document: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    /**
     * Config file options, overridden by command line flags
     */
    ContainsOptions buildOptions(CommandLine cmd) {
        ContainsOptions base = configLoader.load(cmd.getOptionValue("f"));
        ContainsOptions.ContainsOptionsBuilder builder = base.toBuilder();

        if (cmd.hasOption("s")) {
            builder.stringContains(true);
        }
        if (cmd.hasOption("e")) {
            builder.emptyValuesMatchAny(true);
        }
        if (cmd.hasOption("p")) {
            builder.parseTimes(true);
        }
        if (cmd.hasOption("z")) {
            builder.ignoreTimeZones(true);
        }
        if (cmd.hasOption("time-delta")) {
            builder.allowTimeDelta(parseDuration("time-delta", cmd.getOptionValue("time-delta")));
        }
        if (cmd.hasOption("truncate-times")) {
            builder.truncateTimes(parseDuration("truncate-times", cmd.getOptionValue("truncate-times")));
        }
        if (cmd.hasOption("round-times")) {
            builder.roundTimes(parseDuration("round-times", cmd.getOptionValue("round-times")));
        }

        List<String> ignorePaths = new ArrayList<>();
        if (base.getIgnorePaths() != null) {
            ignorePaths.addAll(base.getIgnorePaths());
        }
        if (cmd.hasOption("i")) {
            ignorePaths.addAll(Arrays.asList(cmd.getOptionValues("i")));
        }
        builder.ignorePaths(ignorePaths);

        return builder.build();
    }

    private static Duration parseDuration(String option, String value) {
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid duration for --" + option + ": " + value
                    + " (expected ISO-8601, e.g. PT1S)", e);
        }
    }

    private int compare(List<String> files, ContainsOptions containsOptions, boolean equivalence) throws IOException {
        Object v1 = documentLoader.load(files.get(0));
        Object v2 = documentLoader.load(files.get(1));

        Match match = equivalence
                ? StructuralComparator.equivalentMatch(v1, v2, containsOptions)
                : StructuralComparator.containsMatch(v1, v2, containsOptions);

        if (match.isMatches()) {
            out.println("✅ MATCH");
            return EXIT_MATCH;
        }
        if (match.hasError()) {
            err.println("Error: " + match.getMessage());
            return EXIT_USAGE;
        }
        out.println("❌ MISMATCH");
        out.println(match.getMessage());
        return EXIT_MISMATCH;
    }

    private int merge(List<String> files, String format) throws IOException {
        Object v1 = documentLoader.load(files.get(0));
        Object v2 = documentLoader.load(files.get(1));
        out.println(documentLoader.render(TreeMerger.merge(v1, v2), format));
        return EXIT_MATCH;
    }

    private int conflicts(List<String> files) throws IOException {
        Object v1 = documentLoader.load(files.get(0));
        Object v2 = documentLoader.load(files.get(1));
        if (TreeMerger.conflicts(v1, v2)) {
            out.println("❌ CONFLICT");
            return EXIT_MISMATCH;
        }
        out.println("✅ NO CONFLICT");
        return EXIT_MATCH;
    }

    private int normalize(String file, ContainsOptions containsOptions, String format)
            throws IOException, NormalizationException {
        Object value = documentLoader.load(file);
        NormalizeOptions normalizeOptions = NormalizeOptions.builder()
                .preserveTime(containsOptions.isTimeParsingEnabled())
                .build();
        out.println(documentLoader.render(Normalizer.getDefault().normalize(value, normalizeOptions), format));
        return EXIT_MATCH;
    }

    private void printHelp() {
        out.println("StructMatch - Structural comparison of JSON and YAML documents");
        out.println();
        out.println("USAGE:");
        out.println("  java -jar structmatch.jar [OPTIONS] contains   <file1> <file2>");
        out.println("  java -jar structmatch.jar [OPTIONS] equivalent <file1> <file2>");
        out.println("  java -jar structmatch.jar [OPTIONS] merge      <file1> <file2>");
        out.println("  java -jar structmatch.jar [OPTIONS] conflicts  <file1> <file2>");
        out.println("  java -jar structmatch.jar [OPTIONS] normalize  <file>");
        out.println();
        out.println("COMMANDS:");
        out.println("  contains                Check that file1 contains everything in file2");
        out.println("  equivalent              Check that file1 and file2 match in both directions");
        out.println("  merge                   Print file2 deep-merged into file1");
        out.println("  conflicts               Check whether merging file2 would overwrite values of file1");
        out.println("  normalize               Print the canonical form of a document");
        out.println();
        out.println("OPTIONS:");
        out.println("  -h, --help                    Display this help message");
        out.println("  -s, --string-contains         Strings match if file1's contains file2's");
        out.println("  -e, --empty-values-match-any  Empty values in file2 match anything of the same type");
        out.println("  -p, --parse-times             Compare RFC 3339 strings as times");
        out.println("  -z, --ignore-timezones        Compare times by instant, ignoring offsets");
        out.println("      --time-delta DURATION     Allowed time difference (e.g., PT1S)");
        out.println("      --truncate-times DURATION Truncate times before comparing (e.g., PT1M)");
        out.println("      --round-times DURATION    Round times before comparing (e.g., PT1M)");
        out.println("  -i, --ignore PATTERN          Path to skip, may be repeated");
        out.println("  -f, --config FILE             Path to comparison config file");
        out.println("                                (default: ./comparison-config.yaml)");
        out.println("  -o, --output-format FORMAT    json or yaml (default: json)");
        out.println();
        out.println("EXIT CODES:");
        out.println("  0  match, no conflict, or success");
        out.println("  1  mismatch or conflict");
        out.println("  2  usage or input error");
    }
}
