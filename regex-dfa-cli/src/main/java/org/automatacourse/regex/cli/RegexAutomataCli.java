package org.automatacourse.regex.cli;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import org.automatacourse.regex.CompilerOptions;
import org.automatacourse.regex.Regex;
import org.automatacourse.regex.ast.RegexSyntaxException;
import org.automatacourse.regex.dfa.ConstructionMode;
import org.automatacourse.regex.dfa.RefinementMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileDescriptor;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Command line entry point. Options given on the command line override the
 * ones in {@code --config}, which override the bundled
 * {@code regex-automata.properties}.
 * <p>
 * Exit status: 0 on success or match, 1 on no match, a failed verification
 * or an I/O error, 2 on a usage error or malformed pattern.
 */
public class RegexAutomataCli {
    private static final Logger LOG = LoggerFactory.getLogger(RegexAutomataCli.class);

    static final String DEFAULTS_RESOURCE = "/regex-automata.properties";
    static final int EXIT_USAGE = 2;

    @Parameter(names = {"-r", "--regexp"}, description = "Regular expression")
    private String regexp;

    @Parameter(names = "--construction", description = "Subset construction mode: terminal-accepting or full-closure")
    private String construction;

    @Parameter(names = "--refinement", description = "Minimizer refinement mode: first-group or all-groups")
    private String refinement;

    @Parameter(names = "--config", description = "Properties file overriding the bundled defaults")
    private String config;

    @Parameter(names = {"-h", "--help"}, help = true, description = "Displays help")
    private boolean help;

    public static void main(String... args) {
        PrintStream out = new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
        System.exit(run(args, out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        RegexAutomataCli cli = new RegexAutomataCli();
        Map<String, CliCommand> commands = new LinkedHashMap<>();
        commands.put("test", new TestCommand());
        commands.put("table", new TableCommand());
        commands.put("export", new ExportCommand());
        commands.put("verify", new VerifyCommand());

        JCommander.Builder builder = JCommander.newBuilder().programName("regex-automata").addObject(cli);
        for (Map.Entry<String, CliCommand> command : commands.entrySet()) {
            builder.addCommand(command.getKey(), command.getValue());
        }
        JCommander jCommander = builder.build();

        try {
            jCommander.parse(args);
        } catch (ParameterException e) {
            err.println(e.getMessage());
            err.print(usage(jCommander));
            return EXIT_USAGE;
        }
        if (cli.help) {
            out.print(usage(jCommander));
            return 0;
        }
        String commandName = jCommander.getParsedCommand();
        if (commandName == null || cli.regexp == null) {
            err.println(commandName == null ? "No command given" : "The option --regexp is required");
            err.print(usage(jCommander));
            return EXIT_USAGE;
        }

        CliCommand command = commands.get(commandName);
        try {
            CompilerOptions options = command.configure(cli.loadOptions());
            LOG.debug("Running '{}' on /{}/ with {}", commandName, cli.regexp, options);
            Regex regex = Regex.compile(cli.regexp, options);
            return command.run(regex, out);
        } catch (RegexSyntaxException | IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            LOG.error("Command '{}' failed", commandName, e);
            err.println("Error occurred: " + e.getMessage());
            return 1;
        }
    }

    CompilerOptions loadOptions() throws IOException {
        Properties properties = new Properties();
        try (InputStream in = RegexAutomataCli.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                LOG.warn("{} not found on the classpath, using built-in defaults", DEFAULTS_RESOURCE);
            }
        }
        if (config != null) {
            try (InputStream in = new FileInputStream(config)) {
                properties.load(in);
            }
        }

        CompilerOptions.Builder options = CompilerOptions.fromProperties(properties).toBuilder();
        if (construction != null) {
            options.construction(CompilerOptions.parseEnum(ConstructionMode.class, "--construction", construction));
        }
        if (refinement != null) {
            options.refinement(CompilerOptions.parseEnum(RefinementMode.class, "--refinement", refinement));
        }
        return options.build();
    }

    private static String usage(JCommander jCommander) {
        StringBuilder sb = new StringBuilder();
        jCommander.getUsageFormatter().usage(sb);
        return sb.toString();
    }
}
