package org.automatacourse.regex.cli;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.common.hash.Hashing;
import org.automatacourse.regex.Regex;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Writes the DFA as JSON. Without {@code --output} the file is named after
 * the pattern's hash, {@code dfa-<8 hex digits>.json}.
 */
@Parameters(commandDescription = "Export the DFA transition table as JSON")
public class ExportCommand implements CliCommand {

    @Parameter(names = {"-o", "--output"}, description = "Output file")
    private String output;

    @Parameter(names = {"-m", "--minimize"}, description = "Export the minimized table instead of the original one")
    private boolean minimize;

    @Override
    public int run(Regex regex, PrintStream out) throws IOException {
        File file = new File(output != null ? output : defaultFileName(regex.getPattern()));
        AutomatonSerializer.serializeToJson(minimize ? regex.getMinimizedTable() : regex.getDfaTable(),
                regex.getPattern(), file);
        // the file name is the only output so a calling program can pick it up
        out.println(file.getPath());
        return 0;
    }

    static String defaultFileName(String pattern) {
        String hash = Hashing.sha256().hashString(pattern, StandardCharsets.UTF_8).toString();
        return "dfa-" + hash.substring(0, 8) + ".json";
    }
}
