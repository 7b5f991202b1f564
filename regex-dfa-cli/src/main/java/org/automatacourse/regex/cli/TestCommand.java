package org.automatacourse.regex.cli;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import org.automatacourse.regex.Regex;

import java.io.PrintStream;

@Parameters(commandDescription = "Test whether an input matches the pattern")
public class TestCommand implements CliCommand {

    @Parameter(names = {"-i", "--input"}, description = "Input to test", required = true)
    private String input;

    @Override
    public int run(Regex regex, PrintStream out) {
        boolean matched = regex.test(input);
        out.println(matched ? "match" : "no match");
        return matched ? 0 : 1;
    }
}
