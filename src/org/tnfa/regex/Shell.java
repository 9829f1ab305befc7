/*
 * @LICENSE@
 */
package org.tnfa.regex;

import java.io.BufferedReader;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.Charset;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

/**
 * Line oriented command shell over a single stored {@link Pattern}:
 * <blockquote><pre>
 *  exp &lt;expression>   compile and store an expression
 *  dot &lt;file>         write the stored NFA in dot notation
 *  mat &lt;string>       check whether the stored pattern accepts a string
 *  end                stop
 * </pre></blockquote>
 * A command given without its argument prompts for it on the next line. The
 * stored pattern starts out as the empty expression.
 * <p>
 * In quiet mode (command line argument <code>d</code>) neither the banner nor
 * the menu is printed, which makes the shell scriptable.
 */
public final class Shell {

    private static final Logger logger = Logger.getLogger("org.tnfa.regex");

    static final String BANNER = "Regular expression parsing with Thompson NFAs";

    static final String MENU =
        "Available operations:\n"
        + " - exp <expression>\tRead in regular expression\n"
        + " - dot <filename>\tExport regular expression to dot-notation\n"
        + " - mat <string>\t\tCheck whether a string is accepted by automaton\n"
        + " - end\t\t\tClose the program\n"
        + "Please enter an operation. If applicable, you can immediately provide\n"
        + "an argument for the operation:";

    /*
     * dot files are always written as UTF-8
     */
    static final String DOT_ENCODING = "UTF-8";

    private final BufferedReader in;
    private final PrintStream out;
    private final boolean quiet;
    private Pattern pattern = Pattern.compile("");

    public Shell(Reader in, PrintStream out, boolean quiet) {
        this.in = in instanceof BufferedReader
            ? (BufferedReader) in : new BufferedReader(in);
        this.out = out;
        this.quiet = quiet;
    }

    /**
     * Reads and executes commands until <code>end</code> or end of input.
     */
    public void run() throws IOException {
        if (!quiet) out.println(BANNER);
        while (true) {
            if (!quiet) out.print(MENU);
            String line = in.readLine();
            if (line == null || !execute(line)) {
                return;
            }
        }
    }

    /**
     * Executes one command line.
     *
     * @return false if the shell should stop.
     */
    boolean execute(String operation) throws IOException {
        final int cr = operation.indexOf('\r');
        if (cr >= 0) operation = operation.substring(0, cr);

        final String trimmed = operation.trim();
        final int blank = indexOfBlank(trimmed);
        final String command = blank < 0 ? trimmed : trimmed.substring(0, blank);
        final String argument = blank < 0 ? "" : trimmed.substring(blank).trim();

        if (command.equals("exp")) {
            String regex = argument.length() > 0
                ? argument : prompt("Please enter a regular expression:");
            if (regex == null) return false;
            try {
                pattern = Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                out.println("Invalid regular expression: " + e.getDescription());
            }
        } else if (command.equals("dot")) {
            String file = argument.length() > 0
                ? firstWord(argument)
                : prompt("Please enter a filepath to write the output to:");
            if (file == null) return false;
            try {
                writeDot(file);
            } catch (IOException e) {
                logger.log(Level.WARNING, "dot export to " + file + " failed", e);
                out.println("Error while exporting .dot: " + e.getMessage());
            }
        } else if (command.equals("mat")) {
            String input = argument.length() > 0
                ? argument : prompt("Please enter a string to check:");
            if (input == null) return false;
            out.println(pattern.accepts(input) ? "match" : "no match");
        } else if (command.equals("end")) {
            return false;
        } else {
            out.println("Unknown command: "
                + (command.length() == 0 ? "(none)" : command));
        }
        return true;
    }

    Pattern pattern() {
        return pattern;
    }

    private void writeDot(String file) throws IOException {
        Writer w = new OutputStreamWriter(new FileOutputStream(file), DOT_ENCODING);
        try {
            w.write(pattern.toDot());
        } finally {
            w.close();
        }
    }

    /*
     * null on end of input
     */
    private String prompt(String msg) throws IOException {
        out.print(msg);
        out.flush();
        String line = in.readLine();
        if (line == null) return null;
        final int cr = line.indexOf('\r');
        return cr >= 0 ? line.substring(0, cr) : line;
    }

    private static int indexOfBlank(String s) {
        for (int i = 0; i < s.length(); ++i) {
            if (Character.isWhitespace(s.charAt(i))) return i;
        }
        return -1;
    }

    private static String firstWord(String s) {
        final int blank = indexOfBlank(s);
        return blank < 0 ? s : s.substring(0, blank);
    }

    public static void main(String[] args) {
        if (args.length > 1) {
            System.out.println("Usage: Shell [d]");
            System.exit(1);
        }
        final boolean quiet = args.length == 1 && args[0].startsWith("d");
        try {
            // commands come from the console, in its encoding
            Reader console = new InputStreamReader(System.in, Charset.defaultCharset());
            new Shell(console, System.out, quiet).run();
        } catch (IOException e) {
            logger.log(Level.SEVERE, "reading commands failed", e);
            System.exit(1);
        }
    }
}
