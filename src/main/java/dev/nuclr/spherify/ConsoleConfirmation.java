package dev.nuclr.spherify;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

import dev.nuclr.spherify.service.Confirmation;

/**
 * Terminal {@link Confirmation}: prints the question with a {@code [y/n]}
 * suffix and reads one line. Re-asks on anything that is not a yes/no word;
 * end of input counts as "no".
 */
final class ConsoleConfirmation implements Confirmation {

    private static final Set<String> YES = Set.of("y", "yes", "t", "true", "on", "1");
    private static final Set<String> NO = Set.of("n", "no", "f", "false", "off", "0");

    private final BufferedReader in;
    private final PrintStream out;

    ConsoleConfirmation(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public boolean confirm(String question) {
        while (true) {
            out.print(question + " [y/n] ");
            out.flush();
            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                return false;
            }
            if (line == null) {
                return false;
            }
            String answer = line.trim().toLowerCase(Locale.ROOT);
            if (YES.contains(answer)) {
                return true;
            }
            if (NO.contains(answer)) {
                return false;
            }
        }
    }
}
