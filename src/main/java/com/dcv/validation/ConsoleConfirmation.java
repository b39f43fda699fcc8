package com.dcv.validation;

import com.dcv.domain.Domain;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Console yes/no prompt.
 * <p>Only <i>y</i> or <i>yes</i> approves; anything else, including end of input, aborts.
 */
public class ConsoleConfirmation implements Confirmation {
    private static final Logger log = LogManager.getLogger(ConsoleConfirmation.class);

    private final BufferedReader in;
    private final PrintStream out;

    /**
     * Constructs a new ConsoleConfirmation on standard streams.
     */
    public ConsoleConfirmation() {
        this(System.in, System.out);
    }

    /**
     * Constructs a new ConsoleConfirmation on given streams.
     *
     * @param in  Input stream.
     * @param out Output stream.
     */
    public ConsoleConfirmation(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public boolean confirm(List<Domain> domains) {
        out.println();
        out.println("List of domains to be validated:");
        out.println();
        for (Domain domain : domains) {
            out.println(String.format("%-30s %30s", domain.getName(), domain.getEarliestExpiration()
                    .map(date -> "Expiration: " + date)
                    .orElse("No expiration found, must be a new domain.")));
        }

        out.print("\nThe above domains will be validated, continue? [y/n] ");
        out.flush();

        String answer;
        try {
            answer = in.readLine();
        } catch (IOException e) {
            log.warn("Unable to read confirmation: {}", e.getMessage());
            return false;
        }

        String normalized = answer != null ? answer.trim().toLowerCase(Locale.ROOT) : "";
        return normalized.equals("y") || normalized.equals("yes");
    }
}
