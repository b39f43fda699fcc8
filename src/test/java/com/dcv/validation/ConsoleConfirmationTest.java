package com.dcv.validation;

import com.dcv.domain.DcvExpiration;
import com.dcv.domain.DcvMethod;
import com.dcv.domain.Domain;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleConfirmationTest {

    private static final List<Domain> DOMAINS = List.of(
            new Domain("1", "example.com", DcvMethod.EMAIL, new DcvExpiration(LocalDate.of(2024, 2, 1), null)),
            new Domain("2", "example.org", DcvMethod.EMAIL, null));

    private static boolean answer(String input, ByteArrayOutputStream out) {
        ConsoleConfirmation confirmation = new ConsoleConfirmation(
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8));
        return confirmation.confirm(DOMAINS);
    }

    @ParameterizedTest
    @ValueSource(strings = {"y\n", "yes\n", " Y \n", "YES\n"})
    void approves(String input) {
        assertTrue(answer(input, new ByteArrayOutputStream()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"n\n", "no\n", "\n", "maybe\n", ""})
    void declines(String input) {
        assertFalse(answer(input, new ByteArrayOutputStream()));
    }

    @Test
    void listsCandidates() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        answer("n\n", out);

        String printed = out.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("example.com"));
        assertTrue(printed.contains("Expiration: 2024-02-01"));
        assertTrue(printed.contains("No expiration found, must be a new domain."));
        assertTrue(printed.contains("continue? [y/n]"));
    }
}
