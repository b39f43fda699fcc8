package com.dcv.validation;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Reads a list of domain names, one FQDN per line.
 * <p>Blank lines and lines starting with <i>#</i> are ignored. Duplicates are collapsed.
 */
public class DomainFile {

    private DomainFile() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Reads domain names.
     *
     * @param path File path.
     * @return Set of lower case names in file order.
     * @throws IOException Unable to read file.
     */
    public static Set<String> read(Path path) throws IOException {
        Set<String> names = new LinkedHashSet<>();

        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String name = line.trim();
                if (name.isEmpty() || name.startsWith("#")) {
                    continue;
                }
                names.add(name.toLowerCase(Locale.ROOT));
            }
        }

        return names;
    }
}
