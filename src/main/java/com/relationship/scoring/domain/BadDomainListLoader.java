package com.relationship.scoring.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads the bad-domain reference list.
 *
 * <p>Expected format (extra columns are ignored):</p>
 * <pre>
 * bad_domains,notes
 * gmail.com,free mail
 * ringcentral.com,telephony
 * </pre>
 *
 * <p>A missing or unreadable list is logged and yields an empty set; it never fails startup.</p>
 */
public final class BadDomainListLoader {
    private static final Logger log = LoggerFactory.getLogger(BadDomainListLoader.class);

    public static final String HEADER = "bad_domains";
    public static final String DEFAULT_RESOURCE = "reference/bad_domains.csv";

    private BadDomainListLoader() {
        // Utility class
    }

    /**
     * Loads the list from a file path.
     */
    public static BadDomainSet load(Path path) {
        if (path == null || !Files.isReadable(path)) {
            log.warn("bad-domains.missing path={} - bad-domain check disabled", path);
            return BadDomainSet.empty();
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            BadDomainSet set = read(reader);
            log.info("bad-domains.loaded path={} size={}", path, set.size());
            return set;
        } catch (IOException e) {
            log.error("bad-domains.failed path={} error={}", path, e.getMessage());
            return BadDomainSet.empty();
        }
    }

    /**
     * Loads the list from a classpath resource.
     */
    public static BadDomainSet loadResource(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = BadDomainListLoader.class.getClassLoader();
        }
        InputStream input = loader.getResourceAsStream(resource);
        if (input == null) {
            log.warn("bad-domains.missing resource={} - bad-domain check disabled", resource);
            return BadDomainSet.empty();
        }
        try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
            BadDomainSet set = read(reader);
            log.info("bad-domains.loaded resource={} size={}", resource, set.size());
            return set;
        } catch (IOException e) {
            log.error("bad-domains.failed resource={} error={}", resource, e.getMessage());
            return BadDomainSet.empty();
        }
    }

    /**
     * Reads the list from an open reader. The caller owns the reader.
     *
     * @throws IOException if the reader fails
     */
    public static BadDomainSet read(Reader reader) throws IOException {
        BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);

        String header = br.readLine();
        if (header == null) {
            return BadDomainSet.empty();
        }
        int column = findColumn(splitRow(header));
        if (column < 0) {
            log.warn("bad-domains.header-missing expected={} header='{}' - using first column", HEADER, header);
            column = 0;
        }

        List<String> domains = new ArrayList<>();
        String line;
        while ((line = br.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            List<String> cells = splitRow(line);
            if (column < cells.size()) {
                String domain = BadDomainSet.clean(cells.get(column));
                if (!domain.isEmpty()) {
                    domains.add(domain);
                }
            }
        }
        return BadDomainSet.of(domains);
    }

    private static int findColumn(List<String> headerCells) {
        for (int i = 0; i < headerCells.size(); i++) {
            if (HEADER.equals(BadDomainSet.clean(headerCells.get(i)).toLowerCase(Locale.ROOT))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Splits a CSV row on commas outside double quotes.
     */
    static List<String> splitRow(String row) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < row.length(); i++) {
            char c = row.charAt(i);
            if (c == '"') {
                if (quoted && i + 1 < row.length() && row.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else {
                    quoted = !quoted;
                }
            } else if (c == ',' && !quoted) {
                cells.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        cells.add(current.toString());
        return cells;
    }
}
