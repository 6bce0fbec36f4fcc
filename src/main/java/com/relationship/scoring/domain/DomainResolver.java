package com.relationship.scoring.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts registrable domains from websites and email addresses, and repairs
 * operator-input noise against a {@link BadDomainSet}.
 *
 * <p>Never throws for malformed input: anything that cannot be parsed resolves to {@code ""}.</p>
 */
public class DomainResolver {
    private static final Logger log = LoggerFactory.getLogger(DomainResolver.class);

    public static final List<String> DEFAULT_SUBDOMAIN_PREFIXES =
            List.of("app.", "portal.", "my.", "secure.", "admin.");

    /**
     * TLD tokens known to be typing noise, e.g. {@code gmail.comno}.
     */
    public static final Set<String> INVALID_TLDS =
            Set.of("comno", "comxyz", "com123", "netno", "orgno", "comabc");

    private static final List<String> COMMON_TLDS = List.of("com", "net", "org");
    private static final int MAX_TRAILING_GARBAGE = 4;
    private static final int MAX_PLAUSIBLE_TLD = 4;
    private static final Pattern SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://.*");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]");

    private final List<String> subdomainPrefixes;

    public DomainResolver() {
        this(DEFAULT_SUBDOMAIN_PREFIXES);
    }

    public DomainResolver(List<String> subdomainPrefixes) {
        this.subdomainPrefixes = List.copyOf(Objects.requireNonNull(subdomainPrefixes, "subdomainPrefixes is required"));
    }

    /**
     * Extracts the domain from a URL or an email address.
     * Emails use the part after the last {@code @}; URLs without a scheme are parsed as {@code http://}.
     * A leading {@code www.} and then one configured subdomain prefix are stripped.
     *
     * @return the lowercase domain, or {@code ""} if none could be extracted
     */
    public String extract(String urlOrEmail) {
        if (urlOrEmail == null || urlOrEmail.isBlank()) {
            return "";
        }
        String input = urlOrEmail.trim();

        String host;
        int at = input.lastIndexOf('@');
        if (at >= 0) {
            host = input.substring(at + 1);
        } else {
            host = parseHost(input);
        }

        host = host.trim().toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        for (String prefix : subdomainPrefixes) {
            if (host.startsWith(prefix) && host.length() > prefix.length()) {
                host = host.substring(prefix.length());
                break;
            }
        }
        return host;
    }

    /**
     * Maps a noisy domain onto the known-bad domain it was meant to be.
     * Rules, first match wins:
     * <ol>
     *   <li>already a member: returned as-is</li>
     *   <li>a member followed by up to 4 alphanumeric characters ({@code gmail.comno}): that member</li>
     *   <li>a subdomain of a member ({@code test.ringcentral.com}): that member</li>
     *   <li>an invalid TLD token: the first {@code com}/{@code net}/{@code org} substitution that is a member</li>
     *   <li>otherwise the domain unchanged</li>
     * </ol>
     * Valid short TLDs such as {@code .io}, {@code .co} or {@code .xyz} are never rewritten.
     */
    public String repair(String domain, BadDomainSet badSet) {
        if (domain == null || domain.isBlank()) {
            return "";
        }
        String candidate = domain.trim().toLowerCase(Locale.ROOT);
        if (badSet.isEmpty() || badSet.contains(candidate)) {
            return candidate;
        }

        for (String bad : badSet.ordered()) {
            if (candidate.length() > bad.length() && candidate.startsWith(bad)) {
                String extra = candidate.substring(bad.length());
                if (extra.length() <= MAX_TRAILING_GARBAGE && isAlphanumeric(extra)) {
                    log.debug("Repaired '{}' -> '{}' (trailing garbage)", candidate, bad);
                    return bad;
                }
            }
        }

        for (String bad : badSet.ordered()) {
            if (candidate.endsWith("." + bad)) {
                log.debug("Repaired '{}' -> '{}' (subdomain)", candidate, bad);
                return bad;
            }
        }

        int dot = candidate.lastIndexOf('.');
        if (dot > 0 && dot < candidate.length() - 1) {
            String base = candidate.substring(0, dot);
            String tld = candidate.substring(dot + 1);
            if (isInvalidTld(tld)) {
                for (String common : COMMON_TLDS) {
                    String substituted = base + "." + common;
                    if (badSet.contains(substituted)) {
                        log.debug("Repaired '{}' -> '{}' (invalid TLD)", candidate, substituted);
                        return substituted;
                    }
                }
            }
        }
        return candidate;
    }

    /**
     * Returns true if the repaired domain is a member of the bad-domain set.
     */
    public boolean isBad(String domain, BadDomainSet badSet) {
        String repaired = repair(domain, badSet);
        return !repaired.isEmpty() && badSet.contains(repaired);
    }

    /**
     * Derives a bare company name from a domain: drops the TLD (the last label)
     * and every non-alphanumeric character, e.g. {@code carlosreyes.zumba.com -> carlosreyeszumba}.
     */
    public String domainDerivedName(String domain) {
        if (domain == null || domain.isBlank()) {
            return "";
        }
        String lower = domain.trim().toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        String base = dot > 0 ? lower.substring(0, dot) : lower;
        return NON_ALNUM.matcher(base).replaceAll("");
    }

    /**
     * Extracts the domain of a website and derives a bare company name from it.
     */
    public String nameFromWebsite(String website) {
        return domainDerivedName(extract(website));
    }

    private String parseHost(String input) {
        String url = SCHEME.matcher(input).matches() ? input : "http://" + input;
        try {
            URI uri = new URI(url);
            if (uri.getHost() != null) {
                return uri.getHost();
            }
            // Hosts with characters URI rejects (e.g. underscores) still carry an authority
            String authority = uri.getRawAuthority();
            if (authority == null) {
                return "";
            }
            int userInfoEnd = authority.lastIndexOf('@');
            if (userInfoEnd >= 0) {
                authority = authority.substring(userInfoEnd + 1);
            }
            int port = authority.indexOf(':');
            return port >= 0 ? authority.substring(0, port) : authority;
        } catch (URISyntaxException e) {
            log.debug("Could not parse '{}' as a URL: {}", input, e.getMessage());
            return "";
        }
    }

    private static boolean isInvalidTld(String tld) {
        return INVALID_TLDS.contains(tld) || (isAlphanumeric(tld) && tld.length() > MAX_PLAUSIBLE_TLD);
    }

    private static boolean isAlphanumeric(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean alnum = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
            if (!alnum) {
                return false;
            }
        }
        return true;
    }
}
