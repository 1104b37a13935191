package com.vidnyan.sigmaeval.adapter.out.evaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regexes for literal indicators (IPs, domains, tokens, GUIDs) embedded in rule values.
 */
public final class IndicatorPatterns {

    public static final Pattern IPV4 = Pattern.compile("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b");

    public static final Pattern DOMAIN = Pattern.compile(
            "\\b(?:[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?\\.)+([a-zA-Z]{2,6})\\b");

    public static final Pattern BASE64 = Pattern.compile("[A-Za-z0-9+/]{41,}={0,2}");

    public static final Pattern GUID = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    public static final Pattern JWT = Pattern.compile("eyJ[A-Za-z0-9_-]+\\.eyJ[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+");

    /**
     * Endings that make a dotted token a file name rather than a host.
     */
    private static final Set<String> FILE_EXTENSIONS = Set.of(
            "exe", "dll", "ps1", "psm1", "bat", "cmd", "vbs", "vbe", "js", "jse", "wsf", "hta", "msi",
            "lnk", "sys", "scr", "zip", "rar", "7z", "tmp", "log", "txt", "dat", "ini", "xml",
            "json", "yaml", "yml", "cpl", "ocx", "jar", "py", "sh", "doc", "docx", "docm", "xls",
            "xlsx", "xlsm", "ppt", "pptx", "pdf", "iso", "img", "vhd", "vhdx", "csv", "htm", "html",
            "php", "aspx", "asp", "jsp", "dmp", "bin", "cab", "chm", "reg", "inf", "evtx", "db");

    /**
     * Top-level domains accepted without URL or mail context. Other dotted tokens such as
     * {@code update.task} only count as hosts after {@code //} or {@code @}.
     */
    private static final Set<String> KNOWN_TLDS = Set.of(
            "com", "net", "org", "edu", "gov", "mil", "int", "info", "biz", "io", "co", "me", "cc",
            "tv", "ru", "cn", "su", "uk", "de", "fr", "nl", "ir", "kp", "br", "in", "jp", "kr", "ua",
            "tk", "ml", "ga", "cf", "gq", "pw", "ws", "xyz", "top", "online", "site", "club", "live",
            "onion", "app", "dev", "cloud", "link", "shop", "store", "tech");

    private static final Set<String> NAMESPACE_PREFIXES = Set.of("system.", "microsoft.", "windows.", "net.");

    private static final Set<String> BENIGN_DOMAINS = Set.of(
            "microsoft.com", "windows.com", "example.com", "example.org", "example.net", "test.com");

    private IndicatorPatterns() {
    }

    public static List<String> ipAddresses(String value) {
        List<String> found = new ArrayList<>();
        Matcher matcher = IPV4.matcher(value);
        while (matcher.find()) {
            if (validOctets(matcher.group())) {
                found.add(matcher.group());
            }
        }
        return found;
    }

    /**
     * Domain-shaped tokens with a known TLD or URL/mail context, excluding file names, .NET/Windows namespaces and well-known benign hosts.
     */
    public static List<String> domains(String value) {
        List<String> found = new ArrayList<>();
        Matcher matcher = DOMAIN.matcher(value);
        while (matcher.find()) {
            String candidate = matcher.group().toLowerCase(Locale.ROOT);
            String tld = matcher.group(1).toLowerCase(Locale.ROOT);
            if (FILE_EXTENSIONS.contains(tld) || isNamespace(candidate) || isBenign(candidate)) {
                continue;
            }
            if (!KNOWN_TLDS.contains(tld) && !hostContext(value, matcher.start())) {
                continue;
            }
            found.add(matcher.group());
        }
        return found;
    }

    public static List<String> tokens(String value) {
        return all(JWT, value);
    }

    /**
     * GUIDs other than the all-zero and all-f placeholders.
     */
    public static List<String> guids(String value) {
        List<String> found = new ArrayList<>();
        for (String guid : all(GUID, value)) {
            String digits = guid.replace("-", "").toLowerCase(Locale.ROOT);
            if (!digits.chars().allMatch(c -> c == '0') && !digits.chars().allMatch(c -> c == 'f')) {
                found.add(guid);
            }
        }
        return found;
    }

    public static boolean isBenign(String domain) {
        String lower = domain.toLowerCase(Locale.ROOT);
        for (String benign : BENIGN_DOMAINS) {
            if (lower.equals(benign) || lower.endsWith("." + benign)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hostContext(String value, int start) {
        String before = value.substring(0, start);
        return before.endsWith("//") || before.endsWith("@");
    }

    private static boolean isNamespace(String candidate) {
        for (String prefix : NAMESPACE_PREFIXES) {
            if (candidate.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static boolean validOctets(String ip) {
        for (String octet : ip.split("\\.")) {
            if (Integer.parseInt(octet) > 255) {
                return false;
            }
        }
        return true;
    }

    private static List<String> all(Pattern pattern, String value) {
        List<String> found = new ArrayList<>();
        Matcher matcher = pattern.matcher(value);
        while (matcher.find()) {
            found.add(matcher.group());
        }
        return found;
    }
}
