package com.example.statements.application.service;

import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Application-layer service for the human-facing names of banking documents: normalized account holder labels,
 * institution abbreviations and display names such as {@code "2.3 CBA 1234"}.
 */
@Service
public class DocumentNamingService {

    static final String UNKNOWN_HOLDER = "Unknown Holder";
    static final String UNKNOWN_INSTITUTION = "UNKNOWN";

    private static final Set<String> TITLES = Set.of(
            "mr", "mrs", "ms", "miss", "dr", "prof", "professor", "sir", "madam", "lord", "lady");
    private static final Set<String> NON_SIGNIFICANT_WORDS = Set.of(
            "bank", "banking", "group", "corporation", "ltd", "limited", "australia", "australian");
    private static final Map<String, String> KNOWN_ABBREVIATIONS = Map.of(
            "commonwealth bank of australia", "CBA",
            "commonwealth bank", "CBA",
            "australia and new zealand banking group", "ANZ",
            "westpac banking corporation", "WBC",
            "westpac", "WBC",
            "national australia bank", "NAB",
            "bendigo and adelaide bank", "BEN",
            "bendigo bank", "BEN",
            "ing bank", "ING",
            "hsbc bank australia", "HSBC"
    );

    /**
     * Strips leading honorifics and applies title case, so "MR JOHN  SMITH" and "John Smith" name the same account.
     *
     * @param rawName holder name as extracted or typed
     * @return normalized label, {@value #UNKNOWN_HOLDER} when nothing is left
     */
    public String normalizeAccountHolder(String rawName) {
        if (rawName == null || rawName.isBlank()) {
            return UNKNOWN_HOLDER;
        }
        List<String> words = Arrays.stream(rawName.trim().split("\\s+")).toList();
        int start = 0;
        while (start < words.size() - 1 && isTitle(words.get(start))) {
            start++;
        }
        String normalized = words.subList(start, words.size()).stream()
                .map(DocumentNamingService::titleCase)
                .collect(Collectors.joining(" "));
        return normalized.isEmpty() ? UNKNOWN_HOLDER : normalized;
    }

    /**
     * Resolves a short institution code. Well-known institutions use their market abbreviation; anything else
     * uses the initials of up to four significant words.
     *
     * @param institution institution name
     * @return upper-case abbreviation, {@value #UNKNOWN_INSTITUTION} when blank
     */
    public String abbreviateInstitution(String institution) {
        if (institution == null || institution.isBlank()) {
            return UNKNOWN_INSTITUTION;
        }
        String clean = institution.trim();
        String known = KNOWN_ABBREVIATIONS.get(clean.toLowerCase(Locale.ROOT));
        if (known != null) {
            return known;
        }
        String initials = Arrays.stream(clean.toLowerCase(Locale.ROOT).split("\\s+"))
                .filter(word -> word.length() > 1 && !NON_SIGNIFICANT_WORDS.contains(word))
                .limit(4)
                .map(word -> word.substring(0, 1))
                .collect(Collectors.joining())
                .toUpperCase(Locale.ROOT);
        if (!initials.isEmpty()) {
            return initials;
        }
        return clean.substring(0, Math.min(3, clean.length())).toUpperCase(Locale.ROOT);
    }

    /**
     * @param documentNumber assigned document number
     * @param institution    institution name
     * @param accountNumber  account number, may be blank
     * @return display name {@code "{documentNumber} {abbreviation} {last four digits or XXXX}"}
     */
    public String displayName(String documentNumber, String institution, String accountNumber) {
        String lastFour = accountNumber == null || accountNumber.isBlank()
                ? "XXXX"
                : accountNumber.trim().substring(Math.max(0, accountNumber.trim().length() - 4));
        return documentNumber + " " + abbreviateInstitution(institution) + " " + lastFour;
    }

    private static boolean isTitle(String word) {
        return TITLES.contains(word.replace(".", "").replace(",", "").toLowerCase(Locale.ROOT));
    }

    private static String titleCase(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
