package com.payerdesk.chatbot.service.state;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
@EnableConfigurationProperties(PayerProperties.class)
public class PayerDirectory {

    private static final Pattern GENERIC_PAYER = Pattern.compile(
            "\\b((?:[A-Z][A-Za-z&'.-]*\\s+){1,4})(Health Plan|Healthcare|Health|Insurance)\\b");

    /**
     * Capitalised words right after a self-introduction are a person's name, never a payer.
     */
    private static final Pattern SELF_INTRODUCTION = Pattern.compile(
            "(?i:\\b(?:my name is|my name's|patient name is|patient's name is|name:))\\s+((?:[A-Z][A-Za-z'.-]*\\s*){1,4})");

    private static final Set<String> LEADING_STOPWORDS = Set.of(
            "what", "how", "is", "does", "do", "can", "for", "with", "the", "my", "our", "which", "where",
            "when", "who", "i", "are", "should", "about", "and", "or", "in", "at", "to", "a", "an", "also");

    private final List<NamedPattern> knownPayers;
    private final Map<String, String> aliasToCanonical;

    public PayerDirectory(PayerProperties properties) {
        this.knownPayers = properties.getNames().stream()
                .filter(name -> name != null && !name.isBlank())
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(name -> new NamedPattern(name.trim(), Pattern.compile("\\b" + Pattern.quote(name.trim()) + "\\b", Pattern.CASE_INSENSITIVE)))
                .toList();
        Map<String, String> aliases = new HashMap<>();
        properties.getAliases().forEach((alias, canonical) -> {
            if (alias != null && canonical != null && !canonical.isBlank()) {
                aliases.put(alias.trim().toLowerCase(Locale.ROOT), canonical.trim());
                aliases.put(canonical.trim().toLowerCase(Locale.ROOT), canonical.trim());
            }
        });
        this.aliasToCanonical = Map.copyOf(aliases);
    }

    /**
     * All payers mentioned in the text, in order of appearance, without overlapping matches.
     */
    public List<String> detectAll(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Match> matches = new ArrayList<>();
        for (NamedPattern payer : knownPayers) {
            Matcher matcher = payer.pattern().matcher(text);
            while (matcher.find()) {
                addIfFree(matches, new Match(matcher.start(), matcher.end(), payer.name()));
            }
        }
        List<Match> names = new ArrayList<>();
        Matcher introduction = SELF_INTRODUCTION.matcher(text);
        while (introduction.find()) {
            names.add(new Match(introduction.start(1), introduction.end(1), introduction.group(1)));
        }
        Matcher generic = GENERIC_PAYER.matcher(text);
        while (generic.find()) {
            String name = stripLeadingStopwords(generic.group(1));
            if (name.isEmpty()) {
                continue;
            }
            String full = name + " " + generic.group(2);
            int start = generic.end() - full.length();
            Match candidate = new Match(start, generic.end(), full);
            if (names.stream().noneMatch(candidate::overlaps)) {
                addIfFree(matches, candidate);
            }
        }
        matches.sort(Comparator.comparingInt(Match::start));
        List<String> result = new ArrayList<>();
        for (Match match : matches) {
            if (result.stream().noneMatch(existing -> existing.equalsIgnoreCase(match.name()))) {
                result.add(match.name());
            }
        }
        return List.copyOf(result);
    }

    public boolean mentionsPayer(String text) {
        return !detectAll(text).isEmpty();
    }

    public String canonicalize(String payer) {
        if (payer == null || payer.isBlank()) {
            return null;
        }
        return aliasToCanonical.getOrDefault(payer.trim().toLowerCase(Locale.ROOT), payer.trim());
    }

    private String stripLeadingStopwords(String words) {
        String[] tokens = words.trim().split("\\s+");
        int first = 0;
        while (first < tokens.length && LEADING_STOPWORDS.contains(tokens[first].toLowerCase(Locale.ROOT))) {
            first++;
        }
        return String.join(" ", Arrays.copyOfRange(tokens, first, tokens.length));
    }

    private static void addIfFree(List<Match> matches, Match candidate) {
        if (matches.stream().noneMatch(candidate::overlaps)) {
            matches.add(candidate);
        }
    }

    private record NamedPattern(String name, Pattern pattern) {
    }

    private record Match(int start, int end, String name) {

        boolean overlaps(Match other) {
            return start < other.end() && other.start() < end;
        }
    }
}
