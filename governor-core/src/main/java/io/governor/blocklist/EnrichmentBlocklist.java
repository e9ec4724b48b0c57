package io.governor.blocklist;

import io.governor.model.CatalogRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Names that can never be enriched (flights, mixed drinks, house specials).
 *
 * <p>A name is blocked if it equals an entry case-insensitively, or if any
 * pattern finds a match in it. Blocked records are marked {@code skipped} by the
 * sweep so they are never queried again.
 */
public final class EnrichmentBlocklist {

    static final List<String> DEFAULT_NAMES = List.of(
            "Black Velvet",
            "Build Your Flight",
            "Cheeky Monkey",
            "Chocolate Banana",
            "Dealer's Choice Flight",
            "Hop Head Flight",
            "Hummingbird H20",
            "Irish Car Bomb",
            "Michelada",
            "Texas Flight");

    static final List<String> DEFAULT_PATTERNS = List.of(
            "\\bflight\\b",
            "\\broot beer\\b",
            "\\bbeer and cheese\\b");

    private final Set<String> names;
    private final List<Pattern> patterns;

    private EnrichmentBlocklist(Builder builder) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String name : builder.names) {
            normalized.add(normalize(name));
        }
        this.names = Set.copyOf(normalized);
        List<Pattern> compiled = new ArrayList<>();
        for (String regex : builder.patterns) {
            compiled.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }
        this.patterns = List.copyOf(compiled);
    }

    /** The built-in names and patterns only. */
    public static EnrichmentBlocklist defaults() {
        return builder().build();
    }

    /** Starts from the built-in entries. */
    public static Builder builder() {
        return new Builder().names(DEFAULT_NAMES).patterns(DEFAULT_PATTERNS);
    }

    /** Starts from nothing. */
    public static Builder empty() {
        return new Builder();
    }

    public boolean isBlocked(String name) {
        if (name == null) {
            return false;
        }
        if (names.contains(normalize(name))) {
            return true;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(name).find()) {
                return true;
            }
        }
        return false;
    }

    public Partition partition(Collection<CatalogRecord> records) {
        List<CatalogRecord> eligible = new ArrayList<>();
        List<CatalogRecord> blocked = new ArrayList<>();
        for (CatalogRecord record : records) {
            if (isBlocked(record.name())) {
                blocked.add(record);
            } else {
                eligible.add(record);
            }
        }
        return new Partition(List.copyOf(eligible), List.copyOf(blocked));
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    /** Records split by blocklist membership, each list in input order. */
    public record Partition(List<CatalogRecord> eligible, List<CatalogRecord> blocked) {

        public List<String> blockedIds() {
            return blocked.stream().map(CatalogRecord::id).toList();
        }
    }

    /** Builder for {@link EnrichmentBlocklist}. */
    public static final class Builder {
        private final List<String> names = new ArrayList<>();
        private final List<String> patterns = new ArrayList<>();

        private Builder() {}

        public Builder name(String name) {
            names.add(Objects.requireNonNull(name, "name"));
            return this;
        }

        public Builder names(Collection<String> names) {
            names.forEach(this::name);
            return this;
        }

        /**
         * Adds a regular expression, matched case-insensitively anywhere in the name.
         *
         * @throws java.util.regex.PatternSyntaxException on {@link #build()} if invalid
         */
        public Builder pattern(String regex) {
            patterns.add(Objects.requireNonNull(regex, "regex"));
            return this;
        }

        public Builder patterns(Collection<String> patterns) {
            patterns.forEach(this::pattern);
            return this;
        }

        public EnrichmentBlocklist build() {
            return new EnrichmentBlocklist(this);
        }
    }
}
