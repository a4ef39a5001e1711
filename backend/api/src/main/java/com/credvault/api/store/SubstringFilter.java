package com.credvault.api.store;

import static com.mongodb.client.model.Filters.or;
import static com.mongodb.client.model.Filters.regex;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.Getter;
import org.bson.conversions.Bson;

/**
 * Matches documents where at least one of the given fields contains a piece of text,
 * ignoring case. The text is quoted, so regex metacharacters in it match literally.
 */
@Getter
public class SubstringFilter implements DocumentFilter {

    private final String text;
    private final List<String> fields;
    private final Pattern pattern;

    private SubstringFilter(String text, List<String> fields) {
        this.text = text;
        this.fields = fields;
        this.pattern = Pattern.compile(
                Pattern.quote(text),
                Pattern.CASE_INSENSITIVE
        );
    }

    public static SubstringFilter anyOf(String text, String... fields) {
        if (text == null) {
            throw new IllegalArgumentException("Search text cannot be null");
        }
        if (fields.length == 0) {
            throw new IllegalArgumentException("At least one field is required");
        }
        return new SubstringFilter(text, List.of(fields));
    }

    @Override
    public Bson toBson() {
        List<Bson> clauses = fields.stream()
                .map(field -> regex(field, pattern))
                .collect(Collectors.toList());
        return or(clauses);
    }

    @Override
    public String toString() {
        return "SubstringFilter{text='" + text + "', fields=" + fields + "}";
    }
}
