package com.clientsync.model.source;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * A single typed property of a Notion page.
 *
 * Single-valued kinds (title, rich text, email, url, select) carry {@code text};
 * multi-select carries {@code options}. Use the factory methods rather than
 * the constructor so the pair stays consistent with the kind.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SourceProperty {

    String name;
    PropertyKind kind;
    String text;
    List<String> options;

    public static SourceProperty title(String name, String text) {
        return new SourceProperty(name, PropertyKind.TITLE, text, List.of());
    }

    public static SourceProperty richText(String name, String text) {
        return new SourceProperty(name, PropertyKind.RICH_TEXT, text, List.of());
    }

    public static SourceProperty email(String name, String email) {
        return new SourceProperty(name, PropertyKind.EMAIL, email, List.of());
    }

    public static SourceProperty url(String name, String url) {
        return new SourceProperty(name, PropertyKind.URL, url, List.of());
    }

    public static SourceProperty select(String name, String option) {
        return new SourceProperty(name, PropertyKind.SELECT, option, List.of());
    }

    public static SourceProperty multiSelect(String name, List<String> options) {
        return new SourceProperty(name, PropertyKind.MULTI_SELECT, null, List.copyOf(options));
    }

    public static SourceProperty other(String name) {
        return new SourceProperty(name, PropertyKind.OTHER, null, List.of());
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
