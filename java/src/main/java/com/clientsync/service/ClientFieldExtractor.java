package com.clientsync.service;

import com.clientsync.model.source.PropertyKind;
import com.clientsync.model.source.SourceProperty;
import com.clientsync.model.source.SourceRecord;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the client fields out of a source record's typed properties.
 *
 * Property names are not fixed in the Notion database, so each field is found
 * by kind, first property of that kind in page order.
 */
@Component
public class ClientFieldExtractor {

    private static final Pattern EMAIL = Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");
    private static final String MAILTO = "mailto:";

    /**
     * The title text, else the first non-blank rich text. Null when neither exists.
     */
    public String extractName(SourceRecord record) {
        Collection<SourceProperty> properties = record.getProperties().values();
        return firstText(properties, PropertyKind.TITLE)
                .or(() -> firstText(properties, PropertyKind.RICH_TEXT))
                .map(String::trim)
                .orElse(null);
    }

    public String extractContactEmail(SourceRecord record) {
        Collection<SourceProperty> properties = record.getProperties().values();

        Optional<String> email = firstText(properties, PropertyKind.EMAIL);
        if (email.isPresent()) {
            return email.get().trim();
        }

        for (SourceProperty property : properties) {
            if (property.getKind() == PropertyKind.RICH_TEXT && property.hasText()) {
                Matcher matcher = EMAIL.matcher(property.getText());
                if (matcher.find()) {
                    return matcher.group();
                }
            }
        }

        for (SourceProperty property : properties) {
            if (property.getKind() == PropertyKind.URL && property.hasText()
                    && property.getText().startsWith(MAILTO)) {
                return property.getText().substring(MAILTO.length());
            }
        }
        return null;
    }

    /**
     * Multi-select options joined with ", ", else the select option, else the first rich text.
     */
    public String extractProductsServices(SourceRecord record) {
        Collection<SourceProperty> properties = record.getProperties().values();

        for (SourceProperty property : properties) {
            if (property.getKind() == PropertyKind.MULTI_SELECT && !property.getOptions().isEmpty()) {
                return String.join(", ", property.getOptions());
            }
        }
        return firstText(properties, PropertyKind.SELECT)
                .or(() -> firstText(properties, PropertyKind.RICH_TEXT).map(String::trim))
                .orElse(null);
    }

    private Optional<String> firstText(Collection<SourceProperty> properties, PropertyKind kind) {
        return properties.stream()
                .filter(property -> property.getKind() == kind && property.hasText())
                .map(SourceProperty::getText)
                .findFirst();
    }
}
