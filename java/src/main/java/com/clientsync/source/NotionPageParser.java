package com.clientsync.source;

import com.clientsync.model.source.PropertyKind;
import com.clientsync.model.source.SourceProperty;
import com.clientsync.model.source.SourceRecord;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Turns Notion page and block JSON into the typed source model.
 */
@Slf4j
@Component
public class NotionPageParser {

    /**
     * Parse a page object. Returns null for anything that is not a page.
     */
    public SourceRecord parsePage(JsonNode page) {
        if (page == null || !"page".equals(page.path("object").asText())) {
            return null;
        }

        SourceRecord.SourceRecordBuilder builder = SourceRecord.builder()
                .id(page.path("id").asText())
                .lastModifiedAt(parseInstant(page.path("last_edited_time").asText(null)))
                .parentCollectionId(parentCollectionId(page.path("parent")))
                .archived(page.path("archived").asBoolean(false) || page.path("in_trash").asBoolean(false));

        Iterator<Map.Entry<String, JsonNode>> fields = page.path("properties").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            builder.property(field.getKey(), parseProperty(field.getKey(), field.getValue()));
        }
        return builder.build();
    }

    SourceProperty parseProperty(String name, JsonNode value) {
        PropertyKind kind = PropertyKind.fromNotionType(value.path("type").asText(null));
        switch (kind) {
            case TITLE:
                return SourceProperty.title(name, plainText(value.path("title")));
            case RICH_TEXT:
                return SourceProperty.richText(name, plainText(value.path("rich_text")));
            case EMAIL:
                return SourceProperty.email(name, value.path("email").asText(null));
            case URL:
                return SourceProperty.url(name, value.path("url").asText(null));
            case SELECT:
                return SourceProperty.select(name, value.path("select").path("name").asText(null));
            case MULTI_SELECT:
                List<String> options = new ArrayList<>();
                for (JsonNode option : value.path("multi_select")) {
                    String optionName = option.path("name").asText(null);
                    if (optionName != null) {
                        options.add(optionName);
                    }
                }
                return SourceProperty.multiSelect(name, options);
            default:
                return SourceProperty.other(name);
        }
    }

    /**
     * Text of one block; unsupported block types yield an empty string.
     */
    public String blockToText(JsonNode block) {
        String type = block.path("type").asText("");
        JsonNode data = block.path(type);
        if (type.isEmpty() || data.isMissingNode()) {
            return "";
        }

        switch (type) {
            case "paragraph":
            case "heading_1":
            case "heading_2":
            case "heading_3":
            case "bulleted_list_item":
            case "numbered_list_item":
            case "code":
                return plainText(data.path("rich_text"));
            case "quote":
                return "\"" + plainText(data.path("rich_text")) + "\"";
            default:
                return "";
        }
    }

    String plainText(JsonNode richText) {
        StringBuilder text = new StringBuilder();
        for (JsonNode fragment : richText) {
            text.append(fragment.path("plain_text").asText(""));
        }
        return text.toString();
    }

    private String parentCollectionId(JsonNode parent) {
        if (parent.hasNonNull("database_id")) {
            return parent.get("database_id").asText();
        }
        if (parent.hasNonNull("data_source_id")) {
            return parent.get("data_source_id").asText();
        }
        return null;
    }

    private Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable last_edited_time '{}'", value);
            return null;
        }
    }
}
