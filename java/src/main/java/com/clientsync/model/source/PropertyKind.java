package com.clientsync.model.source;

/**
 * Property types the sync engine understands. Everything else maps to OTHER.
 */
public enum PropertyKind {
    TITLE,
    RICH_TEXT,
    EMAIL,
    URL,
    SELECT,
    MULTI_SELECT,
    OTHER;

    public static PropertyKind fromNotionType(String type) {
        if (type == null) {
            return OTHER;
        }
        switch (type) {
            case "title":
                return TITLE;
            case "rich_text":
                return RICH_TEXT;
            case "email":
                return EMAIL;
            case "url":
                return URL;
            case "select":
                return SELECT;
            case "multi_select":
                return MULTI_SELECT;
            default:
                return OTHER;
        }
    }
}
