package com.clientsync.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Client entity: one row of the canonical client registry.
 *
 * The slug is assigned once when the row is created and is never rewritten,
 * even when the display name changes in Notion.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("clients")
public class Client {

    @Id
    private UUID id;

    @Column("name")
    private String name;

    @Column("slug")
    private String slug;

    @Column("contact_email")
    private String contactEmail;

    @Column("products_services")
    private String productsServices;

    @Column("client_page_info")
    private String pageInfo;

    // Notion page id; also mirrored into metadata for older readers
    @Column("source_record_id")
    private String sourceRecordId;

    @Column("metadata")
    private String metadata; // JSON string

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;
}
