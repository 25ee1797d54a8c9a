package com.clientsync.model.dto;

import com.clientsync.model.entity.Client;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response of the manual single-record sync.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpsertResponse {
    private String action;
    private String matchedBy;
    private Client client;
}
