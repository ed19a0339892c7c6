package com.whereq.scribe.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionTestResponse {

    private boolean connected;

    /**
     * Authenticated WordPress user
     */
    private String user;

    private String message;
}
