package com.whereq.scribe.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SitemapRequest {

    @NotBlank
    @Pattern(regexp = "https?://\\S+", message = "sitemapUrl must be an absolute http(s) URL")
    private String sitemapUrl;
}
