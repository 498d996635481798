package com.itembank.tos.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "itembank")
public record ItemBankProperties(
        @DefaultValue Similarity similarity,
        @DefaultValue Review review,
        @DefaultValue Recommendations recommendations
) {

    public record Similarity(@DefaultValue("0.7") double defaultThreshold,
                             @DefaultValue("10") int maxResults) {}

    public record Review(@DefaultValue("0.9") double autoApproveThreshold) {}

    public record Recommendations(@DefaultValue("3") int failingCells,
                                  @DefaultValue("2") int warningCells) {}
}
