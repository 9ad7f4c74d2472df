package com.smartbag.commerce.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusChangeResponse {
    @JsonProperty("status")
    private String status;

    @JsonProperty("changed_at")
    private LocalDateTime changedAt;

    @JsonProperty("changed_by")
    private String changedBy;

    @JsonProperty("partner_id")
    private String partnerId;

    @JsonProperty("message")
    private String message;
}
