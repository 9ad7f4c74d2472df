package com.smartbag.commerce.presentation.delivery.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignPartnerRequest {
    @JsonProperty("partner_id")
    private String partnerId;
}
