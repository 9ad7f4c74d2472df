package com.smartbag.commerce.domain.order;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 배송지
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryAddress {

    private String recipient;
    private String phone;
    private String street;
    private String city;
    private String postalCode;
    private Double latitude;
    private Double longitude;

    /**
     * 배송 가능한 주소인지 여부: 도로명+도시, 또는 좌표가 있어야 한다
     */
    public boolean isResolvable() {
        boolean hasStreet = street != null && !street.isBlank() && city != null && !city.isBlank();
        boolean hasCoordinates = latitude != null && longitude != null
                && Math.abs(latitude) <= 90 && Math.abs(longitude) <= 180;
        return hasStreet || hasCoordinates;
    }
}
