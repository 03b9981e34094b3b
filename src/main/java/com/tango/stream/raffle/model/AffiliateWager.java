package com.tango.stream.raffle.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One player row of the affiliate stats endpoint. {@code wagerAmount} is cumulative.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AffiliateWager {
    private String username;
    private String campaignCode;
    private BigDecimal wagerAmount;
}
