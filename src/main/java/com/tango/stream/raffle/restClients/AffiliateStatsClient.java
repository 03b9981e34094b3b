package com.tango.stream.raffle.restClients;

import com.tango.stream.raffle.model.AffiliateWager;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;

import java.net.URI;
import java.util.List;

/**
 * Affiliate stats of a gambling platform. Every tenant has its own endpoint, passed as {@code affiliateUrl}.
 */
@FeignClient(name = "wager-affiliate", url = "${wager.affiliate.url:https://affiliate.invalid}")
public interface AffiliateStatsClient {
    @GetMapping
    List<AffiliateWager> getWagers(URI affiliateUrl);
}
