package com.tango.stream.raffle.restClients;

import com.tango.stream.raffle.model.KickChannel;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

@FeignClient(name = "kick-channels", url = "${kick.api.url:https://kick.com}")
public interface KickChannelClient {
    @GetMapping("/api/v2/channels/{slug}")
    KickChannel getChannel(@PathVariable("slug") String slug);
}
