package com.tango.stream.raffle.restClients;

import com.tango.stream.raffle.model.KickChatMessage;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;

@FeignClient(name = "kick-chat", url = "${kick.public.api.url:https://api.kick.com}")
public interface KickChatMessageClient {
    @PostMapping(value = "/public/v1/chat", consumes = "application/json")
    void sendMessage(@RequestHeader("Authorization") String authorization, @RequestBody KickChatMessage message);
}
