package com.tango.stream.raffle.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class KickChatMessage {
    @JsonProperty("broadcaster_user_id")
    private Long broadcasterUserId;
    private String content;
    private String type;
}
