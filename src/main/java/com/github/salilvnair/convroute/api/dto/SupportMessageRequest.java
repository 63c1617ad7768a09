package com.github.salilvnair.convroute.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

@Data
public class SupportMessageRequest {

    @JsonAlias("user_id")
    private String userId;
    @JsonAlias("content")
    private String message;
}
