package com.bit.politeia.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PluginCommandReply {
    private String id;
    private String command;
    @JsonProperty("commandid")
    private String commandId;
    private String payload;
}
