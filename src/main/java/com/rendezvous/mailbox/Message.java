package com.rendezvous.mailbox;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
    String side,
    String phase,
    String body,
    double serverRx,
    JsonNode id
) {}
