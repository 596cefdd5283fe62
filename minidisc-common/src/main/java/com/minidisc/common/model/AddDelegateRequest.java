package com.minidisc.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

/**
 * POST /add-delegate 请求体
 */
@Getter
public final class AddDelegateRequest {

    private final AddrPort addrPort;

    @JsonCreator
    public AddDelegateRequest(@JsonProperty(value = "addrPort", required = true) AddrPort addrPort) {
        this.addrPort = addrPort;
    }
}
