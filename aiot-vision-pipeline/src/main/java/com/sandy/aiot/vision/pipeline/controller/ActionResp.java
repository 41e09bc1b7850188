package com.sandy.aiot.vision.pipeline.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * Outcome of an operator action. Failures are reported with HTTP 200 and {@code success=false}.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActionResp {
    private boolean success;
    private String message;
    private Object data;

    public static ActionResp ok() { ActionResp r = new ActionResp(); r.success = true; return r; }
    public static ActionResp ok(Object data) { ActionResp r = ok(); r.data = data; return r; }
    public static ActionResp fail(String msg) { ActionResp r = new ActionResp(); r.success = false; r.message = msg; return r; }
}
