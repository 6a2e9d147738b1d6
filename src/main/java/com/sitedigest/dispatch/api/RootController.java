package com.sitedigest.dispatch.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GET /: liveness banner for the API.
 */
@RestController
public class RootController {

    @GetMapping("/")
    public Map<String, String> root() {
        var body = new LinkedHashMap<String, String>();
        body.put("message", "Sitedigest API");
        body.put("status", "running");
        body.put("version", "0.1.0");
        return body;
    }
}
