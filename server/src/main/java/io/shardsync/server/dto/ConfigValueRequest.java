package io.shardsync.server.dto;

/**
 * JSON body for PUT /admin/config/{key}.
 * Example:
 *   { "value": "250" }
 */
public class ConfigValueRequest {
    public String value; // raw string; validated by the reconfiguration handler
}
