package io.shardsync.server.dto;

/**
 * JSON body for POST /events.
 * Example:
 *   {
 *     "subject": "shards/00000000-1fffffff/accounts.1700000000",
 *     "kind": "updated"
 *   }
 */
public class ChangeEventRequest {
    public String subject;
    public String kind; // created | updated | deleted
}
