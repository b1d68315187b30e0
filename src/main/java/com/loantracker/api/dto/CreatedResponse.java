package com.loantracker.api.dto;

import lombok.Value;

/**
 * Response body for every create operation.
 */
@Value
public class CreatedResponse {
    String id;
}
