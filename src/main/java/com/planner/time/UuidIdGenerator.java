package com.planner.time;

import java.util.UUID;

/**
 * Random UUID identifiers.
 */
public class UuidIdGenerator implements IdGenerator {

    @Override
    public String newId() {
        return UUID.randomUUID().toString();
    }
}
