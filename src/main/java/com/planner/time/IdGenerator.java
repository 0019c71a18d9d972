package com.planner.time;

/**
 * Source of opaque, unique task identifiers.
 */
@FunctionalInterface
public interface IdGenerator {

    String newId();
}
