package com.aki.script.parser;

/** Function modifiers written as {@code #weak}, {@code #sync}, {@code #own}, {@code #actor}. Parsed only. */
public enum Attribute {
    WEAK,
    SYNC,
    OWN,
    ACTOR
}
