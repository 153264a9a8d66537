package com.example.fbp.engine;

import com.example.fbp.exception.InvalidInputException;

import java.util.Locale;

public enum PhantomKind {
    DISC,
    SQUARE,
    HEAD_PHANTOM,
    RANDOM_BLOBS;

    public static PhantomKind fromName(String name) {
        InvalidInputException.require(name != null && !name.isBlank(), "Phantom kind is empty");
        String key = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        switch (key) {
            case "CIRCLE":
                return DISC;
            case "SHEPP_LOGAN":
                return HEAD_PHANTOM;
            case "CUSTOM":
                return RANDOM_BLOBS;
            default:
                try {
                    return valueOf(key);
                } catch (IllegalArgumentException e) {
                    throw new InvalidInputException("Unknown phantom kind: " + name);
                }
        }
    }
}
